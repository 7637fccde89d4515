package com.company.scheduler.controller;

import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.dto.request.CancelJobRequest;
import com.company.scheduler.dto.request.ScheduleJobRequest;
import com.company.scheduler.dto.request.SendNowRequest;
import com.company.scheduler.dto.response.CancelJobResponse;
import com.company.scheduler.dto.response.PendingJobSummary;
import com.company.scheduler.dto.response.PendingJobsResponse;
import com.company.scheduler.dto.response.ScheduleJobResponse;
import com.company.scheduler.service.JobSchedulingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Scheduled Jobs", description = "Enqueue, send, list and cancel scheduled messages")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ScheduledJobController {

    private final JobSchedulingService schedulingService;

    @PostMapping
    @PreAuthorize("hasAnyRole('SCHEDULER_CLIENT', 'ADMIN')")
    @Operation(summary = "Schedule a job",
            description = "Stores a manual or autoSummary job. autoSummary jobs take their first send time from the owner's schedule when one is configured.")
    public ResponseEntity<ScheduleJobResponse> schedule(@Valid @RequestBody ScheduleJobRequest request) {
        ScheduledJob job = schedulingService.enqueue(request);

        return ResponseEntity
                .created(URI.create("/api/v1/jobs/" + job.getId()))
                .body(ScheduleJobResponse.builder()
                        .success(true)
                        .id(job.getId())
                        .sendAt(job.getSendAt())
                        .build());
    }

    @PostMapping("/send-now")
    @PreAuthorize("hasAnyRole('SCHEDULER_CLIENT', 'ADMIN')")
    @Operation(summary = "Send a message immediately without storing it")
    public ResponseEntity<Map<String, Object>> sendNow(@Valid @RequestBody SendNowRequest request) {
        schedulingService.sendNow(request);
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('SCHEDULER_CLIENT', 'ADMIN')")
    @Operation(summary = "List an owner's pending jobs", description = "Sorted by send time, then id")
    public ResponseEntity<PendingJobsResponse> listPending(@RequestParam(required = false) String ownerId) {
        List<PendingJobSummary> jobs = schedulingService.listPending(ownerId).stream()
                .map(PendingJobSummary::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(PendingJobsResponse.builder()
                .success(true)
                .jobs(jobs)
                .build());
    }

    @PostMapping("/cancel")
    @PreAuthorize("hasAnyRole('SCHEDULER_CLIENT', 'ADMIN')")
    @Operation(summary = "Cancel a job owned by the caller")
    public ResponseEntity<CancelJobResponse> cancel(@Valid @RequestBody CancelJobRequest request) {
        return ResponseEntity.ok(cancelResponse(request.getOwnerId(), request.getId()));
    }

    @DeleteMapping("/{jobId}")
    @PreAuthorize("hasAnyRole('SCHEDULER_CLIENT', 'ADMIN')")
    @Operation(summary = "Cancel a job owned by the caller")
    public ResponseEntity<CancelJobResponse> delete(@PathVariable String jobId,
                                                    @RequestParam(required = false) String ownerId) {
        return ResponseEntity.ok(cancelResponse(ownerId, jobId));
    }

    private CancelJobResponse cancelResponse(String ownerId, String jobId) {
        boolean cancelled = schedulingService.cancel(ownerId, jobId);
        log.debug("Cancel request for job {} by owner {}: cancelled={}", jobId, ownerId, cancelled);
        return CancelJobResponse.builder()
                .success(true)
                .cancelled(cancelled)
                .build();
    }
}
