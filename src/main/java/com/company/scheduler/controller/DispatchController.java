package com.company.scheduler.controller;

import com.company.scheduler.dto.response.DispatchPassResponse;
import com.company.scheduler.service.DispatchPass;
import com.company.scheduler.service.JobDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/v1/dispatch")
@Tag(name = "Dispatch", description = "Manual dispatch passes")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class DispatchController {

    private final JobDispatcher jobDispatcher;

    @PostMapping("/run")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Run a dispatch pass now",
            description = "Returns once jobs are launched, or after they finish when await=true")
    public ResponseEntity<DispatchPassResponse> run(@RequestParam(defaultValue = "false") boolean await) {
        DispatchPass pass = jobDispatcher.runPass();
        log.info("Manual dispatch pass {} requested (await={})", pass.getPassId(), await);

        DispatchPassResponse.DispatchPassResponseBuilder response = DispatchPassResponse.builder()
                .passId(pass.getPassId())
                .startedAt(pass.getStartedAt())
                .dueCount(pass.getDueCount())
                .launchedCount(pass.getLaunchedCount())
                .skippedCount(pass.getSkippedCount());

        if (await) {
            Map<String, Long> outcomes = new TreeMap<>();
            pass.awaitOutcomes().forEach((outcome, count) -> outcomes.put(outcome.name(), count));
            response.outcomes(outcomes);
        }
        return ResponseEntity.ok(response.build());
    }
}
