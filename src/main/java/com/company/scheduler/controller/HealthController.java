package com.company.scheduler.controller;

import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.exception.JobStoreException;
import com.company.scheduler.repository.ScheduledJobRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final ScheduledJobRepository jobRepository;
    private final SchedulerProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Reports job store reachability and the pending job count")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "summary-scheduler-service");
        response.put("timestamp", Instant.now());
        response.put("dispatchEnabled", properties.getDispatch().isEnabled());

        try {
            response.put("pendingJobs", jobRepository.countPending());
            response.put("status", "UP");
            return ResponseEntity.ok(response);
        } catch (JobStoreException e) {
            log.warn("Health check could not reach the job store: {}", e.getMessage());
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
