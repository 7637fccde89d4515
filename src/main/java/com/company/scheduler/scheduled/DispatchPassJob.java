package com.company.scheduler.scheduled;

import com.company.scheduler.service.DispatchPass;
import com.company.scheduler.service.JobDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger for dispatch passes. Each tick launches one pass and returns;
 * jobs still in flight from an earlier tick are skipped by the dispatcher.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "scheduler.dispatch.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class DispatchPassJob {

    private final JobDispatcher jobDispatcher;

    @Scheduled(fixedDelayString = "${scheduler.dispatch.fixed-delay-ms:60000}",
            initialDelayString = "${scheduler.dispatch.initial-delay-ms:10000}")
    public void trigger() {
        log.debug("Dispatch tick");
        DispatchPass pass = jobDispatcher.runPass();
        pass.getCompletion().whenComplete((outcomes, error) -> {
            if (error != null) {
                log.error("Dispatch pass {} ended with an unexpected task failure", pass.getPassId(), error);
            }
        });
    }
}
