package com.company.scheduler.service;

import com.company.scheduler.client.DeliveryClient;
import com.company.scheduler.client.OutboundMessage;
import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.domain.enums.MarkOutcomeResult;
import com.company.scheduler.exception.JobStoreException;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.company.scheduler.repository.ScheduledJobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs dispatch passes: loads due jobs, then delivers each one on the dispatch
 * executor and records its next state with a conditional update.
 */
@Service
@Slf4j
public class JobDispatcher {

    private final ScheduledJobRepository jobRepository;
    private final AutoSummaryService autoSummaryService;
    private final DeliveryClient deliveryClient;
    private final OwnerScheduleService ownerScheduleService;
    private final DispatchRetryPolicy retryPolicy;
    private final Executor dispatchExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /** Occurrences ({@code id@sendAt}) queued or running in this process. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobDispatcher(ScheduledJobRepository jobRepository,
                         AutoSummaryService autoSummaryService,
                         DeliveryClient deliveryClient,
                         OwnerScheduleService ownerScheduleService,
                         DispatchRetryPolicy retryPolicy,
                         @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.jobRepository = jobRepository;
        this.autoSummaryService = autoSummaryService;
        this.deliveryClient = deliveryClient;
        this.ownerScheduleService = ownerScheduleService;
        this.retryPolicy = retryPolicy;
        this.dispatchExecutor = dispatchExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Launches one task per due job and returns without waiting for them.
     * Jobs still queued or running from an earlier pass are skipped.
     * Never throws; a store failure while listing yields an empty pass.
     */
    public DispatchPass runPass() {
        String passId = UUID.randomUUID().toString().substring(0, 8);
        Instant now = clock.instant();

        List<ScheduledJob> due;
        try {
            due = jobRepository.findDue(now);
        } catch (JobStoreException e) {
            log.error("Dispatch pass {} could not list due jobs", passId, e);
            meterRegistry.counter("scheduler.passes.failed").increment();
            return DispatchPass.empty(passId, now);
        }

        List<CompletableFuture<DispatchOutcome>> tasks = new ArrayList<>();
        int skipped = 0;
        for (ScheduledJob job : due) {
            if (retryPolicy.isInBackoff(job, now)) {
                log.debug("Job {} is backing off after {} failure(s)", job.getId(), job.getFailureCount());
                skipped++;
                continue;
            }
            String key = inFlightKey(job);
            if (!inFlight.add(key)) {
                log.debug("Job {} at {} is still being dispatched by an earlier pass", job.getId(), job.getSendAt());
                skipped++;
                continue;
            }
            try {
                tasks.add(CompletableFuture.supplyAsync(() -> dispatchInContext(passId, job, now), dispatchExecutor));
            } catch (RejectedExecutionException e) {
                inFlight.remove(key);
                log.warn("Dispatch executor rejected job {}: {}", job.getId(), e.getMessage());
                skipped++;
            }
        }

        meterRegistry.counter("scheduler.passes.run").increment();
        if (!due.isEmpty()) {
            log.info("Dispatch pass {} launched {} job(s), {} due, {} skipped",
                    passId, tasks.size(), due.size(), skipped);
        }

        CompletableFuture<List<DispatchOutcome>> completion =
                CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                        .thenApply(ignored -> tasks.stream()
                                .map(CompletableFuture::join)
                                .collect(Collectors.toList()));

        return new DispatchPass(passId, now, due.size(), tasks.size(), skipped, completion);
    }

    private DispatchOutcome dispatchInContext(String passId, ScheduledJob job, Instant passStart) {
        MDC.put("passId", passId);
        MDC.put("jobId", job.getId());
        try {
            return dispatch(job, passStart);
        } finally {
            inFlight.remove(inFlightKey(job));
            MDC.remove("jobId");
            MDC.remove("passId");
        }
    }

    private static String inFlightKey(ScheduledJob job) {
        return job.getId() + "@" + job.getSendAt().toEpochMilli();
    }

    /**
     * Delivers a single due job and persists its next state.
     */
    DispatchOutcome dispatch(ScheduledJob job, Instant passStart) {
        try {
            ScheduledJob toSend = job.isAutoSummary() ? autoSummaryService.prepare(job) : job;
            deliveryClient.deliver(toOutboundMessage(toSend));
        } catch (RuntimeException e) {
            return handleDeliveryFailure(job, e);
        }

        Optional<Instant> nextSendAt = resolveNextSendAt(job, passStart);
        boolean sent = nextSendAt.isEmpty();

        MarkOutcomeResult result;
        try {
            result = jobRepository.markOutcome(job.getId(), job.getSendAt(), sent, nextSendAt.orElse(null));
        } catch (JobStoreException e) {
            log.error("Delivered job {} but failed to record its outcome", job.getId(), e);
            meterRegistry.counter("scheduler.jobs.store_errors").increment();
            return DispatchOutcome.STORE_ERROR;
        }

        if (!result.isApplied()) {
            log.debug("Job {} at {} was already claimed by another pass", job.getId(), job.getSendAt());
            meterRegistry.counter("scheduler.jobs.conflicts").increment();
            return DispatchOutcome.CONFLICT;
        }

        meterRegistry.counter("scheduler.jobs.delivered", "mode", job.getMode().getCode()).increment();
        if (sent) {
            log.info("Job {} delivered and marked sent", job.getId());
            return DispatchOutcome.SENT;
        }
        log.info("Job {} delivered, next occurrence at {}", job.getId(), nextSendAt.get());
        return DispatchOutcome.RESCHEDULED;
    }

    /**
     * Next send time for recurring jobs; empty means the job is finished.
     * A schedule that cannot be fetched also finishes the job.
     */
    Optional<Instant> resolveNextSendAt(ScheduledJob job, Instant passStart) {
        boolean followsSchedule = job.isAutoSummary() || job.isRecurring();
        if (!followsSchedule || !job.hasOwner()) {
            return Optional.empty();
        }
        try {
            return ownerScheduleService.nextOccurrence(job.getOwnerId(), passStart);
        } catch (UpstreamUnavailableException e) {
            log.warn("Schedule for owner {} unavailable, finishing job {}: {}",
                    job.getOwnerId(), job.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private DispatchOutcome handleDeliveryFailure(ScheduledJob job, RuntimeException failure) {
        Instant attemptedAt = clock.instant();
        int attempts = job.getFailureCount() + 1;
        String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();

        log.error("Failed to deliver job {} (attempt {}): {}", job.getId(), attempts, error, failure);
        meterRegistry.counter("scheduler.jobs.delivery_failures", "mode", job.getMode().getCode()).increment();

        try {
            if (retryPolicy.isLimitReached(attempts)) {
                MarkOutcomeResult result = jobRepository.markFailed(job.getId(), job.getSendAt(), error, attemptedAt);
                if (result.isApplied()) {
                    log.warn("Job {} reached its attempt limit and was marked failed", job.getId());
                    return DispatchOutcome.FAILED_TERMINAL;
                }
                return DispatchOutcome.CONFLICT;
            }
            jobRepository.recordDeliveryFailure(job.getId(), job.getSendAt(), error, attemptedAt);
        } catch (JobStoreException e) {
            log.error("Failed to record delivery failure for job {}", job.getId(), e);
            return DispatchOutcome.STORE_ERROR;
        }
        return DispatchOutcome.DELIVERY_FAILED;
    }

    private static OutboundMessage toOutboundMessage(ScheduledJob job) {
        return OutboundMessage.builder()
                .fromName(job.getFromName())
                .recipients(job.getRecipients())
                .subject(job.getSubject())
                .plainTextBody(job.getBody())
                .htmlBody(job.getBodyHtml())
                .build();
    }
}
