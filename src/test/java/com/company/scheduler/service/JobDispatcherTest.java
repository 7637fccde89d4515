package com.company.scheduler.service;

import com.company.scheduler.client.DeliveryClient;
import com.company.scheduler.client.OutboundMessage;
import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.ScheduledJob;
import com.company.scheduler.domain.enums.JobMode;
import com.company.scheduler.domain.enums.MarkOutcomeResult;
import com.company.scheduler.exception.DeliveryException;
import com.company.scheduler.exception.JobStoreException;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.company.scheduler.repository.ScheduledJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");
    private static final Instant DUE_AT = Instant.parse("2024-05-15T11:59:00Z");
    private static final Instant NEXT = Instant.parse("2024-05-20T08:00:00Z");

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private AutoSummaryService autoSummaryService;

    @Mock
    private DeliveryClient deliveryClient;

    @Mock
    private OwnerScheduleService ownerScheduleService;

    private SchedulerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        meterRegistry = new SimpleMeterRegistry();
        Executor direct = Runnable::run;
        dispatcher = new JobDispatcher(
                jobRepository,
                autoSummaryService,
                deliveryClient,
                ownerScheduleService,
                new DispatchRetryPolicy(properties),
                direct,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ScheduledJob manualJob() {
        return ScheduledJob.builder()
                .id("job_manual")
                .ownerId("owner-1")
                .recipients(List.of("a@example.com"))
                .subject("Hello")
                .body("Body")
                .sendAt(DUE_AT)
                .build();
    }

    private static ScheduledJob autoJob() {
        return manualJob().toBuilder()
                .id("job_auto")
                .mode(JobMode.AUTO_SUMMARY)
                .build();
    }

    @Test
    @DisplayName("One-shot manual job is delivered and marked sent")
    void oneShotJobShouldBeMarkedSent() {
        ScheduledJob job = manualJob();
        when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

        DispatchOutcome outcome = dispatcher.dispatch(job, NOW);

        assertThat(outcome).isEqualTo(DispatchOutcome.SENT);
        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(deliveryClient).deliver(message.capture());
        assertThat(message.getValue().getSubject()).isEqualTo("Hello");
        assertThat(message.getValue().getPlainTextBody()).isEqualTo("Body");
        verifyNoInteractions(ownerScheduleService, autoSummaryService);
        assertThat(meterRegistry.counter("scheduler.jobs.delivered", "mode", "manual").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Recurring manual job moves to the next occurrence")
    void recurringJobShouldBeRescheduled() {
        ScheduledJob job = manualJob().toBuilder().recurring(true).build();
        when(ownerScheduleService.nextOccurrence("owner-1", NOW)).thenReturn(Optional.of(NEXT));
        when(jobRepository.markOutcome("job_manual", DUE_AT, false, NEXT)).thenReturn(MarkOutcomeResult.APPLIED);

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.RESCHEDULED);
    }

    @Test
    @DisplayName("Auto summary job sends regenerated content and follows the schedule")
    void autoSummaryJobShouldSendPreparedContent() {
        ScheduledJob job = autoJob();
        when(autoSummaryService.prepare(job)).thenReturn(job.withContent("fresh", "<p>fresh</p>"));
        when(ownerScheduleService.nextOccurrence("owner-1", NOW)).thenReturn(Optional.of(NEXT));
        when(jobRepository.markOutcome("job_auto", DUE_AT, false, NEXT)).thenReturn(MarkOutcomeResult.APPLIED);

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.RESCHEDULED);

        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(deliveryClient).deliver(message.capture());
        assertThat(message.getValue().getPlainTextBody()).isEqualTo("fresh");
        assertThat(message.getValue().getHtmlBody()).isEqualTo("<p>fresh</p>");
    }

    @Test
    @DisplayName("Exhausted schedule finishes an auto summary job")
    void exhaustedScheduleShouldFinishJob() {
        ScheduledJob job = autoJob();
        when(autoSummaryService.prepare(job)).thenReturn(job);
        when(ownerScheduleService.nextOccurrence("owner-1", NOW)).thenReturn(Optional.empty());
        when(jobRepository.markOutcome("job_auto", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.SENT);
    }

    @Test
    @DisplayName("Unreachable schedule finishes the job after delivery")
    void unreachableScheduleShouldFinishJob() {
        ScheduledJob job = manualJob().toBuilder().recurring(true).build();
        when(ownerScheduleService.nextOccurrence("owner-1", NOW))
                .thenThrow(new UpstreamUnavailableException("settings timeout"));
        when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.SENT);
    }

    @Test
    @DisplayName("Recurring job without owner is treated as one-shot")
    void recurringJobWithoutOwnerShouldFinish() {
        ScheduledJob job = manualJob().toBuilder().ownerId(null).recurring(true).build();

        assertThat(dispatcher.resolveNextSendAt(job, NOW)).isEmpty();
        verifyNoInteractions(ownerScheduleService);
    }

    @Test
    @DisplayName("Delivery failure leaves the job due and records the error")
    void deliveryFailureShouldKeepJobPending() {
        ScheduledJob job = manualJob();
        doThrow(new DeliveryException("Delivery rejected: status 502"))
                .when(deliveryClient).deliver(any());

        DispatchOutcome outcome = dispatcher.dispatch(job, NOW);

        assertThat(outcome).isEqualTo(DispatchOutcome.DELIVERY_FAILED);
        verify(jobRepository).recordDeliveryFailure("job_manual", DUE_AT, "Delivery rejected: status 502", NOW);
        verify(jobRepository, never()).markOutcome(any(), any(), anyBoolean(), any());
        assertThat(meterRegistry.counter("scheduler.jobs.delivery_failures", "mode", "manual").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Failed content preparation counts as a delivery failure")
    void preparationFailureShouldNotDeliver() {
        ScheduledJob job = autoJob();
        when(autoSummaryService.prepare(job)).thenThrow(new IllegalStateException("boom"));

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.DELIVERY_FAILED);
        verifyNoInteractions(deliveryClient);
    }

    @Test
    @DisplayName("Attempt limit marks the job failed")
    void attemptLimitShouldMarkJobFailed() {
        properties.getRetry().setMaxAttempts(3);
        ScheduledJob job = manualJob().toBuilder().failureCount(2).build();
        doThrow(new DeliveryException("down")).when(deliveryClient).deliver(any());
        when(jobRepository.markFailed("job_manual", DUE_AT, "down", NOW)).thenReturn(MarkOutcomeResult.APPLIED);

        assertThat(dispatcher.dispatch(job, NOW)).isEqualTo(DispatchOutcome.FAILED_TERMINAL);
        verify(jobRepository, never()).recordDeliveryFailure(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Losing the claim is reported as a conflict")
    void lostClaimShouldBeConflict() {
        when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.CONFLICT);

        assertThat(dispatcher.dispatch(manualJob(), NOW)).isEqualTo(DispatchOutcome.CONFLICT);
        assertThat(meterRegistry.counter("scheduler.jobs.conflicts").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Store failure after delivery is contained")
    void storeFailureAfterDeliveryShouldBeContained() {
        when(jobRepository.markOutcome(eq("job_manual"), eq(DUE_AT), eq(true), isNull()))
                .thenThrow(new JobStoreException("db down", new RuntimeException()));

        assertThat(dispatcher.dispatch(manualJob(), NOW)).isEqualTo(DispatchOutcome.STORE_ERROR);
    }

    @Test
    @DisplayName("Pass dispatches every due job and skips those backing off")
    void passShouldLaunchDueJobsAndSkipBackoff() {
        properties.getRetry().setInitialBackoff(Duration.ofMinutes(10));
        ScheduledJob ready = manualJob();
        ScheduledJob backingOff = manualJob().toBuilder()
                .id("job_waiting")
                .failureCount(1)
                .lastAttemptAt(NOW.minusSeconds(60))
                .build();
        when(jobRepository.findDue(NOW)).thenReturn(List.of(ready, backingOff));
        when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

        DispatchPass pass = dispatcher.runPass();
        Map<DispatchOutcome, Long> outcomes = pass.awaitOutcomes();

        assertThat(pass.getDueCount()).isEqualTo(2);
        assertThat(pass.getLaunchedCount()).isEqualTo(1);
        assertThat(pass.getSkippedCount()).isEqualTo(1);
        assertThat(pass.getStartedAt()).isEqualTo(NOW);
        assertThat(outcomes).containsEntry(DispatchOutcome.SENT, 1L).hasSize(1);
    }

    @Test
    @DisplayName("Failure while listing due jobs yields an empty pass")
    void listingFailureShouldYieldEmptyPass() {
        when(jobRepository.findDue(NOW)).thenThrow(new JobStoreException("db down", new RuntimeException()));

        DispatchPass pass = dispatcher.runPass();

        assertThat(pass.getLaunchedCount()).isZero();
        assertThat(pass.awaitOutcomes()).isEmpty();
        assertThat(meterRegistry.counter("scheduler.passes.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("One failing job does not stop the others")
    void failuresShouldBeIsolatedPerJob() {
        ScheduledJob failing = manualJob().toBuilder().id("job_fail").recipients(List.of("bad@example.com")).build();
        ScheduledJob ok = manualJob();
        when(jobRepository.findDue(NOW)).thenReturn(List.of(failing, ok));
        doAnswer(invocation -> {
            OutboundMessage message = invocation.getArgument(0);
            if (message.getRecipients().contains("bad@example.com")) {
                throw new DeliveryException("rejected");
            }
            return null;
        }).when(deliveryClient).deliver(any());
        when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

        Map<DispatchOutcome, Long> outcomes = dispatcher.runPass().awaitOutcomes();

        assertThat(outcomes)
                .containsEntry(DispatchOutcome.SENT, 1L)
                .containsEntry(DispatchOutcome.DELIVERY_FAILED, 1L);
    }

    @Test
    @DisplayName("Overlapping pass skips a job whose delivery is still in flight")
    void overlappingPassShouldNotDeliverInFlightJobAgain() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            JobDispatcher pooled = new JobDispatcher(
                    jobRepository,
                    autoSummaryService,
                    deliveryClient,
                    ownerScheduleService,
                    new DispatchRetryPolicy(properties),
                    pool,
                    meterRegistry,
                    Clock.fixed(NOW, ZoneOffset.UTC));
            CountDownLatch deliveryStarted = new CountDownLatch(1);
            CountDownLatch releaseDelivery = new CountDownLatch(1);
            doAnswer(invocation -> {
                deliveryStarted.countDown();
                assertThat(releaseDelivery.await(5, TimeUnit.SECONDS)).isTrue();
                return null;
            }).when(deliveryClient).deliver(any());
            when(jobRepository.findDue(NOW)).thenReturn(List.of(manualJob()));
            when(jobRepository.markOutcome("job_manual", DUE_AT, true, null)).thenReturn(MarkOutcomeResult.APPLIED);

            DispatchPass first = pooled.runPass();
            assertThat(deliveryStarted.await(5, TimeUnit.SECONDS)).isTrue();

            DispatchPass second = pooled.runPass();
            releaseDelivery.countDown();

            assertThat(second.getLaunchedCount()).isZero();
            assertThat(second.getSkippedCount()).isEqualTo(1);
            assertThat(second.awaitOutcomes()).isEmpty();
            assertThat(first.awaitOutcomes()).containsEntry(DispatchOutcome.SENT, 1L).hasSize(1);
            verify(deliveryClient, times(1)).deliver(any());

            DispatchPass afterCompletion = pooled.runPass();
            assertThat(afterCompletion.getLaunchedCount()).isEqualTo(1);
            afterCompletion.awaitOutcomes();
        } finally {
            pool.shutdownNow();
        }
    }
}
