package com.company.scheduler.service;

import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchRetryPolicyTest {

    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");

    private SchedulerProperties properties;
    private DispatchRetryPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        policy = new DispatchRetryPolicy(properties);
    }

    private static ScheduledJob failedJob(int failures, Instant lastAttempt) {
        return ScheduledJob.builder()
                .id("job_1")
                .failureCount(failures)
                .lastAttemptAt(lastAttempt)
                .build();
    }

    @Test
    void defaultsShouldRetryEveryPassWithoutLimit() {
        assertThat(policy.isInBackoff(failedJob(5, NOW.minusSeconds(1)), NOW)).isFalse();
        assertThat(policy.isLimitReached(1_000)).isFalse();
    }

    @Test
    void shouldStopAtConfiguredAttemptLimit() {
        properties.getRetry().setMaxAttempts(3);

        assertThat(policy.isLimitReached(2)).isFalse();
        assertThat(policy.isLimitReached(3)).isTrue();
    }

    @Test
    void backoffShouldGrowExponentiallyAndCap() {
        properties.getRetry().setInitialBackoff(Duration.ofMinutes(1));
        properties.getRetry().setBackoffMultiplier(2.0);
        properties.getRetry().setMaxBackoff(Duration.ofMinutes(10));

        assertThat(policy.backoffAfter(0)).isEqualTo(Duration.ZERO);
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMinutes(4));
        assertThat(policy.backoffAfter(10)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void jobShouldStayInBackoffUntilWindowElapses() {
        properties.getRetry().setInitialBackoff(Duration.ofMinutes(5));

        assertThat(policy.isInBackoff(failedJob(1, NOW.minus(Duration.ofMinutes(4))), NOW)).isTrue();
        assertThat(policy.isInBackoff(failedJob(1, NOW.minus(Duration.ofMinutes(5))), NOW)).isFalse();
        assertThat(policy.isInBackoff(failedJob(0, NOW), NOW)).isFalse();
        assertThat(policy.isInBackoff(failedJob(2, null), NOW)).isFalse();
    }
}
