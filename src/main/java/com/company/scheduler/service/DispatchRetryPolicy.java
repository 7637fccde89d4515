package com.company.scheduler.service;

import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.domain.ScheduledJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Delivery retry policy. With the defaults (no attempt limit, zero backoff)
 * a failed job is simply picked up again by the next pass.
 */
@Component
@RequiredArgsConstructor
public class DispatchRetryPolicy {

    private final SchedulerProperties properties;

    /**
     * True while a previously failed job is still inside its backoff window.
     */
    public boolean isInBackoff(ScheduledJob job, Instant now) {
        if (job.getFailureCount() <= 0 || job.getLastAttemptAt() == null) {
            return false;
        }
        Duration backoff = backoffAfter(job.getFailureCount());
        if (backoff.isZero()) {
            return false;
        }
        return now.isBefore(job.getLastAttemptAt().plus(backoff));
    }

    /**
     * Whether a job that has now failed {@code attempts} times should stop retrying.
     */
    public boolean isLimitReached(int attempts) {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        return maxAttempts > 0 && attempts >= maxAttempts;
    }

    Duration backoffAfter(int failureCount) {
        SchedulerProperties.Retry retry = properties.getRetry();
        Duration initial = retry.getInitialBackoff();
        if (initial.isZero() || initial.isNegative() || failureCount <= 0) {
            return Duration.ZERO;
        }
        double factor = Math.pow(retry.getBackoffMultiplier(), failureCount - 1);
        double millis = initial.toMillis() * factor;
        long maxMillis = retry.getMaxBackoff().toMillis();
        return Duration.ofMillis(millis >= maxMillis ? maxMillis : (long) millis);
    }
}
