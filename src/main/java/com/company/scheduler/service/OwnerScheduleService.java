package com.company.scheduler.service;

import com.company.scheduler.client.MetricsSourceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Resolves the next occurrence of an owner's recurrence schedule. The schedule
 * is fetched fresh on every call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OwnerScheduleService {

    private final MetricsSourceClient metricsSourceClient;
    private final RecurrenceEvaluator recurrenceEvaluator;

    /**
     * @return empty when the owner has no schedule or it is exhausted
     * @throws com.company.scheduler.exception.UpstreamUnavailableException when settings cannot be loaded
     */
    public Optional<Instant> nextOccurrence(String ownerId, Instant now) {
        return metricsSourceClient.fetchSchedule(ownerId)
                .flatMap(schedule -> recurrenceEvaluator.nextFireInstant(schedule, now));
    }
}
