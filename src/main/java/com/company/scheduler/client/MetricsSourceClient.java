package com.company.scheduler.client;

import com.company.scheduler.domain.RecurrenceSchedule;
import com.company.scheduler.domain.dataset.OwnerDataset;

import java.util.List;
import java.util.Optional;

/**
 * Read access to owner metric data and dashboard settings.
 * Failures surface as {@link com.company.scheduler.exception.UpstreamUnavailableException}.
 */
public interface MetricsSourceClient {

    OwnerDataset load(String ownerId);

    /**
     * Merged dataset across every owner carrying one of the tags; empty when the
     * source reports no success.
     */
    Optional<OwnerDataset> consolidate(List<String> tags);

    default Optional<RecurrenceSchedule> fetchSchedule(String ownerId) {
        OwnerDataset dataset = load(ownerId);
        if (dataset == null || dataset.getSettings() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(dataset.getSettings().getSchedule());
    }
}
