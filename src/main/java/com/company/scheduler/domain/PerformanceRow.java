package com.company.scheduler.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated statistics for one (group, metric) pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceRow {

    private String groupName;
    private String metricId;
    private String metricName;
    private String ownerEntityId;

    // null = no qualifying data point
    private Boolean latestMet;
    private String latestActualDisplay;

    private boolean fail2;
    private boolean fail3;

    // Percentage 0..100, null when nothing qualifies
    private Double achievementRate;

    // Only computed when the row is at risk
    private int linkedCaseCount;

    public boolean isAtRisk() {
        return fail2 || fail3;
    }

    public boolean hasLatestValue() {
        return latestMet != null && latestActualDisplay != null && !latestActualDisplay.isEmpty();
    }
}
