package com.company.scheduler.service;

import com.company.scheduler.domain.PerformanceRow;
import com.company.scheduler.domain.dataset.Metric;
import com.company.scheduler.domain.dataset.MetricEntity;
import com.company.scheduler.domain.dataset.PeriodValue;
import com.company.scheduler.domain.dataset.RemediationCase;
import com.company.scheduler.domain.enums.TargetRule;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw per-entity time series into one {@link PerformanceRow} per
 * (group, metric). Groups come out sorted by name; metrics keep source order
 * inside their group.
 */
@Service
@RequiredArgsConstructor
public class PerformanceAggregator {

    public static final String UNGROUPED = "Ungrouped";

    private final ViolationEvaluator violationEvaluator;

    public List<PerformanceRow> aggregate(List<MetricEntity> entities, List<RemediationCase> cases) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        List<RemediationCase> safeCases = cases != null ? cases : List.of();

        Map<String, List<OwnedMetric>> metricsByGroup = new TreeMap<>();
        for (MetricEntity entity : entities) {
            if (entity == null || entity.getMetrics() == null) {
                continue;
            }
            String groupName = groupNameOf(entity);
            for (Metric metric : entity.getMetrics()) {
                if (metric == null || metric.getPeriods() == null || metric.getPeriods().isEmpty()) {
                    continue;
                }
                metricsByGroup.computeIfAbsent(groupName, k -> new ArrayList<>())
                        .add(new OwnedMetric(entity.getId(), metric));
            }
        }

        List<PerformanceRow> rows = new ArrayList<>();
        metricsByGroup.forEach((groupName, metrics) -> {
            for (OwnedMetric owned : metrics) {
                rows.add(buildRow(groupName, owned, safeCases));
            }
        });
        return rows;
    }

    private PerformanceRow buildRow(String groupName, OwnedMetric owned, List<RemediationCase> cases) {
        Metric metric = owned.getMetric();
        TargetRule rule = TargetRule.fromCode(metric.getTargetRule());

        // Period keys are yyyy-MM, so lexicographic order is chronological
        List<PeriodValue> qualifying = new ArrayList<>();
        new TreeMap<>(metric.getPeriods()).forEach((period, value) -> {
            if (value != null && value.isQualifying()) {
                qualifying.add(value);
            }
        });

        PerformanceRow.PerformanceRowBuilder row = PerformanceRow.builder()
                .groupName(groupName)
                .metricId(metric.getId())
                .metricName(metric.getName())
                .ownerEntityId(owned.getOwnerEntityId());

        if (qualifying.isEmpty()) {
            return row.build();
        }

        List<Boolean> violations = new ArrayList<>(qualifying.size());
        for (PeriodValue value : qualifying) {
            violations.add(violationEvaluator.isViolation(rule, value.getTarget(), value.getActual()));
        }

        PeriodValue latest = qualifying.get(qualifying.size() - 1);
        boolean fail2 = lastAllViolate(violations, 2);
        boolean fail3 = lastAllViolate(violations, 3);

        long met = violations.stream().filter(v -> !v).count();
        double achievementRate = (met * 100.0) / violations.size();

        row.latestMet(!violations.get(violations.size() - 1))
                .latestActualDisplay(latest.getActual())
                .fail2(fail2)
                .fail3(fail3)
                .achievementRate(achievementRate);

        if (fail2 || fail3) {
            row.linkedCaseCount(countLinkedCases(metric.getId(), cases));
        }
        return row.build();
    }

    /**
     * True only when at least {@code window} qualifying points exist and the
     * latest {@code window} of them all violate.
     */
    private boolean lastAllViolate(List<Boolean> violations, int window) {
        if (violations.size() < window) {
            return false;
        }
        return violations.subList(violations.size() - window, violations.size())
                .stream()
                .allMatch(Boolean::booleanValue);
    }

    static int countLinkedCases(String metricId, List<RemediationCase> cases) {
        return (int) cases.stream()
                .filter(c -> c != null && c.isLinkedTo(metricId))
                .count();
    }

    private String groupNameOf(MetricEntity entity) {
        String group = entity.getGroup();
        if (group == null || group.isBlank()) {
            return UNGROUPED;
        }
        return group.trim();
    }

    @Getter
    @AllArgsConstructor
    private static class OwnedMetric {
        private final String ownerEntityId;
        private final Metric metric;
    }
}
