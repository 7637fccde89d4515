package com.company.scheduler.service;

import com.company.scheduler.domain.PerformanceRow;
import com.company.scheduler.domain.dataset.MetricEntity;
import com.company.scheduler.domain.dataset.RemediationCase;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the system and user prompts for a summary request. Only at-risk rows
 * are sent as the statistical snapshot; the whole dataset goes in as context.
 */
@Component
public class SummaryPromptBuilder {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ObjectMapper prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SummaryPrompt build(List<MetricEntity> entities, List<RemediationCase> cases, List<PerformanceRow> rows) {
        List<SnapshotEntry> snapshot = rows.stream()
                .filter(PerformanceRow::isAtRisk)
                .map(row -> toSnapshotEntry(row, cases))
                .collect(Collectors.toList());

        String context = toJson(objectMapper, contextOf(entities, cases));
        String stats = toJson(prettyMapper, snapshot);

        return new SummaryPrompt(systemPrompt(context), userPrompt(stats));
    }

    static SnapshotEntry toSnapshotEntry(PerformanceRow row, List<RemediationCase> cases) {
        List<RemediationCase> linked = cases.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.isLinkedTo(row.getMetricId()))
                .collect(Collectors.toList());
        int completed = (int) linked.stream().filter(RemediationCase::isCompleted).count();

        Double rate = row.getAchievementRate() == null
                ? null
                : Math.round(row.getAchievementRate() * 10.0) / 10.0;

        return new SnapshotEntry(
                row.getGroupName(),
                row.getMetricName(),
                row.getMetricId(),
                row.getLatestMet(),
                row.isFail2(),
                row.isFail3(),
                rate,
                linked.size(),
                completed,
                linked.size() - completed);
    }

    private static Map<String, Object> contextOf(List<MetricEntity> entities, List<RemediationCase> cases) {
        List<MetricEntity> normalized = entities.stream()
                .filter(Objects::nonNull)
                .map(entity -> {
                    if (entity.getGroup() != null && !entity.getGroup().isBlank()) {
                        return entity;
                    }
                    return MetricEntity.builder()
                            .id(entity.getId())
                            .name(entity.getName())
                            .group(PerformanceAggregator.UNGROUPED)
                            .metrics(entity.getMetrics())
                            .build();
                })
                .collect(Collectors.toList());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entities", normalized);
        context.put("cases", cases);
        return context;
    }

    private static String toJson(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prompt data", e);
        }
    }

    private static String systemPrompt(String context) {
        return "You are an assistant for a metric tracking and remediation case application.\n"
                + "Here is the current data in the application: " + context + ".\n"
                + "Answer the user's questions based on this data. Be concise and helpful.";
    }

    private static String userPrompt(String stats) {
        return """
                You are generating a portfolio summary focused on improvement opportunities.

                Use the pre-computed statistical snapshot below. Do not redo statistical calculations from raw data.

                Consecutive failing metrics:
                %s

                Definitions:
                - latestMet: null = no data, true = met latest target, false = missed latest target.
                - fail2: true if the metric missed its target for the latest 2 consecutive periods.
                - fail3: true if the metric missed its target for the latest 3 consecutive periods.
                - achievementRate: percentage of historical data points that met target.
                - metricId: unique id of the metric (matches linkedMetricIds in the cases from context).
                - linkedCaseTotal: total number of remediation cases linked to this metric.
                - linkedCaseCompleted: number of linked cases with status "Completed".
                - linkedCaseActive: number of linked cases that are not completed.

                Tasks:
                1) Write "executiveSummary": a concise high-level snapshot of overall performance across metrics and case activity.
                2) Write "a3Summary": an overview of the remediation case portfolio, its progress and coverage.
                3) Build "areasOfConcern": one entry per metric from the snapshot, with an "issue" that references
                   consecutive failures, achievementRate and linked case activity, and an action-oriented "suggestion".

                Prioritize metrics with fail3 = true, then fail2 = true.
                When linkedCaseTotal = 0 or performance is still weak despite completed cases, recommend the next remediation step.

                Return STRICT JSON with this structure:
                {
                  "executiveSummary": "...",
                  "a3Summary": "...",
                  "areasOfConcern": [
                    { "metricName": "...", "groupName": "...", "issue": "...", "suggestion": "..." }
                  ]
                }

                Do not include any markdown formatting. Just the raw JSON object.""".formatted(stats);
    }

    @Getter
    @AllArgsConstructor
    @JsonPropertyOrder({"groupName", "metricName", "metricId", "latestMet", "fail2", "fail3",
            "achievementRate", "linkedCaseTotal", "linkedCaseCompleted", "linkedCaseActive"})
    static class SnapshotEntry {
        private final String groupName;
        private final String metricName;
        private final String metricId;
        private final Boolean latestMet;
        private final boolean fail2;
        private final boolean fail3;
        private final Double achievementRate;
        private final int linkedCaseTotal;
        private final int linkedCaseCompleted;
        private final int linkedCaseActive;
    }
}
