package com.company.scheduler.domain.dataset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemediationCase {

    private String id;
    private String title;
    private String status;

    @Builder.Default
    private List<String> linkedMetricIds = new ArrayList<>();

    public boolean isLinkedTo(String metricId) {
        return linkedMetricIds != null && metricId != null && linkedMetricIds.contains(metricId);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status != null && "completed".equalsIgnoreCase(status.trim());
    }
}
