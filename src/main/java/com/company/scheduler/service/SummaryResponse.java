package com.company.scheduler.service;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured reply expected from the text-generation service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SummaryResponse {

    private String executiveSummary;

    @JsonProperty("a3Summary")
    @JsonAlias("caseSummary")
    private String caseSummary;

    @Builder.Default
    private List<Concern> areasOfConcern = new ArrayList<>();

    public boolean hasCaseSummary() {
        return caseSummary != null && !caseSummary.isBlank();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Concern {
        private String metricName;
        private String groupName;
        private String issue;
        private String suggestion;
    }
}
