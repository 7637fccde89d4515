package com.company.scheduler.domain.dataset;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Metric {

    private String id;
    private String name;

    // gte, lte, within_range or absent
    @JsonAlias("targetMeetingRule")
    private String targetRule;

    // Period key (yyyy-MM) -> values
    @Builder.Default
    @JsonAlias("monthlyData")
    private Map<String, PeriodValue> periods = new LinkedHashMap<>();
}
