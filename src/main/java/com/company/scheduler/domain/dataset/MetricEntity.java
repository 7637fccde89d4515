package com.company.scheduler.domain.dataset;

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
public class MetricEntity {

    private String id;
    private String name;
    private String group;

    @Builder.Default
    private List<Metric> metrics = new ArrayList<>();
}
