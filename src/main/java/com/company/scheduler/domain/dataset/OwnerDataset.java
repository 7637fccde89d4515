package com.company.scheduler.domain.dataset;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the metrics source returns for one owner.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OwnerDataset {

    @Builder.Default
    @JsonAlias("bowlers")
    private List<MetricEntity> entities = new ArrayList<>();

    @Builder.Default
    @JsonAlias("a3Cases")
    private List<RemediationCase> cases = new ArrayList<>();

    @JsonAlias("dashboardSettings")
    private OwnerSettings settings;

    public static OwnerDataset empty() {
        return OwnerDataset.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (entities == null || entities.isEmpty()) && (cases == null || cases.isEmpty());
    }
}
