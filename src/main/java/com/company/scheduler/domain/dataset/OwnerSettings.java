package com.company.scheduler.domain.dataset;

import com.company.scheduler.domain.RecurrenceSchedule;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Owner dashboard settings relevant to scheduled delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OwnerSettings {

    @JsonAlias("emailSchedule")
    private RecurrenceSchedule schedule;

    private String aiModel;

    @JsonAlias("emailConsolidate")
    private Consolidation consolidation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Consolidation {
        private boolean enabled;
        private String tags; // comma separated

        public List<String> tagList() {
            if (tags == null) {
                return List.of();
            }
            return Arrays.stream(tags.split(","))
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .toList();
        }
    }
}
