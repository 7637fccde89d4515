package com.company.scheduler.domain.dataset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeriodValue {

    private String actual;
    private String target;

    /**
     * A point qualifies for statistics only when both values are present and non-blank.
     */
    @JsonIgnore
    public boolean isQualifying() {
        return actual != null && !actual.isBlank() && target != null && !target.isBlank();
    }
}
