package com.company.scheduler.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner-level recurrence configuration. Values are kept as received so that
 * malformed entries can fall back to defaults at evaluation time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecurrenceSchedule {

    private String frequency;       // weekly or monthly
    private String timeOfDay;       // local HH:MM
    private Integer dayOfWeek;      // 1 = Monday .. 7 = Sunday
    private Integer dayOfMonth;     // 1..31, clamped to month length
    private Integer timezoneOffsetMinutes;
    private String stopDate;        // inclusive local yyyy-MM-dd
}
