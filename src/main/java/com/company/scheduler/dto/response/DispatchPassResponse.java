package com.company.scheduler.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of a dispatch pass. Outcomes are only present when the caller waited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchPassResponse {
    private String passId;
    private Instant startedAt;
    private int dueCount;
    private int launchedCount;
    private int skippedCount;
    private Map<String, Long> outcomes;
}
