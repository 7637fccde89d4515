package com.company.scheduler.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A launched dispatch pass. Job tasks may still be running when this is returned.
 */
@Getter
@AllArgsConstructor
public class DispatchPass {

    private final String passId;
    private final Instant startedAt;
    private final int dueCount;
    private final int launchedCount;
    private final int skippedCount;
    private final CompletableFuture<List<DispatchOutcome>> completion;

    public static DispatchPass empty(String passId, Instant startedAt) {
        return new DispatchPass(passId, startedAt, 0, 0, 0, CompletableFuture.completedFuture(List.of()));
    }

    /**
     * Blocks until every launched task has finished and counts outcomes.
     */
    public Map<DispatchOutcome, Long> awaitOutcomes() {
        return completion.join().stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }
}
