package com.fanfic.ingest.service.ingest;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one poll cycle.
 *
 * @param startedAt when the cycle became active
 * @param extracted number of items the extractor produced
 * @param outcomes dispatch outcome counts
 * @param scanFailed whether the folder scan itself failed
 */
public record CycleResult(
        Instant startedAt,
        int extracted,
        Map<DispatchOutcome, Integer> outcomes,
        boolean scanFailed
) {

    public CycleResult {
        Map<DispatchOutcome, Integer> copy = new EnumMap<>(DispatchOutcome.class);
        copy.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(copy);
    }

    public static CycleResult scanFailure(Instant startedAt) {
        return new CycleResult(startedAt, 0, new EnumMap<>(DispatchOutcome.class), true);
    }

    public int count(DispatchOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int delivered() {
        return outcomes.entrySet().stream()
                .filter(entry -> entry.getKey().isDelivered())
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    public int dropped() {
        return extracted - delivered();
    }
}
