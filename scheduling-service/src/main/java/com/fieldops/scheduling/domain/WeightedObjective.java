package com.fieldops.scheduling.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An objective with an optional caller-supplied weight. A null weight means
 * "use the rank-based default".
 */
@Value
@Builder
@Jacksonized
public class WeightedObjective {

    Objective objective;
    Double weight;

    public static WeightedObjective of(Objective objective) {
        return new WeightedObjective(objective, null);
    }

    public static WeightedObjective of(Objective objective, double weight) {
        return new WeightedObjective(objective, weight);
    }
}
