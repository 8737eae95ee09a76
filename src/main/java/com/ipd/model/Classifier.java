package com.ipd.model;

import java.util.Set;

/**
 * Descriptive properties of a strategy. Transformed player types carry the classifier of their base type unchanged.
 *
 * @param memoryDepth number of past rounds the strategy looks at, {@link #INFINITE_MEMORY} if unbounded
 * @param stochastic whether the strategy draws random numbers
 * @param makesUseOf match attributes the strategy reads, e.g. {@code "length"}
 */
public record Classifier(int memoryDepth, boolean stochastic, Set<String> makesUseOf) {
    public static final int INFINITE_MEMORY = Integer.MAX_VALUE;

    public Classifier {
        makesUseOf = Set.copyOf(makesUseOf);
    }

    public static Classifier deterministic(int memoryDepth) {
        return new Classifier(memoryDepth, false, Set.of());
    }

    public static Classifier stochastic(int memoryDepth) {
        return new Classifier(memoryDepth, true, Set.of());
    }
}
