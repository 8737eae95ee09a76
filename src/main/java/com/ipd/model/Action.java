package com.ipd.model;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

public enum Action {
    COOPERATE,
    DEFECT;

    public Action flip() {
        return switch (this) {
            case COOPERATE -> DEFECT;
            case DEFECT -> COOPERATE;
        };
    }

    /**
     * Returns {@link #COOPERATE} with probability {@code p}, {@link #DEFECT} otherwise. The bounds are exact: no
     * draw is made for {@code p = 0} or {@code p = 1}.
     */
    public static Action random(double p, Random random) {
        checkArgument(0.0 <= p && p <= 1.0, "Probability %s not in [0,1]", p);
        if (p == 0.0) {
            return DEFECT;
        }
        if (p == 1.0) {
            return COOPERATE;
        }
        return random.nextDouble() < p ? COOPERATE : DEFECT;
    }

    public static Action parse(char symbol) {
        return switch (Character.toUpperCase(symbol)) {
            case 'C' -> COOPERATE;
            case 'D' -> DEFECT;
            default -> throw new IllegalArgumentException("Unsupported action symbol " + symbol);
        };
    }

    public char symbol() {
        return this == COOPERATE ? 'C' : 'D';
    }

    @Override
    public String toString() {
        return String.valueOf(symbol());
    }
}
