package com.ipd.model;

import static com.google.common.base.Preconditions.checkArgument;

public record MatchAttributes(int length) {
    public static final int UNKNOWN_LENGTH = -1;

    public MatchAttributes {
        checkArgument(length >= UNKNOWN_LENGTH, "Invalid match length %s", length);
    }

    public static MatchAttributes unknown() {
        return new MatchAttributes(UNKNOWN_LENGTH);
    }

    public static MatchAttributes ofLength(int length) {
        checkArgument(length >= 0, "Negative match length %s", length);
        return new MatchAttributes(length);
    }

    public boolean isLengthKnown() {
        return length >= 0;
    }
}
