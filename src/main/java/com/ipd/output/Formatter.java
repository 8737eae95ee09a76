package com.ipd.output;

import com.ipd.match.Round;
import com.ipd.model.Action;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class Formatter {
    private Formatter() {}

    public static String format(List<Action> actions) {
        return actions.stream().map(Action::toString).collect(Collectors.joining());
    }

    public static String formatFirst(List<Round> rounds) {
        return format(rounds, Round::first);
    }

    public static String formatSecond(List<Round> rounds) {
        return format(rounds, Round::second);
    }

    private static String format(List<Round> rounds, Function<Round, Action> side) {
        return rounds.stream().map(side).map(Action::toString).collect(Collectors.joining());
    }
}
