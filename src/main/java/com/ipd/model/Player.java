package com.ipd.model;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import javax.annotation.Nullable;

/**
 * A live participant of one match. The history is append-only and only written by the match runner through
 * {@link #recordMove(Action)}; strategies see a read-only view.
 */
public final class Player {
    private final PlayerType type;
    private final Strategy strategy;
    private final List<Action> history = new ArrayList<>();
    private final List<Action> historyView = Collections.unmodifiableList(history);
    private final Random random;
    private MatchAttributes matchAttributes = MatchAttributes.unknown();

    Player(PlayerType type, Strategy strategy, Random random) {
        this.type = type;
        this.strategy = strategy;
        this.random = requireNonNull(random);
    }

    public PlayerType type() {
        return type;
    }

    public String name() {
        return type.name();
    }

    public Strategy strategy() {
        return strategy;
    }

    public List<Action> history() {
        return historyView;
    }

    @Nullable
    public Action lastMove() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public Random random() {
        return random;
    }

    public MatchAttributes matchAttributes() {
        return matchAttributes;
    }

    public void setMatchAttributes(MatchAttributes matchAttributes) {
        this.matchAttributes = requireNonNull(matchAttributes);
    }

    public void setSeed(long seed) {
        random.setSeed(seed);
    }

    public Action decide(Player opponent) {
        Action action = strategy.decide(this, opponent);
        checkState(action != null, "Strategy of %s returned no action", type.identifier());
        return action;
    }

    public void recordMove(Action action) {
        history.add(requireNonNull(action));
    }

    @Override
    public String toString() {
        return "%s@%d".formatted(type.name(), history.size());
    }
}
