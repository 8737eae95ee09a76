package com.ipd.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Random;
import java.util.function.Supplier;

/**
 * Description of a behaviour, not a participant. Every call to {@link #newPlayer()} yields an independent
 * {@link Player} with its own strategy instance.
 */
public final class PlayerType {
    private final String identifier;
    private final String name;
    private final Classifier classifier;
    private final Supplier<? extends Strategy> strategyFactory;

    private PlayerType(String identifier, String name, Classifier classifier,
        Supplier<? extends Strategy> strategyFactory) {
        checkArgument(!identifier.isBlank(), "Empty identifier");
        checkArgument(!name.isBlank(), "Empty name");
        this.identifier = identifier;
        this.name = name;
        this.classifier = requireNonNull(classifier);
        this.strategyFactory = requireNonNull(strategyFactory);
    }

    public static PlayerType of(String identifier, String name, Classifier classifier,
        Supplier<? extends Strategy> strategyFactory) {
        return new PlayerType(identifier, name, classifier, strategyFactory);
    }

    /**
     * Creates a stateless type, all players share the given strategy.
     */
    public static PlayerType stateless(String identifier, String name, Classifier classifier, Strategy strategy) {
        requireNonNull(strategy);
        return new PlayerType(identifier, name, classifier, () -> strategy);
    }

    /**
     * Returns a type identical to this one except for identity and decision rule.
     */
    public PlayerType derive(String identifier, String name, Supplier<? extends Strategy> strategyFactory) {
        return new PlayerType(identifier, name, classifier, strategyFactory);
    }

    public String identifier() {
        return identifier;
    }

    public String name() {
        return name;
    }

    public Classifier classifier() {
        return classifier;
    }

    public Strategy newStrategy() {
        return strategyFactory.get();
    }

    public Player newPlayer() {
        return newPlayer(new Random());
    }

    public Player newPlayer(Random random) {
        return new Player(this, requireNonNull(newStrategy(), () -> "No strategy for " + identifier), random);
    }

    @Override
    public String toString() {
        return name;
    }
}
