package com.ipd.strategy;

import com.google.common.collect.ImmutableMap;
import com.ipd.model.Action;
import com.ipd.model.Classifier;
import com.ipd.model.Player;
import com.ipd.model.PlayerType;
import com.ipd.model.Strategy;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A handful of classic base strategies to transform.
 */
public final class BasicStrategies {
  public static final PlayerType COOPERATOR = PlayerType.stateless("Cooperator", "Cooperator",
      Classifier.deterministic(0), Strategy.constant(Action.COOPERATE));

  public static final PlayerType DEFECTOR = PlayerType.stateless("Defector", "Defector",
      Classifier.deterministic(0), Strategy.constant(Action.DEFECT));

  public static final PlayerType TIT_FOR_TAT = PlayerType.stateless("TitForTat", "Tit For Tat",
      Classifier.deterministic(1), Strategy.ofOpponent(BasicStrategies::titForTat));

  public static final PlayerType ALTERNATOR = PlayerType.stateless("Alternator", "Alternator",
      Classifier.deterministic(1), BasicStrategies::alternate);

  public static final PlayerType GRUDGER = PlayerType.of("Grudger", "Grudger",
      Classifier.deterministic(Classifier.INFINITE_MEMORY), GrudgerStrategy::new);

  public static final PlayerType RANDOM = PlayerType.stateless("Random", "Random: 0.5",
      Classifier.stochastic(0), (self, opponent) -> Action.random(0.5, self.random()));

  private static final ImmutableMap<String, PlayerType> REGISTRY = Stream.of(
          COOPERATOR, DEFECTOR, TIT_FOR_TAT, ALTERNATOR, GRUDGER, RANDOM)
      .collect(ImmutableMap.toImmutableMap(
          type -> type.identifier().toLowerCase(Locale.ROOT), Function.identity()));

  private BasicStrategies() {
    // static utility
  }

  public static Collection<PlayerType> all() {
    return REGISTRY.values();
  }

  /**
   * Looks up a strategy by its identifier, ignoring case.
   */
  public static PlayerType byIdentifier(String identifier) {
    PlayerType type = REGISTRY.get(identifier.toLowerCase(Locale.ROOT));
    if (type == null) {
      throw new IllegalArgumentException("Unknown strategy %s, known: %s".formatted(identifier,
          REGISTRY.values().stream().map(PlayerType::identifier).sorted().collect(Collectors.joining(", "))));
    }
    return type;
  }

  private static Action titForTat(Player opponent) {
    Action last = opponent.lastMove();
    return last == null ? Action.COOPERATE : last;
  }

  private static Action alternate(Player self, Player opponent) {
    Action last = self.lastMove();
    return last == null ? Action.COOPERATE : last.flip();
  }

  private static final class GrudgerStrategy implements Strategy {
    private boolean grudged = false;

    @Override
    public Action decide(Player self, Player opponent) {
      if (opponent.lastMove() == Action.DEFECT) {
        grudged = true;
      }
      return grudged ? Action.DEFECT : Action.COOPERATE;
    }
  }
}
