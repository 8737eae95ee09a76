package com.ipd.match;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.ipd.model.Action;
import com.ipd.model.MatchAttributes;
import com.ipd.model.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Plays two players against each other for a fixed number of turns. Both players decide on the same history before
 * either move is recorded. No scoring is done.
 */
public final class Match {
  private static final Logger log = Logger.getLogger(Match.class.getName());

  private final Player first;
  private final Player second;
  private final int turns;
  private final boolean lengthKnown;
  @Nullable
  private final Long seed;

  public Match(Player first, Player second, int turns) {
    this(first, second, turns, true, null);
  }

  /**
   * @param lengthKnown whether the players are told the number of turns
   * @param seed seed for the random sources of both players, or null to leave them untouched
   */
  public Match(Player first, Player second, int turns, boolean lengthKnown, @Nullable Long seed) {
    checkArgument(first != second, "A player cannot play against itself");
    checkArgument(turns >= 0, "Negative number of turns %s", turns);
    this.first = first;
    this.second = second;
    this.turns = turns;
    this.lengthKnown = lengthKnown;
    this.seed = seed;
  }

  public List<Round> play() {
    checkState(first.history().isEmpty() && second.history().isEmpty(), "Players already played");
    MatchAttributes attributes = lengthKnown ? MatchAttributes.ofLength(turns) : MatchAttributes.unknown();
    first.setMatchAttributes(attributes);
    second.setMatchAttributes(attributes);
    if (seed != null) {
      Random seeds = new Random(seed);
      first.setSeed(seeds.nextLong());
      second.setSeed(seeds.nextLong());
    }

    log.log(Level.FINE, () -> "Playing %s vs %s for %d turns".formatted(first.name(), second.name(), turns));
    List<Round> rounds = new ArrayList<>(turns);
    for (int turn = 0; turn < turns; turn++) {
      Action firstAction = first.decide(second);
      Action secondAction = second.decide(first);
      first.recordMove(firstAction);
      second.recordMove(secondAction);
      rounds.add(new Round(firstAction, secondAction));
    }
    log.log(Level.FINE, () -> "Finished %s vs %s: %s".formatted(first.name(), second.name(), rounds));
    return List.copyOf(rounds);
  }

  public Player first() {
    return first;
  }

  public Player second() {
    return second;
  }
}
