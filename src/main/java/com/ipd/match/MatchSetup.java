package com.ipd.match;

import javax.annotation.Nullable;

/**
 * Everything needed to play one match between two possibly transformed strategies.
 */
public record MatchSetup(Contestant player, Contestant opponent, int turns, boolean lengthKnown,
    @Nullable Long seed) {
  public Match newMatch() {
    return new Match(player.type().newPlayer(), opponent.type().newPlayer(), turns, lengthKnown, seed);
  }
}
