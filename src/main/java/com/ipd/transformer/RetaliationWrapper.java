package com.ipd.transformer;

import com.ipd.model.Action;
import com.ipd.model.Player;

/**
 * Answers a defection with defections until the opponent apologises by cooperating, then cooperates once and
 * returns to the wrapped strategy.
 */
public final class RetaliationWrapper implements StrategyWrapper {
  public enum State {
    CALM, RETALIATING
  }

  private State state = State.CALM;

  @Override
  public Action wrap(Player self, Player opponent, Action proposed) {
    Action last = opponent.lastMove();
    if (self.history().isEmpty() || last == null) {
      return proposed;
    }
    if (last == Action.DEFECT) {
      state = State.RETALIATING;
    }
    if (state == State.RETALIATING) {
      if (last == Action.COOPERATE) {
        state = State.CALM;
        return Action.COOPERATE;
      }
      return Action.DEFECT;
    }
    return proposed;
  }

  public State state() {
    return state;
  }

  @Override
  public String toString() {
    return "RUA[" + state + ']';
  }
}
