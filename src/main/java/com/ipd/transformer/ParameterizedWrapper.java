package com.ipd.transformer;

import com.ipd.model.Action;
import com.ipd.model.Player;

@FunctionalInterface
public interface ParameterizedWrapper<A> {
  Action wrap(Player self, Player opponent, Action proposed, A argument);

  default StrategyWrapper bind(A argument) {
    return (self, opponent, proposed) -> wrap(self, opponent, proposed, argument);
  }
}
