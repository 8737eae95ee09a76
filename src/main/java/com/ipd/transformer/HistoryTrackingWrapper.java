package com.ipd.transformer;

import com.ipd.model.Action;
import com.ipd.model.Player;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Records every action passing through it without changing it.
 */
public final class HistoryTrackingWrapper implements StrategyWrapper {
  @Nullable
  private List<Action> recorded;

  @Override
  public Action wrap(Player self, Player opponent, Action proposed) {
    if (recorded == null) {
      recorded = new ArrayList<>();
    }
    recorded.add(proposed);
    return proposed;
  }

  public List<Action> recordedHistory() {
    return recorded == null ? List.of() : List.copyOf(recorded);
  }

  @Override
  public String toString() {
    return "Tracking[" + (recorded == null ? 0 : recorded.size()) + ']';
  }
}
