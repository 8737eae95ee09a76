package com.ipd.transformer;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.ipd.model.Action;
import com.ipd.model.Player;
import com.ipd.model.Strategy;
import java.util.Optional;

/**
 * A strategy delegating to a base strategy and passing its proposal through a wrapper. Both instances belong to a
 * single player.
 */
public final class TransformedStrategy implements Strategy {
  private final Strategy base;
  private final StrategyWrapper wrapper;

  public TransformedStrategy(Strategy base, StrategyWrapper wrapper) {
    this.base = requireNonNull(base);
    this.wrapper = requireNonNull(wrapper);
  }

  @Override
  public Action decide(Player self, Player opponent) {
    Action proposed = base.decide(self, opponent);
    checkState(proposed != null, "Wrapped strategy of %s returned no action", self.name());
    return wrapper.wrap(self, opponent, proposed);
  }

  public StrategyWrapper wrapper() {
    return wrapper;
  }

  /**
   * Finds the outermost wrapper of the given class in the strategy of {@code player}.
   */
  public static <W extends StrategyWrapper> Optional<W> findWrapper(Player player, Class<W> wrapperClass) {
    Strategy current = player.strategy();
    while (current instanceof TransformedStrategy transformed) {
      if (wrapperClass.isInstance(transformed.wrapper)) {
        return Optional.of(wrapperClass.cast(transformed.wrapper));
      }
      current = transformed.base;
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "Transformed:{" + base + " via " + wrapper + '}';
  }
}
