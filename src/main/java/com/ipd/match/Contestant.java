package com.ipd.match;

import com.ipd.model.PlayerType;
import com.ipd.transformer.Transformer;
import java.util.List;

/**
 * A base type together with the transformers to apply to it, first to last.
 */
public record Contestant(PlayerType base, List<Transformer> transformers) {
  public Contestant {
    transformers = List.copyOf(transformers);
  }

  public PlayerType type() {
    PlayerType type = base;
    for (Transformer transformer : transformers) {
      type = transformer.apply(type);
    }
    return type;
  }
}
