package com.ipd.transformer;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.ipd.model.PlayerType;
import com.ipd.model.Strategy;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Derives new player types by passing every decision of the base type through a wrapper.
 *
 * <p>A transformer only holds a factory for its wrapper. Each player of a derived type obtains a fresh wrapper, so
 * wrapper state is never shared between players, nor between types derived from the same transformer. Transformers
 * compose as functions: {@code second.apply(first.apply(type))}, or {@code first.andThen(second)}.
 */
public final class Transformer implements UnaryOperator<PlayerType> {
  private static final Logger log = Logger.getLogger(Transformer.class.getName());

  private final String namePrefix;
  private final Supplier<? extends StrategyWrapper> wrapperFactory;

  private Transformer(@Nullable String namePrefix, Supplier<? extends StrategyWrapper> wrapperFactory) {
    this.namePrefix = Strings.nullToEmpty(namePrefix);
    this.wrapperFactory = requireNonNull(wrapperFactory);
  }

  /**
   * Creates a transformer from a stateless wrapper, which is shared by all derived players.
   */
  public static Transformer of(@Nullable String namePrefix, StrategyWrapper wrapper) {
    requireNonNull(wrapper);
    return new Transformer(namePrefix, () -> wrapper);
  }

  /**
   * Creates a transformer from a stateless wrapper and an argument bound now and passed on every decision.
   */
  public static <A> Transformer of(@Nullable String namePrefix, ParameterizedWrapper<A> wrapper, A argument) {
    requireNonNull(wrapper);
    requireNonNull(argument);
    return of(namePrefix, wrapper.bind(argument));
  }

  /**
   * Creates a transformer whose wrapper keeps state. The factory is called once per derived player.
   */
  public static Transformer ofStateful(@Nullable String namePrefix,
      Supplier<? extends StrategyWrapper> wrapperFactory) {
    return new Transformer(namePrefix, wrapperFactory);
  }

  public String namePrefix() {
    return namePrefix;
  }

  @Override
  public PlayerType apply(PlayerType base) {
    return apply(base, namePrefix);
  }

  /**
   * Applies this transformer with a different name prefix. An empty or null prefix keeps the base identity.
   *
   * @throws TransformerConfigurationException if the base type or the wrapper factory cannot produce instances
   */
  public PlayerType apply(PlayerType base, @Nullable String prefix) {
    requireNonNull(base);
    // Both factories must produce instances before any player exists.
    Strategy probe;
    StrategyWrapper wrapperProbe;
    try {
      probe = base.newStrategy();
      wrapperProbe = wrapperFactory.get();
    } catch (RuntimeException e) {
      throw new TransformerConfigurationException("Cannot transform %s".formatted(base.identifier()), e);
    }
    if (probe == null) {
      throw new TransformerConfigurationException("Player type %s has no strategy".formatted(base.identifier()));
    }
    if (wrapperProbe == null) {
      throw new TransformerConfigurationException(
          "Wrapper factory of transformer '%s' returned no wrapper".formatted(namePrefix));
    }

    String identifier = base.identifier();
    String name = base.name();
    if (!Strings.isNullOrEmpty(prefix)) {
      identifier = prefix + identifier;
      name = prefix + ' ' + name;
    }
    String derivedIdentifier = identifier;
    log.log(Level.FINE, () -> "Derived %s from %s".formatted(derivedIdentifier, base.identifier()));
    return base.derive(identifier, name, () -> new TransformedStrategy(base.newStrategy(), wrapperFactory.get()));
  }

  @Override
  public String toString() {
    return namePrefix.isEmpty() ? "Transformer" : "Transformer[" + namePrefix + ']';
  }
}
