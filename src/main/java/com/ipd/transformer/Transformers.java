package com.ipd.transformer;

import static com.google.common.base.Preconditions.checkArgument;

import com.ipd.model.Action;
import com.ipd.model.Player;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The built-in transformers.
 */
public final class Transformers {
  public static final List<Action> DEFAULT_SEQUENCE = Collections.nCopies(3, Action.DEFECT);

  private static final StrategyWrapper FLIP = (self, opponent, proposed) -> proposed.flip();
  private static final Transformer FLIPPED = flip("Flipped");
  private static final Transformer TRACK_HISTORY = trackHistory("HistoryTracking");

  private Transformers() {
    // static utility
  }

  /**
   * Plays the opposite of the wrapped strategy.
   */
  public static Transformer flip() {
    return FLIPPED;
  }

  public static Transformer flip(@Nullable String namePrefix) {
    return Transformer.of(namePrefix, FLIP);
  }

  public static Transformer noisy(double noise) {
    return noisy(noise, "Noisy");
  }

  /**
   * Flips each proposed action with probability {@code noise}, drawn from the player's random source.
   */
  public static Transformer noisy(double noise, @Nullable String namePrefix) {
    checkProbability(noise);
    return Transformer.of(namePrefix, Transformers::noisyWrapper, noise);
  }

  public static Transformer forgiver(double p) {
    return forgiver(p, "Forgiving");
  }

  /**
   * Turns each proposed defection into a cooperation with probability {@code p}.
   */
  public static Transformer forgiver(double p, @Nullable String namePrefix) {
    checkProbability(p);
    return Transformer.of(namePrefix, Transformers::forgiverWrapper, p);
  }

  public static Transformer initialSequence() {
    return initialSequence(DEFAULT_SEQUENCE, null);
  }

  public static Transformer initialSequence(@Nullable List<Action> sequence) {
    return initialSequence(sequence, null);
  }

  /**
   * Opens the match with {@code sequence} and plays the wrapped strategy afterwards. An empty or missing sequence
   * means {@link #DEFAULT_SEQUENCE}.
   */
  public static Transformer initialSequence(@Nullable List<Action> sequence, @Nullable String namePrefix) {
    return Transformer.of(namePrefix, Transformers::initialSequenceWrapper, sequenceOrDefault(sequence));
  }

  public static Transformer finalSequence() {
    return finalSequence(DEFAULT_SEQUENCE, null);
  }

  public static Transformer finalSequence(@Nullable List<Action> sequence) {
    return finalSequence(sequence, null);
  }

  /**
   * Closes the match with {@code sequence} if the match length is known, otherwise plays the wrapped strategy
   * unchanged. An empty or missing sequence means {@link #DEFAULT_SEQUENCE}.
   */
  public static Transformer finalSequence(@Nullable List<Action> sequence, @Nullable String namePrefix) {
    return Transformer.of(namePrefix, Transformers::finalSequenceWrapper, sequenceOrDefault(sequence));
  }

  public static Transformer retaliateUntilApology() {
    return retaliateUntilApology("RUA");
  }

  public static Transformer retaliateUntilApology(@Nullable String namePrefix) {
    return Transformer.ofStateful(namePrefix, RetaliationWrapper::new);
  }

  /**
   * Records the actions reaching this layer, see {@link HistoryTrackingWrapper}.
   */
  public static Transformer trackHistory() {
    return TRACK_HISTORY;
  }

  public static Transformer trackHistory(@Nullable String namePrefix) {
    return Transformer.ofStateful(namePrefix, HistoryTrackingWrapper::new);
  }

  private static void checkProbability(double p) {
    checkArgument(0.0 <= p && p <= 1.0, "Probability %s not in [0,1]", p);
  }

  private static List<Action> sequenceOrDefault(@Nullable List<Action> sequence) {
    return sequence == null || sequence.isEmpty() ? DEFAULT_SEQUENCE : List.copyOf(sequence);
  }

  private static Action noisyWrapper(Player self, Player opponent, Action proposed, Double noise) {
    return self.random().nextDouble() < noise ? proposed.flip() : proposed;
  }

  private static Action forgiverWrapper(Player self, Player opponent, Action proposed, Double p) {
    return proposed == Action.DEFECT ? Action.random(p, self.random()) : proposed;
  }

  private static Action initialSequenceWrapper(Player self, Player opponent, Action proposed,
      List<Action> sequence) {
    int index = self.history().size();
    return index < sequence.size() ? sequence.get(index) : proposed;
  }

  private static Action finalSequenceWrapper(Player self, Player opponent, Action proposed,
      List<Action> sequence) {
    int length = self.matchAttributes().length();
    if (length < 0) {
      return proposed;
    }
    // Number of rounds left including this one, the last round maps to the last element
    int remaining = length - self.history().size();
    if (1 <= remaining && remaining <= sequence.size()) {
      return sequence.get(sequence.size() - remaining);
    }
    return proposed;
  }
}
