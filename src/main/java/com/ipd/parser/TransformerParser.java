package com.ipd.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.ipd.model.Action;
import com.ipd.transformer.Transformer;
import com.ipd.transformer.Transformers;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Parses transformer descriptors such as {@code noisy:0.1} or {@code initial:DDC}, either as plain strings or as
 * JSON objects with a {@code type} member.
 */
public final class TransformerParser {
  private static final Pattern COLON_PATTERN = Pattern.compile(" *: *");
  private static final Map<String, String> ARGUMENT_KEYS = Map.of(
      "noisy", "noise",
      "forgiver", "p",
      "forgiving", "p",
      "initial", "sequence",
      "final", "sequence");

  private TransformerParser() {}

  public static Transformer parse(String descriptor) {
    String[] parts = COLON_PATTERN.split(descriptor.trim(), 2);
    @Nullable String argument = parts.length == 2 ? parts[1] : null;
    return create(parts[0], argument, null);
  }

  public static Transformer parse(JsonElement element) {
    if (element instanceof JsonPrimitive primitive && primitive.isString()) {
      return parse(primitive.getAsString());
    }
    checkArgument(element.isJsonObject(), "Expected transformer string or object, got %s", element);
    JsonObject object = element.getAsJsonObject();
    checkArgument(object.has("type"), "Transformer without type: %s", object);
    String type = ParseUtil.string(object, "type");
    @Nullable String argumentKey = ARGUMENT_KEYS.get(type.toLowerCase(Locale.ROOT));
    for (String key : object.keySet()) {
      checkArgument(key.equals("type") || key.equals("prefix") || key.equals(argumentKey),
          "Transformer %s does not accept %s", type, key);
    }
    @Nullable String argument = argumentKey != null && object.has(argumentKey)
        ? ParseUtil.scalar(object, argumentKey)
        : null;
    @Nullable String prefix = object.has("prefix") ? ParseUtil.string(object, "prefix") : null;
    return create(type, argument, prefix);
  }

  public static List<Transformer> parseAll(List<String> descriptors) {
    return descriptors.stream().map(TransformerParser::parse).toList();
  }

  public static List<Action> parseSequence(String sequence) {
    List<Action> actions = new ArrayList<>(sequence.length());
    for (char symbol : sequence.trim().toCharArray()) {
      actions.add(Action.parse(symbol));
    }
    return actions;
  }

  private static Transformer create(String type, @Nullable String argument, @Nullable String prefix) {
    return switch (type.toLowerCase(Locale.ROOT)) {
      case "flip", "flipped" -> {
        checkNoArgument(type, argument);
        yield prefix == null ? Transformers.flip() : Transformers.flip(prefix);
      }
      case "noisy" -> prefix == null
          ? Transformers.noisy(probability(type, argument))
          : Transformers.noisy(probability(type, argument), prefix);
      case "forgiver", "forgiving" -> prefix == null
          ? Transformers.forgiver(probability(type, argument))
          : Transformers.forgiver(probability(type, argument), prefix);
      case "initial" -> Transformers.initialSequence(sequence(argument), prefix);
      case "final" -> Transformers.finalSequence(sequence(argument), prefix);
      case "rua", "retaliate" -> {
        checkNoArgument(type, argument);
        yield prefix == null ? Transformers.retaliateUntilApology() : Transformers.retaliateUntilApology(prefix);
      }
      case "track", "history" -> {
        checkNoArgument(type, argument);
        yield prefix == null ? Transformers.trackHistory() : Transformers.trackHistory(prefix);
      }
      default -> throw new IllegalArgumentException("Unknown transformer " + type);
    };
  }

  private static void checkNoArgument(String type, @Nullable String argument) {
    checkArgument(argument == null, "Transformer %s takes no argument, got %s", type, argument);
  }

  private static double probability(String type, @Nullable String argument) {
    checkArgument(argument != null, "Transformer %s requires a probability", type);
    try {
      return Double.parseDouble(argument);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid probability %s for %s".formatted(argument, type), e);
    }
  }

  @Nullable
  private static List<Action> sequence(@Nullable String argument) {
    return argument == null ? null : parseSequence(argument);
  }
}
