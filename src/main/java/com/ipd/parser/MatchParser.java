package com.ipd.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ipd.match.Contestant;
import com.ipd.match.MatchSetup;
import com.ipd.strategy.BasicStrategies;
import com.ipd.transformer.Transformer;
import java.io.Reader;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Reads a match description in JSON format.
 *
 * <pre>
 * { "turns": 10, "seed": 7, "length": "known",
 *   "player": { "strategy": "TitForTat", "transformers": ["noisy:0.1", {"type": "initial", "sequence": "DDC"}] },
 *   "opponent": { "strategy": "Defector" } }
 * </pre>
 */
public final class MatchParser {
  public static final int DEFAULT_TURNS = 10;

  private MatchParser() {}

  public static MatchSetup parse(Reader reader) {
    JsonElement element;
    try {
      element = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed match description: " + e.getMessage(), e);
    }
    checkArgument(element.isJsonObject(), "Expected a JSON object, got %s", element);
    return parse(element.getAsJsonObject());
  }

  public static MatchSetup parse(JsonObject json) {
    checkArgument(json.has("player") && json.has("opponent"), "Match requires player and opponent");
    Contestant player = parseContestant(ParseUtil.object(json, "player"));
    Contestant opponent = parseContestant(ParseUtil.object(json, "opponent"));
    int turns = json.has("turns") ? ParseUtil.intValue(json, "turns") : DEFAULT_TURNS;
    checkArgument(turns >= 0, "Negative number of turns %s", turns);
    boolean lengthKnown = !json.has("length") || parseLength(ParseUtil.string(json, "length"));
    @Nullable Long seed = json.has("seed") ? ParseUtil.integer(json, "seed") : null;
    return new MatchSetup(player, opponent, turns, lengthKnown, seed);
  }

  static Contestant parseContestant(JsonObject json) {
    checkArgument(json.has("strategy"), "Missing strategy in %s", json);
    var base = BasicStrategies.byIdentifier(ParseUtil.string(json, "strategy"));
    JsonArray transformers = json.has("transformers") ? ParseUtil.array(json, "transformers") : new JsonArray();
    List<Transformer> parsed = ParseUtil.stream(transformers).map(TransformerParser::parse).toList();
    return new Contestant(base, parsed);
  }

  private static boolean parseLength(String length) {
    return switch (length) {
      case "known" -> true;
      case "unknown" -> false;
      default -> throw new IllegalArgumentException("Unsupported length mode " + length);
    };
  }
}
