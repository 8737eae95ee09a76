package com.ipd.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.Ints;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.math.BigDecimal;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

final class ParseUtil {
  private ParseUtil() {
  }

  static Stream<JsonElement> stream(JsonArray array) {
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }

  static JsonObject object(JsonObject json, String key) {
    JsonElement element = json.get(key);
    checkArgument(element != null && element.isJsonObject(), "Expected object for %s, got %s", key, element);
    return element.getAsJsonObject();
  }

  static JsonArray array(JsonObject json, String key) {
    JsonElement element = json.get(key);
    checkArgument(element != null && element.isJsonArray(), "Expected array for %s, got %s", key, element);
    return element.getAsJsonArray();
  }

  static String string(JsonObject json, String key) {
    JsonElement element = json.get(key);
    checkArgument(element instanceof JsonPrimitive primitive && primitive.isString(),
        "Expected string for %s, got %s", key, element);
    return element.getAsString();
  }

  /**
   * Returns a string or number member as text.
   */
  static String scalar(JsonObject json, String key) {
    JsonElement element = json.get(key);
    checkArgument(element instanceof JsonPrimitive primitive && (primitive.isString() || primitive.isNumber()),
        "Expected string or number for %s, got %s", key, element);
    return element.getAsString();
  }

  static long integer(JsonObject json, String key) {
    JsonElement element = json.get(key);
    checkArgument(element instanceof JsonPrimitive primitive && primitive.isNumber(),
        "Expected integer for %s, got %s", key, element);
    BigDecimal value = element.getAsBigDecimal();
    try {
      return value.longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Expected integer for %s, got %s".formatted(key, element), e);
    }
  }

  static int intValue(JsonObject json, String key) {
    return Ints.checkedCast(integer(json, key));
  }
}
