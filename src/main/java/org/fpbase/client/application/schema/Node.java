package org.fpbase.client.application.schema;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Path-aware view over a decoded JSON object used by {@link EntityDecoder}.
 *
 * <p>Every accessor reports failures as {@link ValidationException}s naming the full field path.</p>
 */
final class Node {
  private final Map<String, Object> fields;
  private final String path;

  private Node(Map<String, Object> fields, String path) {
    this.fields = fields;
    this.path = path;
  }

  static Node of(Object value, String path) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new ValidationException(path, "expected an object but was " + describe(value));
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return new Node(map, path);
  }

  String path() {
    return path;
  }

  String child(String field) {
    return path + "." + field;
  }

  boolean isPresent(String field) {
    return fields.get(field) != null;
  }

  Object raw(String field) {
    return fields.get(field);
  }

  Node requireObject(String field) {
    return Node.of(require(field), child(field));
  }

  Optional<Node> optionalObject(String field) {
    Object value = fields.get(field);
    return value == null ? Optional.empty() : Optional.of(Node.of(value, child(field)));
  }

  String requireString(String field) {
    Object value = require(field);
    if (!(value instanceof String text)) {
      throw mismatch(field, "a string", value);
    }
    return text;
  }

  String optionalString(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw mismatch(field, "a string", value);
    }
    return text;
  }

  /**
   * Reads an identifier that may arrive as a JSON string or integral number; numbers become decimal text.
   */
  String requireId(String field) {
    Object value = require(field);
    if (value instanceof String text) {
      return text;
    }
    if (isIntegral(value)) {
      return value.toString();
    }
    throw mismatch(field, "a string or integer identifier", value);
  }

  Double optionalDouble(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Number number)) {
      throw mismatch(field, "a number", value);
    }
    return number.doubleValue();
  }

  Integer optionalInteger(String field) {
    Object value = fields.get(field);
    if (value == null) {
      return null;
    }
    if (!isIntegral(value)) {
      throw mismatch(field, "an integer", value);
    }
    long asLong = ((Number) value).longValue();
    if (asLong < Integer.MIN_VALUE || asLong > Integer.MAX_VALUE) {
      throw mismatch(field, "a 32-bit integer", value);
    }
    return (int) asLong;
  }

  boolean optionalBoolean(String field, boolean defaultValue) {
    Object value = fields.get(field);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof Boolean flag)) {
      throw mismatch(field, "a boolean", value);
    }
    return flag;
  }

  <E> E requireCode(String field, Function<String, Optional<E>> lookup, List<String> allowed) {
    String code = requireString(field);
    return lookup.apply(code).orElseThrow(() -> new ValidationException(child(field),
        "expected one of " + allowed + " but was '" + code + "'"));
  }

  <E> E optionalCode(String field, Function<String, Optional<E>> lookup, List<String> allowed) {
    if (!isPresent(field)) {
      return null;
    }
    return requireCode(field, lookup, allowed);
  }

  List<Object> requireList(String field) {
    Object value = require(field);
    if (!(value instanceof List<?> list)) {
      throw mismatch(field, "a list", value);
    }
    return new ArrayList<>(list);
  }

  <T> List<T> mapList(String field, ElementDecoder<T> decoder) {
    List<Object> items = requireList(field);
    List<T> out = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      out.add(decoder.decode(items.get(i), child(field) + "[" + i + "]"));
    }
    return out;
  }

  private Object require(String field) {
    if (!fields.containsKey(field)) {
      throw new ValidationException(child(field), "required field is missing");
    }
    Object value = fields.get(field);
    if (value == null) {
      throw new ValidationException(child(field), "required field is null");
    }
    return value;
  }

  private ValidationException mismatch(String field, String expected, Object actual) {
    return new ValidationException(child(field), "expected " + expected + " but was " + describe(actual));
  }

  static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof BigInteger
        || value instanceof Short || value instanceof Byte;
  }

  static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String text) {
      return "string '" + text + "'";
    }
    if (value instanceof Map<?, ?>) {
      return "an object";
    }
    if (value instanceof List<?>) {
      return "a list";
    }
    return value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " " + value;
  }

  @FunctionalInterface
  interface ElementDecoder<T> {
    T decode(Object element, String path);
  }
}
