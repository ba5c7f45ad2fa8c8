package org.fpbase.client.application.schema;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Minimal JSON helper that converts between byte payloads and loose {@link Map}/{@link List} graphs.
 *
 * <p>Objects decode to insertion-ordered maps, arrays to lists, integral numbers to {@link Integer}, {@link Long}
 * or {@link BigInteger}, and fractional numbers to {@link Double}. Writing accepts the same shapes plus
 * {@link Iterable} and {@link Boolean}; {@link #writeCanonical(Object)} sorts object keys recursively so equal
 * structures produce identical bytes.</p>
 *
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a UTF-8 JSON document into a graph of maps, lists, and scalars.
   *
   * @param json JSON bytes; never {@code null}
   * @return parsed value; an empty document yields an empty map
   * @throws ValidationException when the bytes are not a single well-formed JSON value
   */
  public Object parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new ValidationException("$", "JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new ValidationException("$", "invalid JSON payload: " + ex.getMessage(), ex);
    }
  }

  /**
   * Serializes a value preserving map iteration order.
   *
   * @param value map/list/scalar graph; {@code null} writes JSON {@code null}
   * @return UTF-8 JSON bytes
   */
  public byte[] write(Object value) {
    return serialize(value, false);
  }

  /**
   * Serializes a value with object keys sorted recursively.
   *
   * @param value map/list/scalar graph
   * @return deterministic UTF-8 JSON bytes
   */
  public byte[] writeCanonical(Object value) {
    return serialize(value, true);
  }

  private byte[] serialize(Object value, boolean sortKeys) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, value, sortKeys);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize JSON", ex);
    }
    return out.toByteArray();
  }

  private void writeValue(JsonGenerator gen, Object value, boolean sortKeys) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      Map<?, ?> ordered = sortKeys ? sorted(map) : map;
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : ordered.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue(), sortKeys);
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item, sortKeys);
      }
      gen.writeEndArray();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static Map<String, Object> sorted(Map<?, ?> map) {
    Map<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      sorted.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return sorted;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new ValidationException("$", "unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new ValidationException("$", "expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
