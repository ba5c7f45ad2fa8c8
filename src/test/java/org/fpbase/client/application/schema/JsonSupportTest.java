package org.fpbase.client.application.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedStructuresPreservingOrder() {
    Object parsed = json.parse(bytes("{\"b\": [1, 2.5, null, true], \"a\": {\"x\": \"y\"}}"));

    Map<?, ?> map = assertInstanceOf(Map.class, parsed);
    assertEquals(List.of("b", "a"), List.copyOf(map.keySet()));
    List<?> list = assertInstanceOf(List.class, map.get("b"));
    assertInstanceOf(Integer.class, list.get(0));
    assertInstanceOf(Double.class, list.get(1));
    assertEquals(Map.of("x", "y"), map.get("a"));
  }

  @Test
  void canonicalOutputSortsKeysRecursively() {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("z", 1);
    inner.put("a", 2);
    Map<String, Object> outer = new LinkedHashMap<>();
    outer.put("variables", inner);
    outer.put("query", "q");

    assertEquals("{\"query\":\"q\",\"variables\":{\"a\":2,\"z\":1}}",
        new String(json.writeCanonical(outer), StandardCharsets.UTF_8));
    assertEquals("{\"variables\":{\"z\":1,\"a\":2},\"query\":\"q\"}",
        new String(json.write(outer), StandardCharsets.UTF_8));
  }

  @Test
  void malformedInputIsAValidationError() {
    ValidationException ex = assertThrows(ValidationException.class, () -> json.parse(bytes("{\"a\": ")));
    assertEquals("$", ex.path());
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
