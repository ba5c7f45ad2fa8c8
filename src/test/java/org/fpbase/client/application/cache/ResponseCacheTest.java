package org.fpbase.client.application.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.fpbase.client.application.port.TransportException;
import org.fpbase.client.application.port.TransportPort;
import org.fpbase.client.application.schema.JsonSupport;
import org.fpbase.client.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResponseCacheTest {
  private static final URI ENDPOINT = URI.create("https://fpbase.test/graphql/");
  private static final String QUERY = "query getDye($id: Int!) { dye(id: $id) { id } }";

  private final List<byte[]> payloads = new ArrayList<>();
  private final AtomicInteger calls = new AtomicInteger();
  private RecordingMetricsPort metrics;
  private ResponseCache cache;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    TransportPort transport = (endpoint, payload) -> {
      payloads.add(payload);
      return ("{\"data\":{\"n\":" + calls.incrementAndGet() + "}}").getBytes(StandardCharsets.UTF_8);
    };
    cache = new ResponseCache(transport, new JsonSupport(), metrics);
  }

  @Test
  void hitReturnsStoredBodyWithoutTransportCall() {
    byte[] first = cache.getOrFetch(ENDPOINT, QUERY, Map.of("id", 1));
    byte[] second = cache.getOrFetch(ENDPOINT, QUERY, Map.of("id", 1));

    assertArrayEquals(first, second);
    assertEquals(1, calls.get());
    assertEquals(1, metrics.count("cache.miss"));
    assertEquals(1, metrics.count("cache.hit"));
    assertEquals(1, cache.size());
  }

  @Test
  void differentVariablesAreDifferentEntries() {
    cache.getOrFetch(ENDPOINT, QUERY, Map.of("id", 1));
    cache.getOrFetch(ENDPOINT, QUERY, Map.of("id", 2));

    assertEquals(2, calls.get());
    assertEquals(2, cache.size());
  }

  @Test
  void variableOrderDoesNotAffectKey() {
    Map<String, Object> forward = new LinkedHashMap<>();
    forward.put("a", 1);
    forward.put("b", "x");
    Map<String, Object> reverse = new LinkedHashMap<>();
    reverse.put("b", "x");
    reverse.put("a", 1);

    assertEquals(cache.keyFor(ENDPOINT, QUERY, forward), cache.keyFor(ENDPOINT, QUERY, reverse));
  }

  @Test
  void keyDependsOnEndpointAndQuery() {
    String base = cache.keyFor(ENDPOINT, QUERY, Map.of());

    assertNotEquals(base, cache.keyFor(URI.create("https://other.test/graphql/"), QUERY, Map.of()));
    assertNotEquals(base, cache.keyFor(ENDPOINT, QUERY + " ", Map.of()));
    assertEquals(base, cache.keyFor(ENDPOINT, QUERY, null));
    assertTrue(base.matches("[0-9a-f]{64}"), base);
  }

  @Test
  void payloadCarriesQueryAndVariables() {
    cache.getOrFetch(ENDPOINT, QUERY, Map.of("id", 7));

    @SuppressWarnings("unchecked")
    Map<String, Object> payload = (Map<String, Object>) new JsonSupport().parse(payloads.get(0));
    assertEquals(QUERY, payload.get("query"));
    assertEquals(Map.of("id", 7), payload.get("variables"));
  }

  @Test
  void failuresAreNotStored() {
    AtomicInteger attempts = new AtomicInteger();
    ResponseCache failing = new ResponseCache((endpoint, payload) -> {
      if (attempts.incrementAndGet() == 1) {
        throw new TransportException("boom", 500);
      }
      return "{}".getBytes(StandardCharsets.UTF_8);
    }, new JsonSupport(), metrics);

    assertThrows(TransportException.class, () -> failing.getOrFetch(ENDPOINT, QUERY, Map.of()));
    assertEquals(0, failing.size());
    failing.getOrFetch(ENDPOINT, QUERY, Map.of());
    assertEquals(2, attempts.get());
    assertEquals(1, failing.size());
  }

  @Test
  void clearDropsEntries() {
    cache.getOrFetch(ENDPOINT, QUERY, Map.of());
    cache.clear();
    cache.getOrFetch(ENDPOINT, QUERY, Map.of());

    assertEquals(2, calls.get());
  }
}
