package org.fpbase.client.application.cache;

import java.net.URI;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.fpbase.client.application.port.MetricsPort;
import org.fpbase.client.application.port.TransportPort;
import org.fpbase.client.application.schema.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Memoizes successful transport responses keyed by a digest of the logical query.
 * <p><strong>Why:</strong> Repeated lookups within a client's lifetime cost no network round trip and return the same
 * bytes, so decoded entities compare equal.</p>
 * <p><strong>Role:</strong> Sits between the client facade/resolver and {@link TransportPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive a SHA-256 key from the canonical JSON of endpoint, query text, and key-sorted variables.</li>
 *   <li>Delegate misses to the transport and store only successful bodies.</li>
 *   <li>Let transport failures propagate uncached.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by a {@link ConcurrentHashMap}. Two threads missing the same key at once
 * may both fetch; the last body stored wins and both are equal for a static catalog.</p>
 * <p><strong>Memory:</strong> No eviction. Growth is bounded by the FPbase catalog (low thousands of entities) and the
 * lifetime of the owning client; call {@link #clear()} to release it early.</p>
 * <p><strong>Observability:</strong> Emits {@code cache.hit} and {@code cache.miss} counters.</p>
 *
 * @since 0.1.0
 */
public final class ResponseCache {
  private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);
  private static final HexFormat HEX = HexFormat.of();

  private final TransportPort transport;
  private final JsonSupport json;
  private final MetricsPort metrics;
  private final ConcurrentMap<String, byte[]> entries = new ConcurrentHashMap<>();

  /**
   * Creates a cache in front of a transport.
   *
   * @param transport delegate for cache misses; never {@code null}
   * @param json JSON writer used for payloads and keys; never {@code null}
   * @param metrics metrics sink; never {@code null}
   */
  public ResponseCache(TransportPort transport, JsonSupport json, MetricsPort metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the cached body for a query, fetching and storing it on a miss.
   *
   * @param endpoint GraphQL endpoint; never {@code null}
   * @param query query text; never {@code null}
   * @param variables query variables; {@code null} is treated as empty
   * @return raw response body; callers must not mutate the array
   * @throws org.fpbase.client.application.port.TransportException when the fetch fails; nothing is stored
   */
  public byte[] getOrFetch(URI endpoint, String query, Map<String, Object> variables) {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(query, "query");
    Map<String, Object> vars = variables == null ? Map.of() : variables;
    String key = keyFor(endpoint, query, vars);
    byte[] cached = entries.get(key);
    if (cached != null) {
      metrics.increment("cache.hit");
      log.debug("Cache hit for {}", key);
      return cached;
    }
    metrics.increment("cache.miss");
    log.debug("Cache miss for {}; fetching from {}", key, endpoint);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("query", query);
    payload.put("variables", vars);
    byte[] body = transport.post(endpoint, json.write(payload));
    entries.put(key, body);
    return body;
  }

  /**
   * Computes the cache key for a logical query.
   *
   * @param endpoint GraphQL endpoint
   * @param query query text
   * @param variables query variables; key order is irrelevant
   * @return lowercase hex SHA-256 digest
   */
  public String keyFor(URI endpoint, String query, Map<String, Object> variables) {
    Map<String, Object> tuple = new LinkedHashMap<>();
    tuple.put("endpoint", endpoint.toString());
    tuple.put("query", query);
    tuple.put("variables", variables == null ? Map.of() : variables);
    return sha256(json.writeCanonical(tuple));
  }

  /**
   * Returns the number of stored responses.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Drops every stored response.
   */
  public void clear() {
    entries.clear();
  }

  private static String sha256(byte[] bytes) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HEX.formatHex(digest.digest(bytes));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
