package org.fpbase.client.application.port;

import java.net.URI;

/**
 * <strong>What:</strong> Port issuing one request/response cycle against the GraphQL endpoint.
 * <p><strong>Why:</strong> Keeps HTTP semantics, TLS, and connection reuse outside the application layer so tests can
 * substitute recorded responses.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code HttpTransportAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>POST a JSON payload and return the raw response body on success.</li>
 *   <li>Fail with {@link TransportException} on non-2xx status or connectivity failure.</li>
 *   <li>Make exactly one attempt; callers own any retry policy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportPort {
  /**
   * Posts a JSON payload to the endpoint.
   *
   * @param endpoint GraphQL endpoint; never {@code null}
   * @param jsonPayload UTF-8 encoded {@code {"query": ..., "variables": ...}} document; never {@code null}
   * @return raw response body
   * @throws TransportException on non-success status or connectivity failure
   */
  byte[] post(URI endpoint, byte[] jsonPayload);
}
