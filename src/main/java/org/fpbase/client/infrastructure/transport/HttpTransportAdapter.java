package org.fpbase.client.infrastructure.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.fpbase.client.application.port.MetricsPort;
import org.fpbase.client.application.port.TransportException;
import org.fpbase.client.application.port.TransportPort;
import org.fpbase.client.config.ClientConfig;
import org.fpbase.client.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransportPort} backed by the JDK {@link HttpClient}.
 * <p><strong>Role:</strong> Sole network adapter of the client; everything above it is offline-testable.</p>
 * <p><strong>Behavior:</strong> One synchronous POST per call with JSON content negotiation headers and the
 * configured {@code User-Agent}. No retries. Non-2xx statuses, I/O failures, timeouts, and interruption all surface
 * as {@link TransportException}; interruption also restores the thread's interrupt flag.</p>
 * <p><strong>Thread-safety:</strong> The underlying {@link HttpClient} is thread-safe; so is this adapter.</p>
 * <p><strong>Observability:</strong> Emits {@code transport.request}, {@code transport.failure}, and
 * {@code transport.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class HttpTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(HttpTransportAdapter.class);
  private static final String JSON = "application/json";

  private final HttpClient client;
  private final String userAgent;
  private final Duration requestTimeout;
  private final MetricsPort metrics;

  /**
   * Creates an adapter with timeouts and user agent taken from the configuration.
   *
   * @param config client configuration; never {@code null}
   * @param metrics metrics sink; never {@code null}
   */
  public HttpTransportAdapter(ClientConfig config, MetricsPort metrics) {
    this(HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(config, "config").connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        config.userAgent(),
        config.requestTimeout(),
        metrics);
  }

  HttpTransportAdapter(HttpClient client, String userAgent, Duration requestTimeout, MetricsPort metrics) {
    this.client = Objects.requireNonNull(client, "client");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public byte[] post(URI endpoint, byte[] jsonPayload) {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(jsonPayload, "jsonPayload");
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(requestTimeout)
        .header("Content-Type", JSON)
        .header("Accept", JSON)
        .header("User-Agent", userAgent)
        .POST(HttpRequest.BodyPublishers.ofByteArray(jsonPayload))
        .build();

    metrics.increment("transport.request");
    long start = System.nanoTime();
    HttpResponse<byte[]> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException ex) {
      metrics.increment("transport.failure");
      throw new TransportException("POST " + endpoint + " failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("transport.failure");
      throw new TransportException("POST " + endpoint + " interrupted", ex);
    } finally {
      metrics.observe("transport.latencyNanos", System.nanoTime() - start);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      metrics.increment("transport.failure");
      String excerpt = Logs.excerpt(response.body(), Logs.EXCERPT_BYTES);
      log.debug("POST {} returned HTTP {}: {}", endpoint, status, excerpt);
      throw new TransportException("POST " + endpoint + " returned HTTP " + status + ": " + excerpt, status);
    }
    byte[] body = response.body();
    log.debug("POST {} returned HTTP {} ({} bytes)", endpoint, status, body == null ? 0 : body.length);
    return body == null ? new byte[0] : body;
  }
}
