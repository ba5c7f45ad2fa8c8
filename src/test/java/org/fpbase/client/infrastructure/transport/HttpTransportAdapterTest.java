package org.fpbase.client.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.fpbase.client.application.port.TransportException;
import org.fpbase.client.config.ClientConfig;
import org.fpbase.client.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpTransportAdapterTest {
  private HttpServer server;

  @AfterEach
  void stopServer() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void postsJsonWithHeadersAndReturnsBody() throws IOException {
    AtomicReference<String> method = new AtomicReference<>();
    AtomicReference<String> contentType = new AtomicReference<>();
    AtomicReference<String> accept = new AtomicReference<>();
    AtomicReference<String> userAgent = new AtomicReference<>();
    AtomicReference<String> body = new AtomicReference<>();
    URI endpoint = start(200, "{\"data\":{}}", exchange -> {
      method.set(exchange.getRequestMethod());
      contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      accept.set(exchange.getRequestHeaders().getFirst("Accept"));
      userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
      body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    });
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    HttpTransportAdapter adapter = new HttpTransportAdapter(config("lab-scripts/2.0"), metrics);

    byte[] response = adapter.post(endpoint, "{\"query\":\"{ x }\"}".getBytes(StandardCharsets.UTF_8));

    assertArrayEquals("{\"data\":{}}".getBytes(StandardCharsets.UTF_8), response);
    assertEquals("POST", method.get());
    assertEquals("application/json", contentType.get());
    assertEquals("application/json", accept.get());
    assertEquals("lab-scripts/2.0", userAgent.get());
    assertEquals("{\"query\":\"{ x }\"}", body.get());
    assertEquals(1, metrics.count("transport.request"));
    assertEquals(0, metrics.count("transport.failure"));
    assertEquals(1, metrics.observed("transport.latencyNanos").size());
  }

  @Test
  void nonSuccessStatusCarriesStatusAndBodyExcerpt() throws IOException {
    URI endpoint = start(502, "upstream unavailable", exchange -> {});
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    HttpTransportAdapter adapter = new HttpTransportAdapter(config("fpbase-java"), metrics);

    TransportException ex = assertThrows(TransportException.class,
        () -> adapter.post(endpoint, "{}".getBytes(StandardCharsets.UTF_8)));

    assertEquals(502, ex.statusCode());
    assertTrue(ex.getMessage().contains("HTTP 502"), ex.getMessage());
    assertTrue(ex.getMessage().contains("upstream unavailable"), ex.getMessage());
    assertEquals(1, metrics.count("transport.failure"));
  }

  @Test
  void connectionFailureHasNoStatus() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    int port = server.getAddress().getPort();
    server.stop(0);
    server = null;
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    HttpTransportAdapter adapter = new HttpTransportAdapter(config("fpbase-java"), metrics);

    TransportException ex = assertThrows(TransportException.class,
        () -> adapter.post(URI.create("http://127.0.0.1:" + port + "/graphql/"), new byte[0]));

    assertEquals(TransportException.NO_STATUS, ex.statusCode());
    assertTrue(ex.getCause() instanceof IOException);
    assertEquals(1, metrics.count("transport.failure"));
  }

  @Test
  void interruptedCallerKeepsInterruptFlag() throws IOException {
    URI endpoint = start(200, "{}", exchange -> {});
    HttpTransportAdapter adapter = new HttpTransportAdapter(config("fpbase-java"), new RecordingMetricsPort());

    Thread.currentThread().interrupt();
    try {
      TransportException ex = assertThrows(TransportException.class, () -> adapter.post(endpoint, new byte[0]));
      assertTrue(ex.getCause() instanceof InterruptedException);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  private static ClientConfig config(String userAgent) {
    return new ClientConfig(ClientConfig.DEFAULT_ENDPOINT, userAgent, Duration.ofSeconds(2), Duration.ofSeconds(5),
        ClientConfig.EXPORTER_NONE);
  }

  private URI start(int status, String responseBody, ExchangeInspector inspector) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/graphql/",
        exchange -> {
          inspector.inspect(exchange);
          byte[] response = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, response.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(response);
          }
        });
    server.start();
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/graphql/");
  }

  @FunctionalInterface
  private interface ExchangeInspector {
    void inspect(HttpExchange exchange) throws IOException;
  }
}
