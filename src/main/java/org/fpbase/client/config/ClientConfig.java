package org.fpbase.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.fpbase.client.validation.Strings;

/**
 * Immutable settings for an {@code FpbaseClient}.
 *
 * @param endpoint GraphQL endpoint; must use http or https
 * @param userAgent value of the {@code User-Agent} header
 * @param connectTimeout TCP connect timeout; positive
 * @param requestTimeout whole-request timeout; positive
 * @param metricsExporter {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record ClientConfig(
    URI endpoint,
    String userAgent,
    Duration connectTimeout,
    Duration requestTimeout,
    String metricsExporter) {

  /** Public FPbase GraphQL endpoint. */
  public static final URI DEFAULT_ENDPOINT = URI.create("https://www.fpbase.org/graphql/");
  /** Default {@code User-Agent} header value. */
  public static final String DEFAULT_USER_AGENT = "fpbase-java";
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final String EXPORTER_NONE = "none";
  public static final String EXPORTER_OTLP = "otlp";

  public ClientConfig {
    Objects.requireNonNull(endpoint, "endpoint");
    String scheme = endpoint.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("endpoint must use http or https scheme");
    }
    if (endpoint.getHost() == null || endpoint.getHost().isBlank()) {
      throw new IllegalArgumentException("endpoint must include a host");
    }
    userAgent = Strings.requirePrintableAscii("userAgent", userAgent, 256);
    requirePositive("connectTimeout", connectTimeout);
    requirePositive("requestTimeout", requestTimeout);
    String exporter = Strings.requireNonBlank("metricsExporter", metricsExporter).toLowerCase(Locale.ROOT);
    if (!exporter.equals(EXPORTER_NONE) && !exporter.equals(EXPORTER_OTLP)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    metricsExporter = exporter;
  }

  /**
   * Returns the built-in defaults: public endpoint, {@code fpbase-java}, 10 s connect, 30 s request, no metrics.
   *
   * @return default configuration
   */
  public static ClientConfig defaults() {
    return new ClientConfig(
        DEFAULT_ENDPOINT, DEFAULT_USER_AGENT, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, EXPORTER_NONE);
  }

  public boolean metricsEnabled() {
    return EXPORTER_OTLP.equals(metricsExporter);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
