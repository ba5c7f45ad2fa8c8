package org.fpbase.client.config;

import java.util.Objects;
import org.fpbase.client.application.client.FpbaseClient;
import org.fpbase.client.application.port.MetricsPort;
import org.fpbase.client.application.port.TransportPort;
import org.fpbase.client.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.fpbase.client.infrastructure.transport.HttpTransportAdapter;

/**
 * <strong>What:</strong> Wires an {@link FpbaseClient} to concrete adapters from a {@link ClientConfig}.
 * <p><strong>Role:</strong> The only place that names infrastructure classes; the facade sees ports only.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each call to {@link #createClient()} builds an independent client
 * with its own cache and lookup tables.</p>
 *
 * @since 0.1.0
 * @see ClientConfigLoader
 */
public final class CompositionRoot {
  private final ClientConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a root whose metrics port follows the configured exporter.
   *
   * @param config client configuration; never {@code null}
   */
  public CompositionRoot(ClientConfig config) {
    this(config, OpenTelemetryMetricsAdapter.forConfig(Objects.requireNonNull(config, "config")));
  }

  CompositionRoot(ClientConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the JDK HTTP transport with the configured timeouts and user agent.
   *
   * @return transport adapter
   */
  public TransportPort transport() {
    return new HttpTransportAdapter(config, metrics);
  }

  /**
   * Builds a client against the configured endpoint.
   *
   * @return new client
   */
  public FpbaseClient createClient() {
    return new FpbaseClient(config.endpoint(), transport(), metrics);
  }
}
