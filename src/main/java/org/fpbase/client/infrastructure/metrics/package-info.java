/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the metrics port.
 * <p><strong>Configuration:</strong> Disabled unless the client config selects the {@code otlp} exporter.
 *
 * @since 0.1.0
 */
package org.fpbase.client.infrastructure.metrics;
