/**
 * <strong>Purpose:</strong> Ports connecting the client's application layer to transport and metrics adapters.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe.
 * <p><strong>Errors:</strong> Transport failures surface as {@link org.fpbase.client.application.port.TransportException}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.application.port;
