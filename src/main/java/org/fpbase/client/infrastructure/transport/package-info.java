/**
 * HTTP implementation of the transport port using {@code java.net.http}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.infrastructure.transport;
