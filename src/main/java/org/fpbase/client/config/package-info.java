/**
 * <strong>Purpose:</strong> Client configuration: the immutable {@link org.fpbase.client.config.ClientConfig}
 * record and its YAML/system-property loader.
 * <p><strong>Errors:</strong> Invalid values raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.config;
