/**
 * <strong>Purpose:</strong> Command-line adapter for the FPbase client.
 * <p><strong>Exit codes:</strong> See {@link org.fpbase.client.api.ExitCode}; exceptions from the client map onto them.
 *
 * @since 0.1.0
 */
package org.fpbase.client.api;
