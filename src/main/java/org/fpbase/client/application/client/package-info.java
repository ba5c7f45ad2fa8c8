/**
 * <strong>Purpose:</strong> The public client facade and the fixed GraphQL documents it sends.
 * <p><strong>Entry point:</strong> {@link org.fpbase.client.application.client.FpbaseClient#instance()} for the shared
 * client, or a constructor for isolated instances.
 *
 * @since 0.1.0
 */
package org.fpbase.client.application.client;
