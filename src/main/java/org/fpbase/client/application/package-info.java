/**
 * <strong>Purpose:</strong> Application layer of the FPbase client: resolution, caching, schema validation,
 * and the client facade.
 * <p><strong>Role:</strong> Depends only on {@link org.fpbase.client.application.port} contracts and
 * {@link org.fpbase.client.domain.model} records; adapters live under {@code infrastructure}.
 * <p><strong>Errors:</strong> All failures derive from {@link org.fpbase.client.application.FpbaseException}
 * apart from argument checks, which raise {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.application;
