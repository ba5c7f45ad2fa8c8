/**
 * <strong>Purpose:</strong> Name resolution: cached lookup tables per entity family, normalization rules, and fuzzy
 * "did you mean" suggestions.
 * <p><strong>Concurrency:</strong> Tables are immutable once built; the resolver builds each at most once.
 * <p><strong>Errors:</strong> Misses raise {@link org.fpbase.client.application.resolve.NotFoundException}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.application.resolve;
