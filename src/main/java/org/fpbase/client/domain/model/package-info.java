/**
 * <strong>Purpose:</strong> Immutable FPbase domain records returned by the client facade.
 * <p><strong>Concurrency:</strong> Records are immutable; collections are defensively copied.
 * <p><strong>Invariants:</strong> spectrum data and list fields are never {@code null}; a fluorophore's
 * default state is always one of its own states.
 *
 * @since 0.1.0
 */
package org.fpbase.client.domain.model;
