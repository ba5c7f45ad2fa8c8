/**
 * <strong>Purpose:</strong> Schema layer turning GraphQL response bytes into validated domain records.
 * <p><strong>Pipeline role:</strong> {@link org.fpbase.client.application.schema.JsonSupport} parses,
 * {@link org.fpbase.client.application.schema.PayloadNormalizer} reshapes the loose graph, and
 * {@link org.fpbase.client.application.schema.EntityDecoder} validates it strictly.
 * <p><strong>Errors:</strong> Shape mismatches raise {@link org.fpbase.client.application.schema.ValidationException}
 * with a field path such as {@code data.protein.states[0].name}.
 *
 * @since 0.1.0
 */
package org.fpbase.client.application.schema;
