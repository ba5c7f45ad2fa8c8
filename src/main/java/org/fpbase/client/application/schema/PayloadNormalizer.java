package org.fpbase.client.application.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Pre-validation transforms applied to loosely typed GraphQL payloads.
 * <p><strong>Why:</strong> FPbase returns {@code null} for empty lists and inlines a dye's spectral fields instead of
 * nesting a single state; both are reshaped here so {@link EntityDecoder} can validate one strict shape.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Replace {@code null} values of list-valued fields with empty lists, at any depth.</li>
 *   <li>Fold the inlined fields of a single-state fluorophore into {@code states} and {@code defaultState}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; inputs are copied, never mutated.</p>
 *
 * @since 0.1.0
 */
public final class PayloadNormalizer {
  /** Fields whose payload value is a list; {@code null} becomes an empty list. */
  static final Set<String> LIST_FIELDS = Set.of(
      "spectra", "states", "data", "pdb", "references", "filters", "opticalConfigs");

  /** Inlined fields copied into the synthesized state of a single-state fluorophore. */
  static final List<String> STATE_FIELDS = List.of(
      "id", "name", "exMax", "emMax", "exhex", "emhex", "extCoeff", "qy", "lifetime", "spectra");

  /**
   * Returns a deep copy of {@code value} with {@code null} list fields replaced by empty lists.
   *
   * @param value map/list/scalar graph; may be {@code null}
   * @return normalized copy
   */
  public Object coerceNullLists(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String key = String.valueOf(entry.getKey());
        Object child = entry.getValue();
        if (child == null && LIST_FIELDS.contains(key)) {
          copy.put(key, new ArrayList<>());
        } else {
          copy.put(key, coerceNullLists(child));
        }
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(coerceNullLists(item));
      }
      return copy;
    }
    return value;
  }

  /**
   * Synthesizes {@code states} and {@code defaultState} for a fluorophore whose spectral fields are inlined.
   *
   * <p>Applies only when the payload has no {@code states} key and does carry an {@code exMax} key; otherwise a
   * copy of the payload is returned unchanged.</p>
   *
   * @param fluorophore fluorophore object as decoded from JSON; never {@code null}
   * @return copy with a single nested state when synthesis applied
   */
  public Map<String, Object> inlineSingleState(Map<String, Object> fluorophore) {
    Map<String, Object> out = new LinkedHashMap<>(fluorophore);
    if (fluorophore.containsKey("states") || !fluorophore.containsKey("exMax")) {
      return out;
    }
    Map<String, Object> state = new LinkedHashMap<>();
    for (String field : STATE_FIELDS) {
      if (fluorophore.containsKey(field)) {
        state.put(field, fluorophore.get(field));
      }
    }
    out.put("states", new ArrayList<>(List.of(state)));
    out.put("defaultState", state);
    return out;
  }

  /**
   * Applies every transform to a fluorophore payload: list coercion first, then state synthesis.
   *
   * @param fluorophore fluorophore object as decoded from JSON
   * @return normalized copy
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> normalizeFluorophore(Map<String, Object> fluorophore) {
    Map<String, Object> coerced = (Map<String, Object>) coerceNullLists(fluorophore);
    return inlineSingleState(coerced);
  }
}
