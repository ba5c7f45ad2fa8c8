package org.fpbase.client.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Light path a filter occupies inside an optical configuration.
 *
 * @since 0.1.0
 */
public enum FilterPath {
  /** Excitation path. */
  EX,
  /** Emission path. */
  EM,
  /** Beamsplitter between the two paths. */
  BS;

  /**
   * Looks up a path by its wire code.
   *
   * @param code wire code such as {@code EM}
   * @return matching path, or empty when unknown
   */
  public static Optional<FilterPath> fromCode(String code) {
    return Arrays.stream(values()).filter(p -> p.name().equals(code)).findFirst();
  }

  /**
   * Lists accepted wire codes.
   *
   * @return immutable list of codes
   */
  public static List<String> codes() {
    return Arrays.stream(values()).map(Enum::name).toList();
  }
}
