package org.fpbase.client.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of spectrum subtypes published by FPbase.
 * <p><strong>Why:</strong> Lets callers select excitation, emission, or filter curves without comparing raw codes.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by the schema layer and {@link State}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum SpectrumType {
  /** Two-photon excitation cross-section. */
  A_2P("A_2P"),
  /** Multi-band filter transmission. */
  BM("BM"),
  /** Bandpass filter transmission. */
  BP("BP"),
  /** Beamsplitter transmission. */
  BS("BS"),
  /** Bandpass excitation filter transmission. */
  BX("BX"),
  /** Fluorescence emission. */
  EM("EM"),
  /** Fluorescence excitation. */
  EX("EX"),
  /** Longpass filter transmission. */
  LP("LP"),
  /** Light source power density. */
  PD("PD"),
  /** Camera quantum efficiency. */
  QE("QE"),
  /** Absorption. */
  AB("AB");

  private final String code;

  SpectrumType(String code) {
    this.code = code;
  }

  /**
   * Returns the wire code used by the GraphQL API.
   *
   * @return wire code such as {@code EX}
   */
  public String code() {
    return code;
  }

  /**
   * Looks up a subtype by its wire code.
   *
   * @param code wire code; case-sensitive
   * @return matching subtype, or empty when the code is unknown
   */
  public static Optional<SpectrumType> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (SpectrumType type : values()) {
      if (type.code.equals(code)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Lists every accepted wire code, in declaration order.
   *
   * @return immutable list of codes
   */
  public static List<String> codes() {
    return Arrays.stream(values()).map(SpectrumType::code).toList();
  }

  @Override
  public String toString() {
    return code;
  }
}
