package org.fpbase.client.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Aggregation tag reported for a protein ({@code agg} on the wire).
 *
 * @since 0.1.0
 */
public enum OligomerizationState {
  MONOMER("M"),
  DIMER("D"),
  TANDEM_DIMER("TD"),
  WEAK_DIMER("WD"),
  TETRAMER("T");

  private final String code;

  OligomerizationState(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Looks up a state by wire code.
   *
   * @param code wire code such as {@code WD}
   * @return matching state, or empty when unknown
   */
  public static Optional<OligomerizationState> fromCode(String code) {
    return Arrays.stream(values()).filter(s -> s.code.equals(code)).findFirst();
  }

  public static List<String> codes() {
    return Arrays.stream(values()).map(OligomerizationState::code).toList();
  }
}
