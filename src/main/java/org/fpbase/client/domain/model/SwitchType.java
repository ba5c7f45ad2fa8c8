package org.fpbase.client.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Photoswitching behaviour of a protein ({@code switchType} on the wire).
 *
 * @since 0.1.0
 */
public enum SwitchType {
  BASIC("B"),
  PHOTOACTIVATABLE("PA"),
  PHOTOSWITCHABLE("PS"),
  PHOTOCONVERTIBLE("PC"),
  MULTIPHOTOCHROMIC("MP"),
  TIMER("T"),
  OTHER("O");

  private final String code;

  SwitchType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Looks up a switch type by wire code.
   *
   * @param code wire code such as {@code PA}
   * @return matching type, or empty when unknown
   */
  public static Optional<SwitchType> fromCode(String code) {
    return Arrays.stream(values()).filter(s -> s.code.equals(code)).findFirst();
  }

  public static List<String> codes() {
    return Arrays.stream(values()).map(SwitchType::code).toList();
  }
}
