package org.fpbase.client.domain.model;

/**
 * Capability shared by hardware records that own exactly one spectrum.
 *
 * @since 0.1.0
 * @see Filter
 * @see Camera
 * @see LightSource
 */
public interface SpectrumOwner {
  /**
   * Returns the FPbase identifier of the owner.
   *
   * @return identifier; never {@code null}
   */
  String id();

  /**
   * Returns the display name.
   *
   * @return name; never {@code null}
   */
  String name();

  /**
   * Returns the owned spectrum.
   *
   * @return spectrum; never {@code null}
   */
  Spectrum spectrum();
}
