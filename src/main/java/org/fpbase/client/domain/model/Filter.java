package org.fpbase.client.domain.model;

import java.util.Objects;

/**
 * Optical filter with its transmission spectrum.
 *
 * @param id filter identifier; never {@code null}
 * @param name display name such as {@code Chroma ET525/50m}; never {@code null}
 * @param spectrum transmission spectrum; never {@code null}
 * @param manufacturer manufacturer name; empty when unknown
 * @param bandCenter band center in nanometers; may be {@code null}
 * @param bandWidth band width in nanometers; may be {@code null}
 * @param edge edge wavelength in nanometers for long/shortpass filters; may be {@code null}
 * @since 0.1.0
 */
public record Filter(
    String id,
    String name,
    Spectrum spectrum,
    String manufacturer,
    Double bandCenter,
    Double bandWidth,
    Double edge) implements SpectrumOwner {

  public Filter {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    spectrum = Objects.requireNonNull(spectrum, "spectrum");
    manufacturer = manufacturer == null ? "" : manufacturer;
  }
}
