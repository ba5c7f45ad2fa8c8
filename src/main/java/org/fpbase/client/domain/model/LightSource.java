package org.fpbase.client.domain.model;

import java.util.Objects;

/**
 * Light source with its power-density spectrum.
 *
 * @param id light identifier; never {@code null}
 * @param name display name; never {@code null}
 * @param spectrum power-density spectrum; never {@code null}
 * @param manufacturer manufacturer name; empty when unknown
 * @since 0.1.0
 */
public record LightSource(String id, String name, Spectrum spectrum, String manufacturer)
    implements SpectrumOwner {

  public LightSource {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    spectrum = Objects.requireNonNull(spectrum, "spectrum");
    manufacturer = manufacturer == null ? "" : manufacturer;
  }
}
