package org.fpbase.client.domain.model;

import java.util.Objects;

/**
 * Camera with its quantum-efficiency spectrum.
 *
 * @param id camera identifier; never {@code null}
 * @param name display name; never {@code null}
 * @param spectrum quantum-efficiency spectrum; never {@code null}
 * @param manufacturer manufacturer name; empty when unknown
 * @since 0.1.0
 */
public record Camera(String id, String name, Spectrum spectrum, String manufacturer)
    implements SpectrumOwner {

  public Camera {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    spectrum = Objects.requireNonNull(spectrum, "spectrum");
    manufacturer = manufacturer == null ? "" : manufacturer;
  }
}
