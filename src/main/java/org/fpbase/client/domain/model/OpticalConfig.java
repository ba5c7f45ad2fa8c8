package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named imaging channel: filters plus optional camera, light source, and laser line.
 *
 * @param name channel name; never {@code null}
 * @param filters filter placements in payload order; never {@code null}
 * @param camera detector; may be {@code null}
 * @param light light source; may be {@code null}
 * @param laser laser wavelength in nanometers; may be {@code null}
 * @since 0.1.0
 */
public record OpticalConfig(
    String name,
    List<FilterPlacement> filters,
    Camera camera,
    LightSource light,
    Integer laser) {

  public OpticalConfig {
    name = Objects.requireNonNull(name, "name");
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public Optional<Camera> findCamera() {
    return Optional.ofNullable(camera);
  }

  public Optional<LightSource> findLight() {
    return Optional.ofNullable(light);
  }
}
