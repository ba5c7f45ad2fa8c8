package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Microscope and its optical configurations.
 *
 * @param id opaque microscope identifier, e.g. {@code wKqWbgApvguSNDSRZNSfpN}; never {@code null}
 * @param name display name; never {@code null}
 * @param opticalConfigs configurations in payload order; never {@code null}
 * @since 0.1.0
 */
public record Microscope(String id, String name, List<OpticalConfig> opticalConfigs) {
  public Microscope {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    opticalConfigs = opticalConfigs == null ? List.of() : List.copyOf(opticalConfigs);
  }

  /**
   * Finds an optical configuration by exact name.
   *
   * @param configName configuration name
   * @return matching configuration when present
   */
  public Optional<OpticalConfig> findOpticalConfig(String configName) {
    return opticalConfigs.stream().filter(c -> c.name().equals(configName)).findFirst();
  }
}
