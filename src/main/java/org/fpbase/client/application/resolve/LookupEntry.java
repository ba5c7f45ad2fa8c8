package org.fpbase.client.application.resolve;

import java.util.Objects;
import org.fpbase.client.domain.model.FluorophoreType;

/**
 * Value stored in a resolver table.
 *
 * @param id canonical identifier passed to the detail query; never {@code null}
 * @param displayName name as published by FPbase; never {@code null}
 * @param type fluorophore discriminator; {@code null} for filter, camera, and light tables
 * @since 0.1.0
 */
public record LookupEntry(String id, String displayName, FluorophoreType type) {
  public LookupEntry {
    id = Objects.requireNonNull(id, "id");
    displayName = Objects.requireNonNull(displayName, "displayName");
  }
}
