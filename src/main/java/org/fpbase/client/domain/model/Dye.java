package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Synthetic dye. FPbase inlines a dye's spectral fields; the schema layer folds them into one state.
 *
 * @param id dye identifier; never {@code null}
 * @param name display name; never {@code null}
 * @param states states in payload order; never {@code null}
 * @param defaultState default state; {@code null} only when {@code states} is empty
 * @since 0.1.0
 */
public record Dye(String id, String name, List<State> states, State defaultState) implements Fluorophore {

  public Dye {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    states = states == null ? List.of() : List.copyOf(states);
    Fluorophore.checkDefaultState(states, defaultState);
  }

  @Override
  public FluorophoreType type() {
    return FluorophoreType.DYE;
  }
}
