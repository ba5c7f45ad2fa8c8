package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Dye or protein with one or more photophysical {@link State}s.
 * <p><strong>Role:</strong> Common view returned by name lookups that may resolve to either family.</p>
 * <p><strong>Invariant:</strong> when present, {@link #defaultState()} is one of {@link #states()}.</p>
 *
 * @since 0.1.0
 * @see Dye
 * @see Protein
 */
public interface Fluorophore {
  /**
   * Returns the FPbase identifier.
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
   * Returns the states in payload order.
   *
   * @return immutable list; never {@code null}
   */
  List<State> states();

  /**
   * Returns the designated default state.
   *
   * @return default state; {@code null} when the fluorophore has no states
   */
  State defaultState();

  /**
   * Returns the family discriminator.
   *
   * @return {@link FluorophoreType#DYE} or {@link FluorophoreType#PROTEIN}
   */
  FluorophoreType type();

  /**
   * Optional view of {@link #defaultState()}.
   *
   * @return default state when present
   */
  default Optional<State> findDefaultState() {
    return Optional.ofNullable(defaultState());
  }

  /**
   * Picks the default state for a fluorophore from an identifier reference.
   *
   * @param states candidate states; never {@code null}
   * @param defaultId referenced state id; may be {@code null}
   * @return referenced state, else the first state, else {@code null}
   */
  static State resolveDefaultState(List<State> states, String defaultId) {
    if (defaultId != null) {
      for (State state : states) {
        if (defaultId.equals(state.id())) {
          return state;
        }
      }
    }
    return states.isEmpty() ? null : states.get(0);
  }

  /**
   * Enforces the default-state membership invariant for implementations.
   *
   * @param states owned states
   * @param defaultState candidate default
   * @throws IllegalArgumentException when {@code defaultState} is not one of {@code states}
   */
  static void checkDefaultState(List<State> states, State defaultState) {
    if (defaultState != null && !states.contains(defaultState)) {
      throw new IllegalArgumentException(
          "defaultState " + defaultState.id() + " is not one of the fluorophore states");
    }
  }
}
