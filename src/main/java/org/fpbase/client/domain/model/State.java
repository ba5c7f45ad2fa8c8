package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One photophysical configuration of a fluorophore.
 * <p><strong>Why:</strong> Proteins may expose several states (e.g., on/off, pre/post conversion); dyes expose one.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param id state identifier; never {@code null}
 * @param name state name; never {@code null}
 * @param exMax excitation maximum in nanometers; may be {@code null}
 * @param emMax emission maximum in nanometers; may be {@code null}
 * @param exHex excitation color as a hex code; empty when unknown
 * @param emHex emission color as a hex code; empty when unknown
 * @param extCoeff extinction coefficient in M^-1 cm^-1; may be {@code null}
 * @param qy quantum yield; may be {@code null}
 * @param lifetime fluorescence lifetime in nanoseconds; may be {@code null}
 * @param spectra spectra owned by the state, in payload order; never {@code null}
 * @since 0.1.0
 */
public record State(
    String id,
    String name,
    Double exMax,
    Double emMax,
    String exHex,
    String emHex,
    Double extCoeff,
    Double qy,
    Double lifetime,
    List<Spectrum> spectra) {

  public State {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    exHex = exHex == null ? "" : exHex;
    emHex = emHex == null ? "" : emHex;
    spectra = spectra == null ? List.of() : List.copyOf(spectra);
  }

  /**
   * Returns the excitation spectrum, falling back to the absorption spectrum.
   *
   * @return first {@link SpectrumType#EX} entry, else first {@link SpectrumType#AB} entry, else empty
   */
  public Optional<Spectrum> excitationSpectrum() {
    Optional<Spectrum> excitation = first(SpectrumType.EX);
    return excitation.isPresent() ? excitation : first(SpectrumType.AB);
  }

  /**
   * Returns the emission spectrum.
   *
   * @return first {@link SpectrumType#EM} entry, else empty
   */
  public Optional<Spectrum> emissionSpectrum() {
    return first(SpectrumType.EM);
  }

  private Optional<Spectrum> first(SpectrumType type) {
    return spectra.stream().filter(s -> s.is(type)).findFirst();
  }
}
