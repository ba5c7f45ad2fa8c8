package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable wavelength-vs-value curve tagged with a {@link SpectrumType}.
 *
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param id FPbase spectrum identifier; never {@code null}
 * @param subtype spectrum subtype; never {@code null}
 * @param data ordered samples; never {@code null}, possibly empty
 * @param owner filter, camera, or light that owns this spectrum when the query returned one; may be {@code null}
 * @since 0.1.0
 */
public record Spectrum(String id, SpectrumType subtype, List<SpectrumPoint> data, SpectrumOwner owner) {

  /**
   * Validates invariants and defensively copies the sample list.
   */
  public Spectrum {
    id = Objects.requireNonNull(id, "id");
    subtype = Objects.requireNonNull(subtype, "subtype");
    data = data == null ? List.of() : List.copyOf(data);
  }

  /**
   * Creates a spectrum without an owner back-reference.
   *
   * @param id spectrum identifier
   * @param subtype spectrum subtype
   * @param data ordered samples
   */
  public Spectrum(String id, SpectrumType subtype, List<SpectrumPoint> data) {
    this(id, subtype, data, null);
  }

  /**
   * Returns the owning filter, camera, or light source, when known.
   *
   * @return owner navigation link
   */
  public Optional<SpectrumOwner> findOwner() {
    return Optional.ofNullable(owner);
  }

  /**
   * Reports whether this spectrum carries the given subtype.
   *
   * @param type subtype to test
   * @return {@code true} on match
   */
  public boolean is(SpectrumType type) {
    return subtype == type;
  }

  @Override
  public String toString() {
    return "Spectrum[id=" + id + ", subtype=" + subtype + ", points=" + data.size() + "]";
  }
}
