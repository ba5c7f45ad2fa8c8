package org.fpbase.client.application.resolve;

import java.util.Locale;

/**
 * Entity families that own a resolver table, with their key normalization rule.
 *
 * @since 0.1.0
 */
public enum LookupFamily {
  /** Dyes and proteins combined; keys are lower-cased. */
  FLUOROPHORE("Fluorophore", null),
  /** Filters, listed through spectra of category {@code F}. */
  FILTER("Filter", "F"),
  /** Cameras, listed through spectra of category {@code C}. */
  CAMERA("Camera", "C"),
  /** Light sources, listed through spectra of category {@code L}. */
  LIGHT("Light source", "L");

  private final String label;
  private final String spectrumCategory;

  LookupFamily(String label, String spectrumCategory) {
    this.label = label;
    this.spectrumCategory = spectrumCategory;
  }

  /**
   * Returns the human-readable family name used in error messages.
   *
   * @return label such as {@code Filter}
   */
  public String label() {
    return label;
  }

  /**
   * Returns the spectrum category code used by the listing query.
   *
   * @return {@code F}, {@code C}, {@code L}; {@code null} for {@link #FLUOROPHORE}
   */
  public String spectrumCategory() {
    return spectrumCategory;
  }

  /**
   * Normalizes a name into a lookup key for this family.
   *
   * <p>Fluorophore keys are lower-cased. Filter, camera, and light keys are lower-cased with every space and every
   * forward slash replaced by a hyphen, so {@code Chroma ET525/50m} becomes {@code chroma-et525-50m}.</p>
   *
   * @param name raw name; never {@code null}
   * @return normalized key
   */
  public String normalize(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    if (this == FLUOROPHORE) {
      return lower;
    }
    return lower.replace(' ', '-').replace('/', '-');
  }
}
