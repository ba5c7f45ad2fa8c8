package org.fpbase.client.domain.model;

import java.util.Objects;

/**
 * Literature reference identified by DOI.
 *
 * @param doi digital object identifier, e.g. {@code 10.1038/nmeth.4074}; never {@code null}
 * @since 0.1.0
 */
public record Reference(String doi) {
  private static final String RESOLVER = "https://doi.org/";

  public Reference {
    doi = Objects.requireNonNull(doi, "doi");
  }

  /**
   * Returns the resolver URL for the DOI.
   *
   * @return {@code https://doi.org/<doi>}
   */
  public String url() {
    return RESOLVER + doi;
  }
}
