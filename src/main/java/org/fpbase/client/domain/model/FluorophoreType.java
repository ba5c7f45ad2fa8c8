package org.fpbase.client.domain.model;

/**
 * Discriminates the two fluorophore families stored in the combined lookup table.
 *
 * @since 0.1.0
 */
public enum FluorophoreType {
  /** Synthetic dye; fetched with the dye query. */
  DYE,
  /** Fluorescent protein; fetched with the protein query. */
  PROTEIN
}
