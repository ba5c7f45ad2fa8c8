package org.fpbase.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Fluorescent protein with sequence, cross-references, and literature.
 * <p><strong>Thread-safety:</strong> Immutable; list components are defensively copied.</p>
 *
 * @param id protein identifier (short opaque code); never {@code null}
 * @param name display name; never {@code null}
 * @param states states in payload order; never {@code null}
 * @param defaultState default state; {@code null} only when {@code states} is empty
 * @param seq amino-acid sequence; may be {@code null}
 * @param pdb PDB identifiers; never {@code null}
 * @param genbank GenBank accession; may be {@code null}
 * @param uniprot UniProt accession; may be {@code null}
 * @param agg oligomerization state; may be {@code null}
 * @param switchType photoswitching type; may be {@code null}
 * @param primaryReference primary literature reference; may be {@code null}
 * @param references secondary references; never {@code null}
 * @since 0.1.0
 */
public record Protein(
    String id,
    String name,
    List<State> states,
    State defaultState,
    String seq,
    List<String> pdb,
    String genbank,
    String uniprot,
    OligomerizationState agg,
    SwitchType switchType,
    Reference primaryReference,
    List<Reference> references) implements Fluorophore {

  public Protein {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
    states = states == null ? List.of() : List.copyOf(states);
    pdb = pdb == null ? List.of() : List.copyOf(pdb);
    references = references == null ? List.of() : List.copyOf(references);
    Fluorophore.checkDefaultState(states, defaultState);
  }

  @Override
  public FluorophoreType type() {
    return FluorophoreType.PROTEIN;
  }

  /**
   * Optional view of {@link #primaryReference()}.
   *
   * @return primary reference when present
   */
  public Optional<Reference> findPrimaryReference() {
    return Optional.ofNullable(primaryReference);
  }
}
