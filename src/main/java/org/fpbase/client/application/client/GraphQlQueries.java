package org.fpbase.client.application.client;

/**
 * Static GraphQL documents sent to the FPbase endpoint.
 *
 * <p>Detail queries select every field the schema layer validates; listing queries feed the name resolver.</p>
 *
 * @since 0.1.0
 */
public final class GraphQlQueries {
  private static final String SPECTRUM_FIELDS = "spectrum { id subtype data }";

  /** Microscope by opaque id, with nested optical configurations; variable {@code id: String!}. */
  public static final String MICROSCOPE = """
      query getMicroscope($id: String!) {
        microscope(id: $id) {
          id
          name
          opticalConfigs {
            name
            filters {
              path
              reflects
              filter { id name manufacturer bandcenter bandwidth edge %1$s }
            }
            camera { id name manufacturer %1$s }
            light { id name manufacturer %1$s }
            laser
          }
        }
      }
      """.formatted(SPECTRUM_FIELDS);

  /** Dye by numeric id; spectral fields are inlined on the dye. Variable {@code id: Int!}. */
  public static final String DYE = """
      query getDye($id: Int!) {
        dye(id: $id) {
          id
          name
          exMax
          emMax
          exhex
          emhex
          extCoeff
          qy
          lifetime
          spectra { id subtype data }
        }
      }
      """;

  /** Protein by string id with states, cross-references, and literature. Variable {@code id: String!}. */
  public static final String PROTEIN = """
      query getProtein($id: String!) {
        protein(id: $id) {
          id
          name
          seq
          pdb
          genbank
          uniprot
          agg
          switchType
          primaryReference { doi }
          references { doi }
          states {
            id
            name
            exMax
            emMax
            exhex
            emhex
            extCoeff
            qy
            lifetime
            spectra { id subtype data }
          }
          defaultState { id }
        }
      }
      """;

  /**
   * Spectrum by numeric id with its polymorphic owner; at most one owner field is populated.
   * Variable {@code id: Int!}.
   */
  public static final String SPECTRUM = """
      query getSpectrum($id: Int!) {
        spectrum(id: $id) {
          id
          subtype
          data
          ownerFilter { id name manufacturer bandcenter bandwidth edge %1$s }
          ownerCamera { id name manufacturer %1$s }
          ownerLight { id name manufacturer %1$s }
        }
      }
      """.formatted(SPECTRUM_FIELDS);

  /** Combined dye and protein listing used to build the fluorophore lookup table. */
  public static final String FLUOROPHORE_LISTING = "{ dyes { id name slug } proteins { id name slug } }";

  /** Microscope listing. */
  public static final String MICROSCOPE_LISTING = "{ microscopes { id name } }";

  private static final String SPECTRUM_LISTING_TEMPLATE = "{ spectra(category: \"%s\") { id owner { name } } }";

  private GraphQlQueries() {
    // Constants
  }

  /**
   * Returns the spectrum listing query for a category code.
   *
   * @param category {@code F} (filters), {@code C} (cameras), or {@code L} (lights)
   * @return listing query text
   */
  public static String spectrumListing(String category) {
    return SPECTRUM_LISTING_TEMPLATE.formatted(category);
  }
}
