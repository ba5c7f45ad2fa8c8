package org.fpbase.client.application.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.fpbase.client.domain.model.Camera;
import org.fpbase.client.domain.model.Dye;
import org.fpbase.client.domain.model.Filter;
import org.fpbase.client.domain.model.FilterPath;
import org.fpbase.client.domain.model.FilterPlacement;
import org.fpbase.client.domain.model.Fluorophore;
import org.fpbase.client.domain.model.LightSource;
import org.fpbase.client.domain.model.Microscope;
import org.fpbase.client.domain.model.OligomerizationState;
import org.fpbase.client.domain.model.OpticalConfig;
import org.fpbase.client.domain.model.Protein;
import org.fpbase.client.domain.model.Reference;
import org.fpbase.client.domain.model.Spectrum;
import org.fpbase.client.domain.model.SpectrumOwner;
import org.fpbase.client.domain.model.SpectrumPoint;
import org.fpbase.client.domain.model.SpectrumType;
import org.fpbase.client.domain.model.State;
import org.fpbase.client.domain.model.SwitchType;

/**
 * <strong>What:</strong> Validates GraphQL response bodies into immutable domain records.
 * <p><strong>Why:</strong> Callers receive either a fully validated entity or a {@link ValidationException} naming the
 * offending field; malformed payloads are never coerced into a different meaning.</p>
 * <p><strong>Role:</strong> Schema layer between the response cache and the client facade.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Unwrap the {@code {"data": {...}}} envelope and surface GraphQL {@code errors}.</li>
 *   <li>Run {@link PayloadNormalizer} before any strict check.</li>
 *   <li>Check required fields, declared types, and closed enumerations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class EntityDecoder {
  private final JsonSupport json;
  private final PayloadNormalizer normalizer;

  /**
   * Creates a decoder with default JSON support and normalization.
   */
  public EntityDecoder() {
    this(new JsonSupport(), new PayloadNormalizer());
  }

  /**
   * Creates a decoder with explicit collaborators.
   *
   * @param json JSON parser
   * @param normalizer pre-validation transforms
   */
  public EntityDecoder(JsonSupport json, PayloadNormalizer normalizer) {
    this.json = Objects.requireNonNull(json, "json");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  /**
   * Parses a response body and returns its {@code data} object without shape validation.
   *
   * @param body raw response body
   * @return {@code data} mapping
   * @throws ValidationException when the body is not JSON, has no {@code data} object, or reports GraphQL errors
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> decodeData(byte[] body) {
    Node root = Node.of(json.parse(body), "$");
    if (!root.isPresent("data")) {
      throw new ValidationException("data", graphQlErrors(root).orElse("required field is missing"));
    }
    Object data = root.raw("data");
    if (!(data instanceof Map<?, ?>)) {
      throw new ValidationException("data", "expected an object but was " + Node.describe(data));
    }
    return (Map<String, Object>) data;
  }

  /**
   * Decodes the body of a microscope query.
   *
   * @param body raw response body
   * @return validated microscope
   */
  public Microscope decodeMicroscope(byte[] body) {
    return microscope(root(body, "microscope"));
  }

  /**
   * Decodes the body of a dye query, synthesizing the single state from inlined fields.
   *
   * @param body raw response body
   * @return validated dye
   */
  public Dye decodeDye(byte[] body) {
    Node node = fluorophoreRoot(body, "dye");
    List<State> states = node.mapList("states", this::state);
    return new Dye(node.requireId("id"), node.requireString("name"), states, defaultState(node, states));
  }

  /**
   * Decodes the body of a protein query.
   *
   * @param body raw response body
   * @return validated protein
   */
  public Protein decodeProtein(byte[] body) {
    Node node = fluorophoreRoot(body, "protein");
    List<State> states = node.mapList("states", this::state);
    List<String> pdb = node.isPresent("pdb")
        ? node.mapList("pdb", EntityDecoder::string)
        : List.of();
    List<Reference> references = node.isPresent("references")
        ? node.mapList("references", this::reference)
        : List.of();
    Reference primary = node.optionalObject("primaryReference")
        .map(ref -> new Reference(ref.requireString("doi")))
        .orElse(null);
    return new Protein(
        node.requireId("id"),
        node.requireString("name"),
        states,
        defaultState(node, states),
        node.optionalString("seq"),
        pdb,
        node.optionalString("genbank"),
        node.optionalString("uniprot"),
        node.optionalCode("agg", OligomerizationState::fromCode, OligomerizationState.codes()),
        node.optionalCode("switchType", SwitchType::fromCode, SwitchType.codes()),
        primary,
        references);
  }

  /**
   * Decodes the body of a spectrum query including its polymorphic owner.
   *
   * @param body raw response body
   * @return validated spectrum whose {@link Spectrum#findOwner()} is populated when an owner was returned
   * @throws ValidationException when more than one owner field is populated
   */
  public Spectrum decodeSpectrum(byte[] body) {
    Node node = root(body, "spectrum");
    List<SpectrumOwner> owners = new ArrayList<>(1);
    node.optionalObject("ownerFilter").ifPresent(n -> owners.add(filter(n)));
    node.optionalObject("ownerCamera").ifPresent(n -> owners.add(camera(n)));
    node.optionalObject("ownerLight").ifPresent(n -> owners.add(light(n)));
    if (owners.size() > 1) {
      throw new ValidationException(node.path(),
          "ownerFilter, ownerCamera, and ownerLight are mutually exclusive but " + owners.size() + " were set");
    }
    return spectrum(node, owners.isEmpty() ? null : owners.get(0));
  }

  /**
   * Decodes a listing of {@code {id name slug}} objects such as {@code dyes}, {@code proteins}, or
   * {@code microscopes}.
   *
   * @param body raw response body
   * @param field listing field under {@code data}
   * @return rows in payload order; {@code slug} is {@code null} when not selected
   */
  public List<ListingItem> decodeListing(byte[] body, String field) {
    Map<String, Object> data = decodeData(body);
    return Node.of(Map.of(field, listOrEmpty(data, field)), "data").mapList(field, (element, path) -> {
      Node node = Node.of(element, path);
      return new ListingItem(node.requireId("id"), node.requireString("name"), node.optionalString("slug"));
    });
  }

  /**
   * Decodes a {@code spectra(category: ...)} listing into rows named after each spectrum's owner.
   *
   * <p>Spectra without an owner cannot be looked up by name and are left out.</p>
   *
   * @param body raw response body
   * @return rows whose {@code id} is the spectrum id and {@code name} the owner name
   */
  public List<ListingItem> decodeSpectrumListing(byte[] body) {
    Map<String, Object> data = decodeData(body);
    List<ListingItem> rows = new ArrayList<>();
    Node.of(Map.of("spectra", listOrEmpty(data, "spectra")), "data").mapList("spectra", (element, path) -> {
      Node node = Node.of(element, path);
      node.optionalObject("owner")
          .ifPresent(owner -> rows.add(new ListingItem(node.requireId("id"), owner.requireString("name"), null)));
      return node;
    });
    return rows;
  }

  private static Object listOrEmpty(Map<String, Object> data, String field) {
    if (!data.containsKey(field)) {
      throw new ValidationException("data." + field, "required field is missing");
    }
    Object value = data.get(field);
    return value == null ? List.of() : value;
  }

  private Node root(byte[] body, String field) {
    Map<String, Object> data = decodeData(body);
    Object coerced = normalizer.coerceNullLists(data.get(field));
    if (coerced == null) {
      throw new ValidationException("data." + field, "required field is null");
    }
    return Node.of(coerced, "data." + field);
  }

  @SuppressWarnings("unchecked")
  private Node fluorophoreRoot(byte[] body, String field) {
    Object raw = decodeData(body).get(field);
    if (!(raw instanceof Map<?, ?>)) {
      throw new ValidationException("data." + field, "expected an object but was " + Node.describe(raw));
    }
    return Node.of(normalizer.normalizeFluorophore((Map<String, Object>) raw), "data." + field);
  }

  private static Optional<String> graphQlErrors(Node root) {
    Object errors = root.raw("errors");
    if (!(errors instanceof List<?> list) || list.isEmpty()) {
      return Optional.empty();
    }
    Object first = list.get(0);
    if (first instanceof Map<?, ?> error && error.get("message") instanceof String message) {
      return Optional.of("GraphQL error: " + message);
    }
    return Optional.of("GraphQL error: " + first);
  }

  private State defaultState(Node fluorophore, List<State> states) {
    String defaultId = fluorophore.optionalObject("defaultState")
        .filter(ref -> ref.isPresent("id"))
        .map(ref -> ref.requireId("id"))
        .orElse(null);
    return Fluorophore.resolveDefaultState(states, defaultId);
  }

  private State state(Object element, String path) {
    Node node = Node.of(element, path);
    return new State(
        node.requireId("id"),
        node.requireString("name"),
        node.optionalDouble("exMax"),
        node.optionalDouble("emMax"),
        node.optionalString("exhex"),
        node.optionalString("emhex"),
        node.optionalDouble("extCoeff"),
        node.optionalDouble("qy"),
        node.optionalDouble("lifetime"),
        node.isPresent("spectra") ? node.mapList("spectra", this::spectrumElement) : List.of());
  }

  private Spectrum spectrumElement(Object element, String path) {
    return spectrum(Node.of(element, path), null);
  }

  private Spectrum spectrum(Node node, SpectrumOwner owner) {
    return new Spectrum(
        node.requireId("id"),
        node.requireCode("subtype", SpectrumType::fromCode, SpectrumType.codes()),
        node.isPresent("data") ? node.mapList("data", EntityDecoder::point) : List.of(),
        owner);
  }

  private static SpectrumPoint point(Object element, String path) {
    if (!(element instanceof List<?> pair) || pair.size() != 2) {
      throw new ValidationException(path, "expected a [wavelength, value] pair but was " + Node.describe(element));
    }
    return new SpectrumPoint(number(pair.get(0), path + "[0]"), number(pair.get(1), path + "[1]"));
  }

  private static double number(Object value, String path) {
    if (!(value instanceof Number number)) {
      throw new ValidationException(path, "expected a number but was " + Node.describe(value));
    }
    return number.doubleValue();
  }

  private static String string(Object value, String path) {
    if (!(value instanceof String text)) {
      throw new ValidationException(path, "expected a string but was " + Node.describe(value));
    }
    return text;
  }

  private Reference reference(Object element, String path) {
    Node node = Node.of(element, path);
    return new Reference(node.requireString("doi"));
  }

  private Filter filter(Node node) {
    return new Filter(
        node.requireId("id"),
        node.requireString("name"),
        spectrum(node.requireObject("spectrum"), null),
        node.optionalString("manufacturer"),
        node.optionalDouble("bandcenter"),
        node.optionalDouble("bandwidth"),
        node.optionalDouble("edge"));
  }

  private Camera camera(Node node) {
    return new Camera(
        node.requireId("id"),
        node.requireString("name"),
        spectrum(node.requireObject("spectrum"), null),
        node.optionalString("manufacturer"));
  }

  private LightSource light(Node node) {
    return new LightSource(
        node.requireId("id"),
        node.requireString("name"),
        spectrum(node.requireObject("spectrum"), null),
        node.optionalString("manufacturer"));
  }

  private Microscope microscope(Node node) {
    return new Microscope(
        node.requireId("id"),
        node.requireString("name"),
        node.isPresent("opticalConfigs") ? node.mapList("opticalConfigs", this::opticalConfig) : List.of());
  }

  private OpticalConfig opticalConfig(Object element, String path) {
    Node node = Node.of(element, path);
    return new OpticalConfig(
        node.requireString("name"),
        node.mapList("filters", this::placement),
        node.optionalObject("camera").map(this::camera).orElse(null),
        node.optionalObject("light").map(this::light).orElse(null),
        node.optionalInteger("laser"));
  }

  private FilterPlacement placement(Object element, String path) {
    Node node = Node.of(element, path);
    return new FilterPlacement(
        filter(node.requireObject("filter")),
        node.requireCode("path", FilterPath::fromCode, FilterPath.codes()),
        node.optionalBoolean("reflects", false));
  }
}
