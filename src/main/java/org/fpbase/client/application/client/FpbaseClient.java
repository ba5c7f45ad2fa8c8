package org.fpbase.client.application.client;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.fpbase.client.application.cache.ResponseCache;
import org.fpbase.client.application.port.MetricsPort;
import org.fpbase.client.application.port.TransportPort;
import org.fpbase.client.application.resolve.LookupEntry;
import org.fpbase.client.application.resolve.LookupFamily;
import org.fpbase.client.application.resolve.LookupTable;
import org.fpbase.client.application.resolve.NameResolver;
import org.fpbase.client.application.schema.EntityDecoder;
import org.fpbase.client.application.schema.JsonSupport;
import org.fpbase.client.application.schema.ListingItem;
import org.fpbase.client.application.schema.PayloadNormalizer;
import org.fpbase.client.application.schema.ValidationException;
import org.fpbase.client.config.ClientConfig;
import org.fpbase.client.config.ClientConfigLoader;
import org.fpbase.client.config.CompositionRoot;
import org.fpbase.client.domain.model.Camera;
import org.fpbase.client.domain.model.Dye;
import org.fpbase.client.domain.model.Filter;
import org.fpbase.client.domain.model.Fluorophore;
import org.fpbase.client.domain.model.FluorophoreType;
import org.fpbase.client.domain.model.LightSource;
import org.fpbase.client.domain.model.Microscope;
import org.fpbase.client.domain.model.Protein;
import org.fpbase.client.domain.model.Spectrum;
import org.fpbase.client.domain.model.SpectrumOwner;
import org.fpbase.client.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Typed, read-only entry point to the FPbase catalog.
 * <p><strong>Why:</strong> Callers ask for "EGFP" or "Chroma ET525/50m" and get validated domain records back,
 * without writing GraphQL or handling identifiers.</p>
 * <p><strong>Role:</strong> Facade over {@link NameResolver}, {@link ResponseCache}, and {@link EntityDecoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve names to ids and dispatch to the matching detail query.</li>
 *   <li>Expose sorted listings whose every element can be fetched back by name.</li>
 *   <li>Offer {@link #query(String, Map)} as an unvalidated escape hatch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All operations are synchronous and safe for concurrent use; the cache and lookup
 * tables are shared by every caller of one instance.</p>
 * <p><strong>Errors:</strong> {@link org.fpbase.client.application.resolve.NotFoundException},
 * {@link ValidationException}, {@link org.fpbase.client.application.port.TransportException}, and
 * {@link IllegalArgumentException} for inputs of the wrong kind. Nothing is partially returned.</p>
 *
 * @since 0.1.0
 */
public final class FpbaseClient {
  private static final Logger log = LoggerFactory.getLogger(FpbaseClient.class);

  private static volatile FpbaseClient instance;

  private final URI endpoint;
  private final ResponseCache cache;
  private final EntityDecoder decoder;
  private final NameResolver resolver;
  private final MetricsPort metrics;

  /**
   * Creates an isolated client with its own cache and lookup tables.
   *
   * @param endpoint GraphQL endpoint; never {@code null}
   * @param transport transport used for cache misses; never {@code null}
   * @param metrics metrics sink; never {@code null}
   */
  public FpbaseClient(URI endpoint, TransportPort transport, MetricsPort metrics) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    JsonSupport json = new JsonSupport();
    this.cache = new ResponseCache(transport, json, metrics);
    this.decoder = new EntityDecoder(json, new PayloadNormalizer());
    this.resolver = new NameResolver(cache, decoder, endpoint, metrics);
  }

  /**
   * Creates an isolated client against the public endpoint with the given transport and no metrics.
   *
   * @param transport transport used for cache misses; never {@code null}
   */
  public FpbaseClient(TransportPort transport) {
    this(ClientConfig.DEFAULT_ENDPOINT, transport, MetricsPort.NO_OP);
  }

  /**
   * Builds an isolated client from configuration, wiring the HTTP transport and metrics adapter.
   *
   * @param config client configuration; never {@code null}
   * @return new client
   */
  public static FpbaseClient create(ClientConfig config) {
    return new CompositionRoot(config).createClient();
  }

  /**
   * Returns the process-wide client, creating it from {@link ClientConfigLoader#loadDefault()} on first access.
   *
   * <p>Concurrent first callers observe the same instance.</p>
   *
   * @return shared client
   */
  public static FpbaseClient instance() {
    FpbaseClient local = instance;
    if (local == null) {
      synchronized (FpbaseClient.class) {
        local = instance;
        if (local == null) {
          local = create(ClientConfigLoader.loadDefault());
          instance = local;
          log.debug("Created shared FPbase client for {}", local.endpoint);
        }
      }
    }
    return local;
  }

  public URI endpoint() {
    return endpoint;
  }

  /**
   * Fetches a dye or protein by name, slug, or protein id (case-insensitive).
   *
   * @param name user-supplied name
   * @return {@link Dye} or {@link Protein}
   */
  public Fluorophore getFluorophore(String name) {
    LookupEntry entry = resolver.resolve(LookupFamily.FLUOROPHORE, Strings.requireNonBlank("name", name));
    return entry.type() == FluorophoreType.PROTEIN ? fetchProtein(entry) : fetchDye(entry);
  }

  /**
   * Fetches a protein by name, slug, or id.
   *
   * @param name user-supplied name
   * @return validated protein
   * @throws IllegalArgumentException when the name resolves to a dye
   */
  public Protein getProtein(String name) {
    return fetchProtein(resolveFluorophore(name, FluorophoreType.PROTEIN));
  }

  /**
   * Fetches a dye by name or slug.
   *
   * @param name user-supplied name
   * @return validated dye
   * @throws IllegalArgumentException when the name resolves to a protein
   */
  public Dye getDye(String name) {
    return fetchDye(resolveFluorophore(name, FluorophoreType.DYE));
  }

  /**
   * Fetches a filter by name; spaces and slashes are interchangeable with hyphens.
   *
   * @param name user-supplied name such as {@code Chroma ET525/50m}
   * @return validated filter
   */
  public Filter getFilter(String name) {
    return owner(LookupFamily.FILTER, name, Filter.class);
  }

  /**
   * Fetches a camera by name.
   *
   * @param name user-supplied name
   * @return validated camera
   */
  public Camera getCamera(String name) {
    return owner(LookupFamily.CAMERA, name, Camera.class);
  }

  /**
   * Fetches a light source by name.
   *
   * @param name user-supplied name
   * @return validated light source
   */
  public LightSource getLight(String name) {
    return owner(LookupFamily.LIGHT, name, LightSource.class);
  }

  /**
   * Fetches a microscope by its opaque id.
   *
   * @param id microscope id as returned by {@link #listMicroscopes()}
   * @return validated microscope
   */
  public Microscope getMicroscope(String id) {
    String value = Strings.requireNonBlank("id", id);
    return decoder.decodeMicroscope(cache.getOrFetch(endpoint, GraphQlQueries.MICROSCOPE, Map.of("id", value)));
  }

  public List<String> listFluorophores() {
    return resolver.names(LookupFamily.FLUOROPHORE);
  }

  public List<String> listProteins() {
    return namesOfType(FluorophoreType.PROTEIN);
  }

  public List<String> listDyes() {
    return namesOfType(FluorophoreType.DYE);
  }

  public List<String> listFilters() {
    return resolver.names(LookupFamily.FILTER);
  }

  public List<String> listCameras() {
    return resolver.names(LookupFamily.CAMERA);
  }

  public List<String> listLights() {
    return resolver.names(LookupFamily.LIGHT);
  }

  /**
   * Lists microscope ids, sorted. Each id is accepted by {@link #getMicroscope(String)}.
   *
   * @return sorted, distinct ids
   */
  public List<String> listMicroscopes() {
    byte[] body = cache.getOrFetch(endpoint, GraphQlQueries.MICROSCOPE_LISTING, Map.of());
    return decoder.decodeListing(body, "microscopes").stream()
        .map(ListingItem::id)
        .distinct()
        .sorted()
        .toList();
  }

  /**
   * Runs an arbitrary GraphQL document through the cache and returns its {@code data} object unvalidated.
   *
   * @param query GraphQL text
   * @param variables variables; {@code null} is treated as empty
   * @return decoded {@code data} mapping
   */
  public Map<String, Object> query(String query, Map<String, Object> variables) {
    String text = Strings.requireNonBlank("query", query);
    return decoder.decodeData(cache.getOrFetch(endpoint, text, variables == null ? Map.of() : variables));
  }

  /**
   * Drops cached responses. Lookup tables already built are kept.
   */
  public void clearCache() {
    cache.clear();
  }

  /**
   * Exports buffered metrics now instead of waiting for the next periodic export. No-op when metrics are disabled.
   */
  public void flushMetrics() {
    metrics.flush();
  }

  int cachedResponses() {
    return cache.size();
  }

  private LookupEntry resolveFluorophore(String name, FluorophoreType expected) {
    LookupEntry entry = resolver.resolve(LookupFamily.FLUOROPHORE, Strings.requireNonBlank("name", name));
    if (entry.type() != expected) {
      throw new IllegalArgumentException("'" + name + "' is a " + label(entry.type()) + ", not a " + label(expected));
    }
    return entry;
  }

  private Dye fetchDye(LookupEntry entry) {
    byte[] body = cache.getOrFetch(endpoint, GraphQlQueries.DYE, Map.of("id", intId(entry)));
    return decoder.decodeDye(body);
  }

  private Protein fetchProtein(LookupEntry entry) {
    byte[] body = cache.getOrFetch(endpoint, GraphQlQueries.PROTEIN, Map.of("id", entry.id()));
    return decoder.decodeProtein(body);
  }

  private <T extends SpectrumOwner> T owner(LookupFamily family, String name, Class<T> type) {
    LookupEntry entry = resolver.resolve(family, Strings.requireNonBlank("name", name));
    byte[] body = cache.getOrFetch(endpoint, GraphQlQueries.SPECTRUM, Map.of("id", intId(entry)));
    Spectrum spectrum = decoder.decodeSpectrum(body);
    SpectrumOwner owner = spectrum.findOwner()
        .orElseThrow(() -> new ValidationException("data.spectrum",
            "spectrum " + spectrum.id() + " listed as a " + family.label().toLowerCase(Locale.ROOT)
                + " has no owner"));
    if (!type.isInstance(owner)) {
      throw new ValidationException("data.spectrum", "spectrum " + spectrum.id() + " is owned by a "
          + owner.getClass().getSimpleName() + ", expected " + type.getSimpleName());
    }
    return type.cast(owner);
  }

  private List<String> namesOfType(FluorophoreType type) {
    LookupTable table = resolver.table(LookupFamily.FLUOROPHORE);
    List<String> names = new ArrayList<>();
    for (LookupEntry entry : table.distinctEntries()) {
      if (entry.type() == type) {
        names.add(entry.displayName());
      }
    }
    return names.stream().distinct().sorted().toList();
  }

  private static int intId(LookupEntry entry) {
    try {
      return Integer.parseInt(entry.id());
    } catch (NumberFormatException ex) {
      throw new ValidationException("id", "expected a numeric id but was '" + entry.id() + "'", ex);
    }
  }

  private static String label(FluorophoreType type) {
    return type == FluorophoreType.PROTEIN ? "protein" : "dye";
  }
}
