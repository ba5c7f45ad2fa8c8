package org.fpbase.client.application.resolve;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.fpbase.client.application.cache.ResponseCache;
import org.fpbase.client.application.client.GraphQlQueries;
import org.fpbase.client.application.port.MetricsPort;
import org.fpbase.client.application.schema.EntityDecoder;
import org.fpbase.client.application.schema.ListingItem;
import org.fpbase.client.domain.model.FluorophoreType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves loosely formatted names to canonical FPbase identifiers.
 * <p><strong>Why:</strong> Users type {@code egfp}, {@code EGFP}, a slug, or a near-miss; detail queries need ids.</p>
 * <p><strong>Role:</strong> Application service used by the client facade before every by-name fetch.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build one {@link LookupTable} per {@link LookupFamily} from a single listing query, on first use.</li>
 *   <li>Resolve by exact normalized key, else fail with a {@link NotFoundException} carrying the closest key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Tables are built at most once per family per resolver; concurrent first callers
 * for the same family wait for one build. A failed build is not remembered and is retried on the next call.</p>
 * <p><strong>Observability:</strong> Emits {@code resolver.table.built} and {@code resolver.miss} counters.</p>
 *
 * @since 0.1.0
 */
public final class NameResolver {
  private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

  private final ResponseCache cache;
  private final EntityDecoder decoder;
  private final URI endpoint;
  private final MetricsPort metrics;
  private final ConcurrentMap<LookupFamily, LookupTable> tables = new ConcurrentHashMap<>();

  /**
   * Creates a resolver whose listing queries go through the given cache.
   *
   * @param cache response cache; never {@code null}
   * @param decoder schema layer for listing payloads; never {@code null}
   * @param endpoint GraphQL endpoint; never {@code null}
   * @param metrics metrics sink; never {@code null}
   */
  public NameResolver(ResponseCache cache, EntityDecoder decoder, URI endpoint, MetricsPort metrics) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Resolves a user-supplied name within a family.
   *
   * @param family table to search
   * @param query raw name, slug, or (for proteins) id; never {@code null}
   * @return matching entry
   * @throws NotFoundException when no key matches exactly
   */
  public LookupEntry resolve(LookupFamily family, String query) {
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(query, "query");
    LookupTable table = table(family);
    String key = family.normalize(query);
    Optional<LookupEntry> hit = table.find(key);
    if (hit.isPresent()) {
      return hit.get();
    }
    metrics.increment("resolver.miss");
    String suggestion = SequenceSimilarity.closest(key, table.keys(), SequenceSimilarity.DEFAULT_CUTOFF)
        .orElse(null);
    log.debug("{} lookup miss for '{}' (suggestion: {})", family.label(), query, suggestion);
    throw new NotFoundException(family, query, suggestion);
  }

  /**
   * Returns the sorted, distinct display names known to a family's table.
   *
   * @param family table to list
   * @return sorted names
   */
  public List<String> names(LookupFamily family) {
    return table(family).displayNames();
  }

  /**
   * Returns the lookup table for a family, building it on first use.
   *
   * @param family table to fetch
   * @return immutable table
   */
  public LookupTable table(LookupFamily family) {
    Objects.requireNonNull(family, "family");
    LookupTable existing = tables.get(family);
    if (existing != null) {
      return existing;
    }
    return tables.computeIfAbsent(family, this::build);
  }

  private LookupTable build(LookupFamily family) {
    LookupTable table = family == LookupFamily.FLUOROPHORE ? buildFluorophores() : buildSpectrumOwners(family);
    metrics.increment("resolver.table.built");
    log.debug("Built {} lookup table with {} keys", family.label(), table.size());
    return table;
  }

  private LookupTable buildFluorophores() {
    byte[] body = cache.getOrFetch(endpoint, GraphQlQueries.FLUOROPHORE_LISTING, Map.of());
    LookupTable.Builder builder = LookupTable.builder(LookupFamily.FLUOROPHORE);
    for (ListingItem dye : decoder.decodeListing(body, "dyes")) {
      LookupEntry entry = new LookupEntry(dye.id(), dye.name(), FluorophoreType.DYE);
      builder.put(dye.name(), entry).put(dye.slug(), entry);
    }
    for (ListingItem protein : decoder.decodeListing(body, "proteins")) {
      LookupEntry entry = new LookupEntry(protein.id(), protein.name(), FluorophoreType.PROTEIN);
      builder.put(protein.name(), entry).put(protein.slug(), entry).put(protein.id(), entry);
    }
    return builder.build();
  }

  private LookupTable buildSpectrumOwners(LookupFamily family) {
    String query = GraphQlQueries.spectrumListing(family.spectrumCategory());
    byte[] body = cache.getOrFetch(endpoint, query, Map.of());
    LookupTable.Builder builder = LookupTable.builder(family);
    for (ListingItem row : decoder.decodeSpectrumListing(body)) {
      builder.put(row.name(), new LookupEntry(row.id(), row.name(), null));
    }
    return builder.build();
  }
}
