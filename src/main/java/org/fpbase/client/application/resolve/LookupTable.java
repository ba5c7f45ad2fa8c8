package org.fpbase.client.application.resolve;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable normalized-key to {@link LookupEntry} mapping for one {@link LookupFamily}.
 *
 * <p>Several keys may alias the same entry (a protein's name, slug, and id).</p>
 *
 * @since 0.1.0
 */
public final class LookupTable {
  private final Map<String, LookupEntry> entries;

  private LookupTable(Map<String, LookupEntry> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  /**
   * Starts a table for a family.
   *
   * @param family owning family
   * @return empty builder
   */
  public static Builder builder(LookupFamily family) {
    return new Builder(Objects.requireNonNull(family, "family"));
  }

  /**
   * Exact lookup of an already normalized key.
   *
   * @param key normalized key
   * @return entry when present
   */
  public Optional<LookupEntry> find(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  /**
   * Returns every key, in insertion order.
   *
   * @return unmodifiable key view
   */
  public Set<String> keys() {
    return entries.keySet();
  }

  /**
   * Returns the distinct display names, sorted.
   *
   * @return sorted, duplicate-free names
   */
  public List<String> displayNames() {
    TreeSet<String> names = new TreeSet<>();
    for (LookupEntry entry : entries.values()) {
      names.add(entry.displayName());
    }
    return List.copyOf(names);
  }

  /**
   * Returns the distinct entries, sorted by display name.
   *
   * @return entries without key aliases
   */
  public List<LookupEntry> distinctEntries() {
    return entries.values().stream()
        .distinct()
        .sorted(Comparator.comparing(LookupEntry::displayName))
        .toList();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Accumulates keys; later puts for the same key replace earlier ones.
   */
  public static final class Builder {
    private final LookupFamily family;
    private final Map<String, LookupEntry> entries = new LinkedHashMap<>();

    private Builder(LookupFamily family) {
      this.family = family;
    }

    /**
     * Adds an alias for an entry after normalizing it with the family rule.
     *
     * @param alias raw name, slug, or id; {@code null} or blank aliases are ignored
     * @param entry entry the alias points at
     * @return this builder
     */
    public Builder put(String alias, LookupEntry entry) {
      Objects.requireNonNull(entry, "entry");
      if (alias != null && !alias.isBlank()) {
        entries.put(family.normalize(alias), entry);
      }
      return this;
    }

    public LookupTable build() {
      return new LookupTable(entries);
    }
  }
}
