package org.fpbase.client.application.schema;

import java.util.Objects;

/**
 * One row of a bulk listing query.
 *
 * @param id identifier as decimal text or opaque string; never {@code null}
 * @param name display name (for spectrum listings, the owner's name); never {@code null}
 * @param slug URL slug; {@code null} when the listing does not select one
 * @since 0.1.0
 */
public record ListingItem(String id, String name, String slug) {
  public ListingItem {
    id = Objects.requireNonNull(id, "id");
    name = Objects.requireNonNull(name, "name");
  }
}
