package org.fpbase.client.domain.model;

import java.util.Objects;

/**
 * Filter positioned in one light path of an optical configuration.
 *
 * @param filter placed filter; never {@code null}
 * @param path light path; never {@code null}
 * @param reflects {@code true} when the filter is used in reflection (beamsplitters)
 * @since 0.1.0
 */
public record FilterPlacement(Filter filter, FilterPath path, boolean reflects) {
  public FilterPlacement {
    filter = Objects.requireNonNull(filter, "filter");
    path = Objects.requireNonNull(path, "path");
  }
}
