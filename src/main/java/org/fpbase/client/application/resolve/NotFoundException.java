package org.fpbase.client.application.resolve;

import java.util.Objects;
import java.util.Optional;
import org.fpbase.client.application.FpbaseException;

/**
 * Raised when a name does not resolve to any entry of a lookup table.
 *
 * <p>The message embeds the original query and, when a close key exists, a {@code did you mean '<key>'?} hint.</p>
 *
 * @since 0.1.0
 */
public final class NotFoundException extends FpbaseException {
  private final LookupFamily family;
  private final String query;
  private final String suggestion;

  /**
   * Creates a resolver miss.
   *
   * @param family table that was searched
   * @param query query exactly as supplied by the caller
   * @param suggestion closest existing key; may be {@code null}
   */
  public NotFoundException(LookupFamily family, String query, String suggestion) {
    super(message(family, query, suggestion));
    this.family = Objects.requireNonNull(family, "family");
    this.query = query;
    this.suggestion = suggestion;
  }

  public LookupFamily family() {
    return family;
  }

  public String query() {
    return query;
  }

  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  private static String message(LookupFamily family, String query, String suggestion) {
    String base = family.label() + " '" + query + "' not found";
    return suggestion == null ? base + "." : base + "; did you mean '" + suggestion + "'?";
  }
}
