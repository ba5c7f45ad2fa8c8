package org.fpbase.client.application.schema;

import org.fpbase.client.application.FpbaseException;

/**
 * Raised when a decoded payload does not match the expected entity shape.
 *
 * <p>The message is prefixed with the offending field path, e.g.
 * {@code data.protein.states[0].spectra[1].subtype: expected one of [...] but was 'XX'}.</p>
 *
 * @since 0.1.0
 */
public final class ValidationException extends FpbaseException {
  private final String path;

  /**
   * Creates a validation failure for a field path.
   *
   * @param path dotted/indexed path of the offending field; {@code $} for the document root
   * @param message description of the mismatch
   */
  public ValidationException(String path, String message) {
    super(path + ": " + message);
    this.path = path;
  }

  /**
   * Creates a validation failure with an underlying cause.
   *
   * @param path dotted/indexed path of the offending field
   * @param message description of the mismatch
   * @param cause parser or conversion failure
   */
  public ValidationException(String path, String message, Throwable cause) {
    super(path + ": " + message, cause);
    this.path = path;
  }

  /**
   * Returns the offending field path.
   *
   * @return field path
   */
  public String path() {
    return path;
  }
}
