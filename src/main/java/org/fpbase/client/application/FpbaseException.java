package org.fpbase.client.application;

/**
 * Base type for failures raised by the FPbase client.
 *
 * <p>Subtypes separate transport failures, payload validation failures, and name-resolution misses so callers
 * can react to each without string matching.</p>
 *
 * @since 0.1.0
 * @see org.fpbase.client.application.port.TransportException
 * @see org.fpbase.client.application.schema.ValidationException
 * @see org.fpbase.client.application.resolve.NotFoundException
 */
public class FpbaseException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public FpbaseException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public FpbaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
