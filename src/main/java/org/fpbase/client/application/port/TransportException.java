package org.fpbase.client.application.port;

import org.fpbase.client.application.FpbaseException;

/**
 * Raised when a request cannot be delivered or the service answers with a non-success status.
 *
 * <p>Transport failures are never cached and never retried by the client.</p>
 *
 * @since 0.1.0
 */
public final class TransportException extends FpbaseException {
  /** Status reported when the failure happened before an HTTP response was received. */
  public static final int NO_STATUS = -1;

  private final int statusCode;

  /**
   * Creates an exception for a connectivity failure.
   *
   * @param message human-readable error
   * @param cause underlying IO or interruption failure
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
  }

  /**
   * Creates an exception for a non-success HTTP status.
   *
   * @param message human-readable error
   * @param statusCode HTTP status returned by the service
   */
  public TransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Returns the HTTP status, or {@link #NO_STATUS} for connectivity failures.
   *
   * @return HTTP status code
   */
  public int statusCode() {
    return statusCode;
  }
}
