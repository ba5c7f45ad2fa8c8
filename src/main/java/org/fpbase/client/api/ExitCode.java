package org.fpbase.client.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code fpbase} command.
 * <p><strong>Role:</strong> Returned by {@link Main#run(String[])} and mapped from the client's exception types.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The FPbase endpoint could not be reached or answered with an error status. */
  TRANSPORT_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including payloads that failed validation. */
  RUNTIME_FAILURE(5),
  /** The requested name did not resolve. */
  NOT_FOUND(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
