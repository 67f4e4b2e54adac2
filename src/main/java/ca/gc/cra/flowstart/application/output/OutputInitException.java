package ca.gc.cra.flowstart.application.output;

/**
 * Signals that an output context could not be constructed (sink allocation, file open, bad options).
 * The output is not activated.
 *
 * @since 0.1.0
 */
public final class OutputInitException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public OutputInitException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying failure
   */
  public OutputInitException(String message, Throwable cause) {
    super(message, cause);
  }
}
