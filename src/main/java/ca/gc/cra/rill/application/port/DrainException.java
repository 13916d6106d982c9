package ca.gc.cra.rill.application.port;

import java.util.List;

/**
 * Sink-level failure: I/O error, encoding error, or downstream rejection.
 *
 * @since 0.1.0
 */
public class DrainException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the failure
   */
  public DrainException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the failure
   * @param cause underlying error
   */
  public DrainException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the individual failures this exception stands for.
   *
   * @return a single-element list containing this exception
   */
  public List<DrainException> failures() {
    return List.of(this);
  }
}
