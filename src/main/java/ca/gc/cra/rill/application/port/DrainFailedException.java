package ca.gc.cra.rill.application.port;

/**
 * Unchecked wrapper raised by a fused drain when its inner drain fails.
 *
 * @since 0.1.0
 */
public final class DrainFailedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Wraps a drain failure.
   *
   * @param cause failure reported by the inner drain
   */
  public DrainFailedException(DrainException cause) {
    super("Drain failed: " + cause.getMessage(), cause);
  }

  @Override
  public synchronized DrainException getCause() {
    return (DrainException) super.getCause();
  }
}
