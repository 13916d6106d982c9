package ca.gc.cra.rill.application.port;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Failure of several drains that were all invoked for the same record.
 *
 * <p>The first failure is the cause; the others are attached as suppressed exceptions. {@link #failures()}
 * returns all of them in invocation order.</p>
 *
 * @since 0.1.0
 */
public final class AggregateDrainException extends DrainException {
  private static final long serialVersionUID = 1L;

  private final List<DrainException> failures;

  /**
   * Creates an aggregate of two or more failures.
   *
   * @param failures failures in invocation order; must contain at least two entries
   */
  public AggregateDrainException(List<DrainException> failures) {
    super(describe(failures), failures.get(0));
    this.failures = List.copyOf(failures);
    for (int i = 1; i < this.failures.size(); i++) {
      addSuppressed(this.failures.get(i));
    }
  }

  @Override
  public List<DrainException> failures() {
    List<DrainException> flattened = new ArrayList<>();
    for (DrainException failure : failures) {
      flattened.addAll(failure.failures());
    }
    return List.copyOf(flattened);
  }

  private static String describe(List<DrainException> failures) {
    Objects.requireNonNull(failures, "failures");
    if (failures.size() < 2) {
      throw new IllegalArgumentException("aggregate requires at least two failures");
    }
    StringBuilder message = new StringBuilder(failures.size() + " drains failed: ");
    for (int i = 0; i < failures.size(); i++) {
      if (i > 0) {
        message.append("; ");
      }
      message.append(failures.get(i).getMessage());
    }
    return message.toString();
  }
}
