package ca.gc.cra.rill.application.drain;

import java.util.Locale;

/**
 * What an {@link AsyncDrain} producer does when the queue is full.
 *
 * @since 0.1.0
 */
public enum OverflowStrategy {
  /** Wait for space. Nothing is lost; the logging thread may stall. */
  BLOCK,
  /** Discard the new record and count it. */
  DROP,
  /** Discard the new record, and have the worker emit a warning with the number dropped once it catches up. */
  DROP_AND_REPORT;

  /**
   * Parses a strategy name, accepting {@code drop-and-report} style spellings.
   *
   * @param text candidate name
   * @return matching strategy
   * @throws IllegalArgumentException when {@code text} is blank or unknown
   */
  public static OverflowStrategy parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("overflow strategy must not be blank");
    }
    String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown overflow strategy '" + text + "'", ex);
    }
  }
}
