package ca.gc.cra.rill.domain.record;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity of a log record, ordered from most to least severe.
 * <p><strong>Why:</strong> Used both when emitting records and when drains decide whether to pass them on.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by loggers, records, and level filters.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Performance:</strong> Comparisons are ordinal checks.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  /** Unrecoverable condition; the process or subsystem is about to fail. */
  CRITICAL("CRIT"),
  /** Operation failed. */
  ERROR("ERRO"),
  /** Unexpected condition that did not stop the operation. */
  WARNING("WARN"),
  /** Normal operational milestones. */
  INFO("INFO"),
  /** Diagnostic detail for developers. */
  DEBUG("DEBG"),
  /** Very fine-grained diagnostic detail. */
  TRACE("TRCE");

  /** The least severe level; a filter at this threshold passes everything. */
  public static final Level MOST_VERBOSE = TRACE;

  private final String shortName;

  Level(String shortName) {
    this.shortName = shortName;
  }

  /**
   * Returns {@code true} when this level is at least as severe as {@code threshold}.
   *
   * @param threshold minimum severity; must not be {@code null}
   * @return whether a record at this level passes a filter configured with {@code threshold}
   */
  public boolean isAtLeast(Level threshold) {
    return ordinal() <= threshold.ordinal();
  }

  /**
   * Returns the four-character form used by compact renderers.
   *
   * @return short name such as {@code "WARN"}
   */
  public String asShortString() {
    return shortName;
  }

  /**
   * Parses a level from either its full name or its short name, ignoring case and surrounding blanks.
   *
   * @param text candidate such as {@code "warning"}, {@code "WARN"} or {@code "Info"}
   * @return matching level
   * @throws IllegalArgumentException when {@code text} is {@code null}, blank, or unknown
   */
  public static Level parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = text.trim().toUpperCase(Locale.ROOT);
    for (Level level : values()) {
      if (level.name().equals(normalized) || level.shortName.equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown level '" + text + "'");
  }
}
