package ca.gc.cra.rill.domain.record;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Metadata of a single log event.
 * <p><strong>Why:</strong> Lets drains filter and render an event without touching its key-value fields.</p>
 * <p><strong>Role:</strong> Domain value passed alongside {@code Fields} to every drain, and handed to lazy
 * values as their read-only view of the event.</p>
 * <p><strong>Thread-safety:</strong> Immutable; may cross into an async worker thread.</p>
 * <p><strong>Performance:</strong> One allocation per emitted event; never built for disabled levels.</p>
 *
 * @param level severity of the event
 * @param message rendered message text
 * @param location call-site position
 * @param timestamp wall-clock instant the event was created
 * @param tag free-form routing tag used by filters; empty when unset
 * @since 0.1.0
 */
public record LogRecord(Level level, String message, Location location, Instant timestamp, String tag) {
  /**
   * Validates required components and defaults optional ones.
   */
  public LogRecord {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(timestamp, "timestamp");
    message = Objects.requireNonNullElse(message, "");
    location = Objects.requireNonNullElse(location, Location.UNKNOWN);
    tag = Objects.requireNonNullElse(tag, "");
  }

  /**
   * Creates an untagged record.
   *
   * @param level severity of the event
   * @param message message text
   * @param location call-site position
   * @param timestamp creation instant
   * @return record with an empty tag
   */
  public static LogRecord of(Level level, String message, Location location, Instant timestamp) {
    return new LogRecord(level, message, location, timestamp, "");
  }
}
