package ca.gc.cra.rill.infrastructure.sink;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.Serializer;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import ca.gc.cra.rill.logging.Logs;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Bridges records into an SLF4J logger as {@code message k=v, k=v} lines.
 *
 * <p>CRITICAL and ERROR both map to SLF4J error; CRITICAL records additionally carry the {@code CRITICAL}
 * marker. Values longer than the configured byte budget are truncated and keys in the redaction set are
 * masked. When the target logger has the mapped level disabled the fields are never rendered.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jDrain implements Drain {
  /** Marker attached to records logged at {@link Level#CRITICAL}. */
  public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");
  static final int DEFAULT_MAX_VALUE_BYTES = 1024;

  private final Logger target;
  private final Set<String> redactedKeys;
  private final int maxValueBytes;

  /**
   * Creates a bridge to the named logger without redaction.
   *
   * @param loggerName SLF4J logger name
   */
  public Slf4jDrain(String loggerName) {
    this(LoggerFactory.getLogger(loggerName), Set.of(), DEFAULT_MAX_VALUE_BYTES);
  }

  /**
   * Creates a bridge to {@code target}.
   *
   * @param target SLF4J logger receiving rendered lines
   * @param redactedKeys keys whose values are replaced with {@code [REDACTED]}; matched case-insensitively
   * @param maxValueBytes UTF-8 byte budget per rendered value
   */
  public Slf4jDrain(Logger target, Set<String> redactedKeys, int maxValueBytes) {
    this.target = Objects.requireNonNull(target, "target");
    this.redactedKeys = Objects.requireNonNull(redactedKeys, "redactedKeys").stream()
        .map(key -> key.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    if (maxValueBytes <= 0) {
      throw new IllegalArgumentException("maxValueBytes must be positive");
    }
    this.maxValueBytes = maxValueBytes;
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    org.slf4j.event.Level mapped = toSlf4j(record.level());
    if (!target.isEnabledForLevel(mapped)) {
      return;
    }
    String line;
    try {
      line = render(record, fields);
    } catch (IOException ex) {
      throw new DrainException("Failed to render record for " + target.getName(), ex);
    }
    if (record.level() == Level.CRITICAL) {
      target.atLevel(mapped).addMarker(CRITICAL).log(line);
    } else {
      target.atLevel(mapped).log(line);
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return target.isEnabledForLevel(toSlf4j(level));
  }

  String render(LogRecord record, Fields fields) throws IOException {
    StringJoiner pairs = new StringJoiner(", ");
    fields.serialize(new Serializer() {
      @Override
      public void emitString(String key, String value) {
        add(key, value);
      }

      @Override
      public void emitLong(String key, long value) {
        add(key, Long.toString(value));
      }

      @Override
      public void emitDouble(String key, double value) {
        add(key, Double.toString(value));
      }

      @Override
      public void emitBoolean(String key, boolean value) {
        add(key, Boolean.toString(value));
      }

      @Override
      public void emitNull(String key) {
        add(key, "null");
      }

      @Override
      public void emitObject(String key, Object value) {
        add(key, String.valueOf(value));
      }

      private void add(String key, String value) {
        String shown = Logs.redactIfSensitive(key, Logs.truncate(value, maxValueBytes), redactedKeys);
        pairs.add(key + '=' + shown);
      }
    });
    if (pairs.length() == 0) {
      return record.message();
    }
    return record.message() + ' ' + pairs;
  }

  static org.slf4j.event.Level toSlf4j(Level level) {
    return switch (level) {
      case CRITICAL, ERROR -> org.slf4j.event.Level.ERROR;
      case WARNING -> org.slf4j.event.Level.WARN;
      case INFO -> org.slf4j.event.Level.INFO;
      case DEBUG -> org.slf4j.event.Level.DEBUG;
      case TRACE -> org.slf4j.event.Level.TRACE;
    };
  }
}
