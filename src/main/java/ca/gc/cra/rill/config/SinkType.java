package ca.gc.cra.rill.config;

import java.util.Locale;

/**
 * Terminal sink selected by {@code sink} in a pipeline configuration.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Bridge to an SLF4J logger. */
  SLF4J,
  /** JSON object per line appended to {@code json.path}. */
  JSON,
  /** Accept and drop everything. */
  DISCARD;

  static SinkType parse(String text) {
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "slf4j" -> SLF4J;
      case "json" -> JSON;
      case "discard" -> DISCARD;
      default -> throw new IllegalArgumentException(
          "sink must be one of slf4j, json, discard (was '" + text + "')");
    };
  }
}
