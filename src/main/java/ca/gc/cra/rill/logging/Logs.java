package ca.gc.cra.rill.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * <strong>What:</strong> Rendering hygiene for field values written by text sinks.
 * <p><strong>Why:</strong> A single oversized or secret field must not flood or leak into the backing log.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncation mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} renders as {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return {@code value} when it fits, otherwise its prefix with a {@code "? (truncated, X of Y)"} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "? (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "? (truncated)";
    }
  }

  /**
   * Returns the rendered form of {@code value} for field {@code key}.
   *
   * @param key field name
   * @param value rendered value
   * @param redactedKeys lower-case keys whose values must never be written
   * @return {@code [REDACTED]} for redacted keys, otherwise {@code value}
   */
  public static String redactIfSensitive(String key, String value, Set<String> redactedKeys) {
    if (key != null && redactedKeys.contains(key.toLowerCase(Locale.ROOT))) {
      return redact(value);
    }
    return value;
  }

  /**
   * Returns the standard redaction placeholder.
   *
   * @param value ignored original value
   * @return {@code [REDACTED]}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }
}
