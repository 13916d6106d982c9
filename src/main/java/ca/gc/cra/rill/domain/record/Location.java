package ca.gc.cra.rill.domain.record;

import java.util.Objects;

/**
 * Source position of a log call.
 *
 * <p>The JVM reports no column information, so {@code column} is {@code null} for locations captured
 * from the stack. Adapters that know the column may supply it.</p>
 *
 * @param file source file name, or {@code "<unknown>"}
 * @param line one-based line number, or {@code 0} when unknown
 * @param column one-based column, or {@code null}
 * @param function method name of the call site, or {@code null}
 * @param module declaring class of the call site, or {@code null}
 * @since 0.1.0
 */
public record Location(String file, int line, Integer column, String function, String module) {
  /** Placeholder for records whose call site is not known. */
  public static final Location UNKNOWN = new Location("<unknown>", 0, null, null, null);

  /**
   * Normalizes the file name.
   */
  public Location {
    file = Objects.requireNonNullElse(file, "<unknown>");
    line = Math.max(0, line);
  }

  /**
   * Builds a location from a stack frame.
   *
   * @param frame frame of the calling method
   * @return location naming the frame's file, line, method, and declaring class
   */
  public static Location of(StackWalker.StackFrame frame) {
    return new Location(
        frame.getFileName(), frame.getLineNumber(), null, frame.getMethodName(), frame.getClassName());
  }

  @Override
  public String toString() {
    return file + ':' + line;
  }
}
