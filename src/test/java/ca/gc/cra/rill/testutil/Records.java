package ca.gc.cra.rill.testutil;

import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.KeyValue;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.Location;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.time.Instant;

/** Fixture records for drain tests. */
public final class Records {
  public static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

  private Records() {}

  public static LogRecord sample(Level level, String message) {
    return LogRecord.of(level, message, new Location("Fixture.java", 42, null, "run", "Fixture"), EPOCH);
  }

  public static Fields fields(LogRecord record, KeyValue... pairs) {
    return Fields.of(record, pairs);
  }
}
