package ca.gc.cra.rill.application.drain;

import static ca.gc.cra.rill.testutil.Records.fields;
import static ca.gc.cra.rill.testutil.Records.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import ca.gc.cra.rill.testutil.RecordingDrain;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterDrainTest {
  @Test
  void forwardsOnlyMatchingRecords() throws Exception {
    RecordingDrain inner = new RecordingDrain();
    FilterDrain drain = Drains.filter(record -> record.message().startsWith("keep"), inner);

    for (String message : List.of("keep-1", "drop", "keep-2")) {
      LogRecord record = sample(Level.INFO, message);
      drain.log(record, fields(record));
    }

    assertEquals(List.of("keep-1", "keep-2"), inner.messages());
  }

  @Test
  void isEnabledDelegatesToInner() {
    RecordingDrain inner = new RecordingDrain().enabledAtOrAbove(Level.ERROR);

    assertFalse(new FilterDrain(record -> true, inner).isEnabled(Level.INFO));
  }

  @Test
  void discardAcceptsEverythingAndAdvertisesNothing() throws Exception {
    LogRecord record = sample(Level.CRITICAL, "gone");
    Drains.discard().log(record, fields(record));

    for (Level level : Level.values()) {
      assertFalse(DiscardDrain.INSTANCE.isEnabled(level));
    }
  }
}
