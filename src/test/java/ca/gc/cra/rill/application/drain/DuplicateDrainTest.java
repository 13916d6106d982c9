package ca.gc.cra.rill.application.drain;

import static ca.gc.cra.rill.domain.kv.KeyValue.lazy;
import static ca.gc.cra.rill.testutil.Records.fields;
import static ca.gc.cra.rill.testutil.Records.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rill.application.port.AggregateDrainException;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import ca.gc.cra.rill.testutil.RecordingDrain;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class DuplicateDrainTest {
  @Test
  void bothDrainsReceiveTheSameRecord() throws Exception {
    RecordingDrain a = new RecordingDrain();
    RecordingDrain b = new RecordingDrain();
    LogRecord record = sample(Level.INFO, "fan-out");

    Drains.duplicate(a, b).log(record, fields(record));

    assertSame(record, a.entries().get(0).record());
    assertSame(record, b.entries().get(0).record());
  }

  @Test
  void secondDrainRunsWhenFirstFails() {
    DrainException failure = new DrainException("a down");
    RecordingDrain a = new RecordingDrain().failWith(failure);
    RecordingDrain b = new RecordingDrain();
    LogRecord record = sample(Level.ERROR, "still delivered");

    DrainException thrown =
        assertThrows(DrainException.class, () -> new DuplicateDrain(a, b).log(record, fields(record)));

    assertSame(failure, thrown);
    assertEquals(List.of("still delivered"), b.messages());
  }

  @Test
  void bothFailuresAreAggregated() {
    RecordingDrain a = new RecordingDrain().failWith(new DrainException("a down"));
    RecordingDrain b = new RecordingDrain().failWith(new DrainException("b down"));
    LogRecord record = sample(Level.ERROR, "nowhere");

    DrainException thrown =
        assertThrows(DrainException.class, () -> new DuplicateDrain(a, b).log(record, fields(record)));

    AggregateDrainException aggregate = assertInstanceOf(AggregateDrainException.class, thrown);
    assertEquals(2, aggregate.failures().size());
    assertEquals("2 drains failed: a down; b down", aggregate.getMessage());
    assertEquals("b down", aggregate.getSuppressed()[0].getMessage());
  }

  @Test
  void uncheckedFailureIsWrappedAndSecondStillRuns() {
    RecordingDrain a = new RecordingDrain().crashWith(new IllegalStateException("bug"));
    RecordingDrain b = new RecordingDrain();
    LogRecord record = sample(Level.WARNING, "careful");

    DrainException thrown =
        assertThrows(DrainException.class, () -> new DuplicateDrain(a, b).log(record, fields(record)));

    assertInstanceOf(IllegalStateException.class, thrown.getCause());
    assertEquals(1, b.entries().size());
  }

  @Test
  void nestedDuplicatesFlattenFailures() {
    RecordingDrain a = new RecordingDrain().failWith(new DrainException("a"));
    RecordingDrain b = new RecordingDrain().failWith(new DrainException("b"));
    RecordingDrain c = new RecordingDrain().failWith(new DrainException("c"));
    LogRecord record = sample(Level.ERROR, "x");

    DrainException thrown = assertThrows(DrainException.class,
        () -> new DuplicateDrain(new DuplicateDrain(a, b), c).log(record, fields(record)));

    assertEquals(List.of("a", "b", "c"), thrown.failures().stream().map(Throwable::getMessage).toList());
  }

  @Test
  void lazyValueIsEvaluatedOnceAcrossBranches() throws Exception {
    AtomicInteger evaluations = new AtomicInteger();
    RecordingDrain a = new RecordingDrain();
    RecordingDrain b = new RecordingDrain();
    LogRecord record = sample(Level.INFO, "shared");
    Fields fields = fields(record, lazy("cost", r -> evaluations.incrementAndGet()));

    new DuplicateDrain(a, b).log(record, fields);

    assertEquals(1, evaluations.get());
    assertEquals(1, a.entries().get(0).value("cost"));
    assertEquals(1, b.entries().get(0).value("cost"));
  }

  @Test
  void enabledWhenEitherSideIsEnabled() {
    RecordingDrain errorsOnly = new RecordingDrain().enabledAtOrAbove(Level.ERROR);
    RecordingDrain infoAndUp = new RecordingDrain().enabledAtOrAbove(Level.INFO);
    DuplicateDrain drain = new DuplicateDrain(errorsOnly, infoAndUp);

    assertTrue(drain.isEnabled(Level.INFO));
    assertFalse(drain.isEnabled(Level.DEBUG));
  }
}
