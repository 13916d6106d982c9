package ca.gc.cra.rill.application.errors;

import static ca.gc.cra.rill.testutil.Records.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.LogRecord;
import org.junit.jupiter.api.Test;

class LastErrorSlotTest {
  @Test
  void keepsMostRecentFailureAndCountsAll() {
    LastErrorSlot slot = new LastErrorSlot();
    LogRecord first = sample(Level.ERROR, "first");
    LogRecord second = sample(Level.ERROR, "second");
    DrainException latest = new DrainException("latest");

    slot.onError(first, new DrainException("earlier"));
    slot.onError(second, latest);

    assertEquals(2, slot.count());
    assertSame(second, slot.last().orElseThrow().record());
    assertSame(latest, slot.last().orElseThrow().error());
  }

  @Test
  void takeEmptiesTheSlotButKeepsTheCount() {
    LastErrorSlot slot = new LastErrorSlot();
    slot.onError(sample(Level.WARNING, "w"), new DrainException("x"));

    assertTrue(slot.take().isPresent());
    assertTrue(slot.take().isEmpty());
    assertEquals(1, slot.count());
  }

  @Test
  void clearForgetsLastFailure() {
    LastErrorSlot slot = new LastErrorSlot();
    slot.onError(sample(Level.WARNING, "w"), new DrainException("x"));

    slot.clear();

    assertTrue(slot.last().isEmpty());
  }
}
