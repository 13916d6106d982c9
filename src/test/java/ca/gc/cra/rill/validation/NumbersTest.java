package ca.gc.cra.rill.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void requireRangeReturnsValueWhenWithinBounds() {
    assertEquals(5, Numbers.requireRange("capacity", 5, 1, 10));
  }

  @Test
  void requireRangeRejectsOutOfRange() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("capacity", 0, 1, 10));
    assertEquals("capacity must be between 1 and 10 (was 0)", ex.getMessage());
  }

  @Test
  void parseIntInRangeTrimsAndValidates() {
    assertEquals(64, Numbers.parseIntInRange("async.capacity", " 64 ", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("async.capacity", "101", 1, 100));
  }

  @Test
  void parseIntInRangeReportsMalformedInput() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("async.capacity", "12k", 1, 100));
    assertTrue(ex.getMessage().contains("must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange(null, " ", 1, 100));
  }
}
