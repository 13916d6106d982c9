package ca.gc.cra.rill.application.logger;

import static ca.gc.cra.rill.domain.kv.KeyValue.kv;
import static ca.gc.cra.rill.domain.kv.KeyValue.lazy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rill.application.drain.LevelFilterDrain;
import ca.gc.cra.rill.application.errors.LastErrorSlot;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.Location;
import ca.gc.cra.rill.domain.record.LogRecord;
import ca.gc.cra.rill.testutil.RecordingDrain;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LoggerTest {
  @Test
  void recordCarriesCallSitePairsThenChildThenRootContext() {
    RecordingDrain drain = new RecordingDrain();
    Logger root = Logger.root(drain, kv("svc", "api"));
    Logger child = root.newChild(kv("req", 42));

    child.info("handled", kv("status", 200));

    RecordingDrain.Entry entry = drain.entries().get(0);
    assertEquals(Level.INFO, entry.record().level());
    assertEquals("handled", entry.record().message());
    assertEquals(List.of("status", "req", "svc"), entry.keys());
    assertEquals(List.of(200, 42, "api"), entry.values());
  }

  @Test
  void deepHierarchyKeepsMostSpecificFirstAndDuplicates() {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.root(drain, kv("k", "root"));
    for (int i = 1; i <= 5; i++) {
      logger = logger.newChild(kv("k", "level" + i));
    }

    logger.warning("deep", kv("k", "call"));

    RecordingDrain.Entry entry = drain.entries().get(0);
    assertEquals(
        List.of("call", "level5", "level4", "level3", "level2", "level1", "root"), entry.values());
    assertEquals(5, logger.context().depth());
    assertEquals(6, logger.context().totalPairs());
  }

  @Test
  void childrenShareTheParentDrainAndLeaveParentUnchanged() {
    RecordingDrain drain = new RecordingDrain();
    Logger root = Logger.root(drain, kv("svc", "api"));
    Logger child = root.newChild(kv("req", 1));

    root.info("from root");

    assertSame(root.drain(), child.drain());
    assertEquals(List.of("svc"), drain.entries().get(0).keys());
  }

  @Test
  void levelMethodsMapToLevels() {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.root(drain);

    logger.critical("c");
    logger.error("e");
    logger.warning("w");
    logger.info("i");
    logger.debug("d");
    logger.trace("t");

    List<Level> levels = drain.entries().stream().map(entry -> entry.record().level()).toList();
    assertEquals(
        List.of(Level.CRITICAL, Level.ERROR, Level.WARNING, Level.INFO, Level.DEBUG, Level.TRACE), levels);
  }

  @Test
  void drainFailureIsRoutedToHandlerAndNotThrown() {
    DrainException failure = new DrainException("sink offline");
    RecordingDrain drain = new RecordingDrain().failWith(failure);
    LastErrorSlot slot = new LastErrorSlot();
    Logger logger = Logger.builder(drain).errorHandler(slot).build();

    logger.error("boom");
    logger.error("again");

    assertEquals(2, slot.count());
    LastErrorSlot.Failure last = slot.last().orElseThrow();
    assertSame(failure, last.error());
    assertEquals("again", last.record().message());
  }

  @Test
  void uncheckedDrainFailureIsAlsoRouted() {
    RecordingDrain drain = new RecordingDrain().crashWith(new IllegalStateException("bug"));
    LastErrorSlot slot = new LastErrorSlot();
    Logger logger = Logger.builder(drain).errorHandler(slot).build();

    logger.info("still returns");

    assertInstanceOf(IllegalStateException.class, slot.last().orElseThrow().error());
  }

  @Test
  void disabledLevelSkipsRecordConstructionAndLazyValues() {
    RecordingDrain inner = new RecordingDrain();
    AtomicInteger evaluations = new AtomicInteger();
    Logger logger = Logger.root(new LevelFilterDrain(Level.INFO, inner));

    logger.debug("hidden", lazy("cost", record -> evaluations.incrementAndGet()));
    logger.info("shown", lazy("cost", record -> evaluations.incrementAndGet()));

    assertEquals(List.of("shown"), inner.messages());
    assertEquals(1, evaluations.get());
    assertFalse(logger.isEnabled(Level.DEBUG));
    assertTrue(logger.isEnabled(Level.WARNING));
  }

  @Test
  void lazyRootContextIsNeverEvaluatedForDroppedRecords() {
    AtomicInteger evaluations = new AtomicInteger();
    RecordingDrain inner = new RecordingDrain();
    Logger logger = Logger.root(
        new LevelFilterDrain(Level.ERROR, inner), lazy("expensive", record -> evaluations.incrementAndGet()));

    logger.info("dropped");
    logger.newChild(kv("a", 1)).warning("also dropped");

    assertEquals(0, evaluations.get());
    assertEquals(0, inner.logCalls());
  }

  @Test
  void capturesCallSiteLocation() {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.root(drain);

    logger.info("where");

    Location location = drain.entries().get(0).record().location();
    assertEquals("LoggerTest.java", location.file());
    assertTrue(location.line() > 0);
    assertEquals("capturesCallSiteLocation", location.function());
    assertEquals(LoggerTest.class.getName(), location.module());
  }

  @Test
  void locationCaptureCanBeDisabled() {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.builder(drain).captureLocation(false).build();

    logger.info("nowhere");

    assertEquals(Location.UNKNOWN, drain.entries().get(0).record().location());
  }

  @Test
  void timestampsAndTagsComeFromLoggerInputs() {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.builder(drain).clock(() -> 1_700_000_000_000L).build();

    logger.logTagged(Level.INFO, "audit", "login", kv("user", "alice"));
    logger.logAt(Level.ERROR, new Location("Other.java", 7, 3, null, null), "", "explicit");

    LogRecord tagged = drain.entries().get(0).record();
    assertEquals("audit", tagged.tag());
    assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), tagged.timestamp());
    LogRecord explicit = drain.entries().get(1).record();
    assertEquals("Other.java", explicit.location().file());
    assertEquals(3, explicit.location().column());
  }

  @Test
  void loggersAreSafeToShareAcrossThreads() throws Exception {
    RecordingDrain drain = new RecordingDrain();
    Logger logger = Logger.root(drain, kv("svc", "api"));
    Thread[] threads = new Thread[4];
    for (int t = 0; t < threads.length; t++) {
      int id = t;
      threads[t] = new Thread(() -> {
        Logger local = logger.newChild(kv("thread", id));
        for (int i = 0; i < 250; i++) {
          local.info("tick", kv("i", i));
        }
      });
      threads[t].start();
    }
    for (Thread thread : threads) {
      thread.join();
    }

    assertEquals(1000, drain.entries().size());
    for (RecordingDrain.Entry entry : drain.entries()) {
      assertEquals(List.of("i", "thread", "svc"), entry.keys());
    }
  }

  @Test
  void failingEnablementCheckIsTreatedAsEnabled() {
    List<String> messages = new CopyOnWriteArrayList<>();
    Drain drain = new Drain() {
      @Override
      public void log(LogRecord record, Fields fields) {
        messages.add(record.message());
      }

      @Override
      public boolean isEnabled(Level level) {
        throw new IllegalStateException("hint bug");
      }
    };
    Logger logger = Logger.root(drain);

    assertDoesNotThrow(() -> logger.info("x"));
    assertDoesNotThrow(() -> logger.logTagged(Level.WARNING, "audit", "y"));
    assertTrue(logger.isEnabled(Level.TRACE));
    assertEquals(List.of("x", "y"), messages);
  }
}
