package ca.gc.cra.rill.infrastructure.sink;

import static ca.gc.cra.rill.domain.kv.KeyValue.kv;
import static ca.gc.cra.rill.domain.kv.KeyValue.lazy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rill.application.logger.Logger;
import ca.gc.cra.rill.domain.record.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class Slf4jDrainTest {
  private static final String TARGET = "rill.test.slf4j";

  private ch.qos.logback.classic.Logger target;
  private ListAppender<ILoggingEvent> appender;
  private ch.qos.logback.classic.Level originalLevel;

  @BeforeEach
  void attachAppender() {
    target = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(TARGET);
    originalLevel = target.getLevel();
    target.setLevel(ch.qos.logback.classic.Level.TRACE);
    target.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    target.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    target.detachAppender(appender);
    target.setAdditive(true);
    target.setLevel(originalLevel);
    appender.stop();
  }

  @Test
  void rendersMessageAndPairsInSequenceOrder() {
    Logger logger = Logger.root(new Slf4jDrain(TARGET), kv("svc", "api"));

    logger.newChild(kv("req", 7)).info("served", kv("status", 200), kv("ok", true), kv("user", null));

    ILoggingEvent event = appender.list.get(0);
    assertEquals(ch.qos.logback.classic.Level.INFO, event.getLevel());
    assertEquals("served status=200, ok=true, user=null, req=7, svc=api", event.getFormattedMessage());
  }

  @Test
  void mapsLevelsAndMarksCritical() {
    Logger logger = Logger.root(new Slf4jDrain(TARGET));

    logger.critical("c");
    logger.error("e");
    logger.warning("w");
    logger.debug("d");
    logger.trace("t");

    List<ch.qos.logback.classic.Level> levels = appender.list.stream().map(ILoggingEvent::getLevel).toList();
    assertEquals(
        List.of(
            ch.qos.logback.classic.Level.ERROR,
            ch.qos.logback.classic.Level.ERROR,
            ch.qos.logback.classic.Level.WARN,
            ch.qos.logback.classic.Level.DEBUG,
            ch.qos.logback.classic.Level.TRACE),
        levels);
    assertTrue(appender.list.get(0).getMarkerList().contains(Slf4jDrain.CRITICAL));
    assertTrue(appender.list.get(1).getMarkerList() == null
        || appender.list.get(1).getMarkerList().isEmpty());
  }

  @Test
  void messageWithoutFieldsIsLoggedAsIs() {
    Logger.root(new Slf4jDrain(TARGET)).warning("plain");

    assertEquals("plain", appender.list.get(0).getFormattedMessage());
  }

  @Test
  void disabledBackendLevelSkipsRendering() {
    target.setLevel(ch.qos.logback.classic.Level.WARN);
    Slf4jDrain drain = new Slf4jDrain(TARGET);
    AtomicInteger evaluations = new AtomicInteger();

    Logger.root(drain).info("quiet", lazy("cost", record -> evaluations.incrementAndGet()));

    assertFalse(drain.isEnabled(Level.INFO));
    assertTrue(drain.isEnabled(Level.ERROR));
    assertEquals(0, evaluations.get());
    assertTrue(appender.list.isEmpty());
  }

  @Test
  void redactsConfiguredKeysAndTruncatesLongValues() {
    Slf4jDrain drain = new Slf4jDrain(LoggerFactory.getLogger(TARGET), Set.of("Password"), 16);

    Logger.root(drain).info("login", kv("password", "hunter2"), kv("note", "x".repeat(40)));

    String message = appender.list.get(0).getFormattedMessage();
    assertTrue(message.contains("password=[REDACTED]"), message);
    assertTrue(message.contains("note=xxxxxxxxxxxxxxxx? (truncated, 16 of 40)"), message);
  }
}
