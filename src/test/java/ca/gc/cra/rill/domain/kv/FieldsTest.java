package ca.gc.cra.rill.domain.kv;

import static ca.gc.cra.rill.domain.kv.KeyValue.kv;
import static ca.gc.cra.rill.domain.kv.KeyValue.lazy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.Location;
import ca.gc.cra.rill.domain.record.LogRecord;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class FieldsTest {
  private static final LogRecord RECORD =
      LogRecord.of(Level.INFO, "hello", Location.UNKNOWN, Instant.parse("2024-01-01T00:00:00Z"));

  @Test
  void callSitePairsComeBeforeInheritedContext() {
    ContextNode chain = ContextNode.root(List.of(kv("r", 0)))
        .child(List.of(kv("c1", 1)))
        .child(List.of(kv("c2", 2)));

    Fields fields = Fields.of(RECORD, List.of(kv("x", "call"), kv("r", "shadow")), chain);

    List<String> keys = new ArrayList<>();
    fields.forEach(pair -> keys.add(pair.key()));
    assertEquals(List.of("x", "r", "c2", "c1", "r"), keys);
    assertEquals(5, fields.size());
    assertSame(RECORD, fields.record());
  }

  @Test
  void lazyValueIsComputedOncePerCall() {
    AtomicInteger calls = new AtomicInteger();
    KeyValue pair = lazy("expensive", record -> calls.incrementAndGet());
    Fields fields = Fields.of(RECORD, pair);

    Object first = fields.resolve(pair.value());
    Object second = fields.resolve(pair.value());

    assertEquals(1, first);
    assertEquals(1, second);
    assertEquals(1, calls.get());
  }

  @Test
  void lazyValueSeesTheRecord() {
    KeyValue pair = lazy("msgLen", record -> record.message().length());

    assertEquals(5, Fields.of(RECORD, pair).resolve(pair.value()));
  }

  @Test
  void lazyNullResultIsMemoized() {
    AtomicInteger calls = new AtomicInteger();
    KeyValue pair = lazy("maybe", record -> {
      calls.incrementAndGet();
      return null;
    });
    Fields fields = Fields.of(RECORD, pair);

    assertNull(fields.resolve(pair.value()));
    assertNull(fields.resolve(pair.value()));
    assertEquals(1, calls.get());
  }

  @Test
  void concurrentResolversShareOneEvaluation() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    KeyValue pair = lazy("shared", record -> calls.incrementAndGet());
    Fields fields = Fields.of(RECORD, pair);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Object>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(pool.submit(() -> {
          start.await();
          return fields.resolve(pair.value());
        }));
      }
      start.countDown();
      for (Future<Object> result : results) {
        assertEquals(1, result.get(5, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, calls.get());
  }

  @Test
  void serializeDispatchesByRuntimeType() throws IOException {
    Fields fields = Fields.of(
        RECORD,
        kv("s", "text"),
        kv("i", 3),
        kv("l", 4L),
        kv("d", 1.5d),
        kv("f", 2.5f),
        kv("b", true),
        kv("n", null),
        kv("e", Level.WARNING),
        kv("o", List.of(1, 2)),
        lazy("lz", record -> "computed"));

    RecordingSerializer serializer = new RecordingSerializer();
    fields.serialize(serializer);

    assertEquals(
        List.of(
            "str:s=text",
            "long:i=3",
            "long:l=4",
            "double:d=1.5",
            "double:f=2.5",
            "bool:b=true",
            "null:n",
            "str:e=WARNING",
            "str:o=[1, 2]",
            "str:lz=computed"),
        serializer.events);
  }

  @Test
  void serializerFailureStopsIteration() {
    Fields fields = Fields.of(RECORD, kv("a", 1), kv("b", 2));
    RecordingSerializer serializer = new RecordingSerializer() {
      @Override
      public void emitLong(String key, long value) throws IOException {
        super.emitLong(key, value);
        throw new IOException("disk full");
      }
    };

    assertThrows(IOException.class, () -> fields.serialize(serializer));
    assertEquals(List.of("long:a=1"), serializer.events);
  }

  private static class RecordingSerializer implements Serializer {
    final List<String> events = new ArrayList<>();

    @Override
    public void emitString(String key, String value) throws IOException {
      events.add("str:" + key + "=" + value);
    }

    @Override
    public void emitLong(String key, long value) throws IOException {
      events.add("long:" + key + "=" + value);
    }

    @Override
    public void emitDouble(String key, double value) throws IOException {
      events.add("double:" + key + "=" + value);
    }

    @Override
    public void emitBoolean(String key, boolean value) throws IOException {
      events.add("bool:" + key + "=" + value);
    }

    @Override
    public void emitNull(String key) throws IOException {
      events.add("null:" + key);
    }
  }
}
