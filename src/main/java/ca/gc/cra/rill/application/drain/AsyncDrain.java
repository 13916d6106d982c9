package ca.gc.cra.rill.application.drain;

import ca.gc.cra.rill.application.errors.LoggingDrainErrorHandler;
import ca.gc.cra.rill.application.port.ClockPort;
import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainErrorHandler;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.application.port.MetricsPort;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.KeyValue;
import ca.gc.cra.rill.domain.record.Level;
import ca.gc.cra.rill.domain.record.Location;
import ca.gc.cra.rill.domain.record.LogRecord;
import ca.gc.cra.rill.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decouples logging threads from a slow drain through a bounded queue and one worker thread.
 * <p>Producers enqueue {@code (record, fields)} and return without waiting for the inner drain. The worker
 * delivers items strictly in arrival order, so the inner drain is only ever called from that thread and
 * need not be thread-safe itself. Lazy values are evaluated on the worker.</p>
 * <p>When the queue is full the configured {@link OverflowStrategy} applies; the default blocks the producer.
 * Inner failures never reach producers; they go to the {@link DrainErrorHandler}.</p>
 * <p>{@link #close()} stops accepting records, lets the worker deliver everything already accepted, then joins
 * it. A record is either rejected with {@link DrainException} or delivered, even when close races a log call.</p>
 *
 * @since 0.1.0
 */
public final class AsyncDrain implements Drain, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncDrain.class);

  static final String OVERFLOW_MESSAGE = "rill-async: logger dropped messages due to channel overflow";
  private static final int DEFAULT_CAPACITY = 128;
  private static final String DEFAULT_THREAD_NAME = "rill-async";
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final long ENQUEUE_RECHECK_MILLIS = 50L;
  private static final Duration SHUTDOWN_PROGRESS_INTERVAL = Duration.ofSeconds(5);
  private static final int OVERFLOW_LOG_THRESHOLD = 1_000;
  private static final Task STOP = new Task(null, null);

  private final Drain inner;
  private final Settings settings;
  private final DrainErrorHandler errorHandler;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private final BlockingQueue<Task> queue;
  private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
  private final AtomicLong pendingDropped = new AtomicLong();
  private final AtomicLong droppedTotal = new AtomicLong();
  private final AtomicLong processed = new AtomicLong();
  private final AtomicInteger queueHighWaterMark = new AtomicInteger();
  private final AtomicInteger overflowLogLimiter = new AtomicInteger();
  private final ExecutorService executor;

  private volatile boolean closed;
  private volatile boolean workerAlive = true;

  /**
   * Creates an async drain with default settings.
   *
   * @param inner drain called from the worker thread
   */
  public AsyncDrain(Drain inner) {
    this(inner, Settings.defaults());
  }

  /**
   * Creates an async drain with explicit settings, reporting failures through SLF4J.
   *
   * @param inner drain called from the worker thread
   * @param settings queue and worker tuning
   */
  public AsyncDrain(Drain inner, Settings settings) {
    this(inner, settings, LoggingDrainErrorHandler.INSTANCE, MetricsPort.NO_OP);
  }

  /**
   * Creates an async drain and starts its worker.
   *
   * @param inner drain called from the worker thread
   * @param settings queue and worker tuning
   * @param errorHandler receives inner drain failures
   * @param metrics metrics sink for queue and delivery counters
   */
  public AsyncDrain(
      Drain inner, Settings settings, DrainErrorHandler errorHandler, MetricsPort metrics) {
    this.inner = Objects.requireNonNull(inner, "inner");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = ClockPort.SYSTEM;
    this.queue = new ArrayBlockingQueue<>(settings.capacity());
    this.executor = ExecutorFactories.newDrainWorker(settings.threadName(), this::handleWorkerCrash);
    this.executor.execute(new Worker());
    log.debug(
        "Started async drain worker {} with capacity {} ({})",
        settings.threadName(),
        settings.capacity(),
        settings.overflow());
  }

  @Override
  public void log(LogRecord record, Fields fields) throws DrainException {
    Lock lock = closeLock.readLock();
    lock.lock();
    try {
      if (closed) {
        throw new DrainException("Async drain closed");
      }
      Task task = new Task(record, fields);
      if (settings.overflow() == OverflowStrategy.BLOCK) {
        enqueueBlocking(task);
      } else if (!queue.offer(task)) {
        recordOverflow();
        return;
      }
      metrics.increment("async.enqueued");
      int depth = queue.size();
      metrics.observe("async.queue.depth", depth);
      updateQueueHighWater(depth);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isEnabled(Level level) {
    return inner.isEnabled(level);
  }

  /**
   * Stops accepting records, delivers everything already queued, and joins the worker.
   *
   * <p>Idempotent. Blocks until the worker has drained the queue; progress is logged while it waits. If the
   * calling thread is interrupted the flush continues in the background and the interrupt flag is restored.</p>
   */
  @Override
  public void close() {
    Lock lock = closeLock.writeLock();
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
    } finally {
      lock.unlock();
    }

    boolean interrupted = false;
    try {
      while (workerAlive && !queue.offer(STOP, ENQUEUE_RECHECK_MILLIS, TimeUnit.MILLISECONDS)) {
        // Worker is still making room.
      }
      if (!workerAlive && !queue.isEmpty()) {
        log.error(
            "Async worker {} terminated before close; {} accepted records were not delivered",
            settings.threadName(),
            queue.size());
      }
      executor.shutdown();
      while (!executor.awaitTermination(SHUTDOWN_PROGRESS_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Async drain {} still flushing {} queued records",
            settings.threadName(),
            queue.size());
      }
    } catch (InterruptedException ie) {
      interrupted = true;
      executor.shutdown();
      log.warn(
          "Interrupted while closing async drain {}; {} records still flushing in background",
          settings.threadName(),
          queue.size());
    }
    metrics.observe("async.queue.highWater", queueHighWaterMark.get());
    log.debug(
        "Async drain {} closed after delivering {} records ({} dropped)",
        settings.threadName(),
        processed.get(),
        droppedTotal.get());
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Returns whether {@link #close()} has been called.
   *
   * @return {@code true} once closing started
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Returns the number of records dropped on overflow since creation.
   *
   * @return total drops
   */
  public long droppedCount() {
    return droppedTotal.get();
  }

  /**
   * Returns the number of records waiting for the worker.
   *
   * @return current queue depth
   */
  public int queueSize() {
    return queue.size();
  }

  /**
   * Returns the tuning this drain was created with.
   *
   * @return settings
   */
  public Settings settings() {
    return settings;
  }

  private void enqueueBlocking(Task task) throws DrainException {
    try {
      while (!queue.offer(task, ENQUEUE_RECHECK_MILLIS, TimeUnit.MILLISECONDS)) {
        metrics.increment("async.enqueue.wait");
        if (!workerAlive) {
          throw new DrainException("Async worker " + settings.threadName() + " terminated");
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      metrics.increment("async.enqueue.interrupted");
      throw new DrainException("Interrupted while waiting for async queue space", ie);
    }
  }

  private void recordOverflow() {
    metrics.increment("async.dropped");
    droppedTotal.incrementAndGet();
    if (settings.overflow() == OverflowStrategy.DROP_AND_REPORT) {
      pendingDropped.incrementAndGet();
    }
    int count = overflowLogLimiter.incrementAndGet();
    if (count == 1 || count % OVERFLOW_LOG_THRESHOLD == 0) {
      log.warn(
          "Async drain {} queue full (capacity={}); dropped {} records so far",
          settings.threadName(),
          settings.capacity(),
          droppedTotal.get());
    }
  }

  private void updateQueueHighWater(int depth) {
    int previous;
    do {
      previous = queueHighWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!queueHighWaterMark.compareAndSet(previous, depth));
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (true) {
          Task task = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (task == null) {
            reportDropped();
            continue;
          }
          if (task == STOP) {
            break;
          }
          deliver(task.record(), task.fields());
          if (queue.isEmpty()) {
            reportDropped();
          }
        }
        reportDropped();
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        metrics.increment("async.worker.interrupted");
        log.warn(
            "Async worker {} interrupted with {} records undelivered",
            Thread.currentThread().getName(),
            queue.size());
      } finally {
        workerAlive = false;
      }
    }
  }

  private void deliver(LogRecord record, Fields fields) {
    long startNanos = System.nanoTime();
    try {
      inner.log(record, fields);
      processed.incrementAndGet();
      metrics.increment("async.processed");
      metrics.observe("async.deliver.latencyNanos", System.nanoTime() - startNanos);
    } catch (DrainException | RuntimeException failure) {
      metrics.increment("async.error");
      reportFailure(record, failure);
    }
  }

  private void reportFailure(LogRecord record, Exception failure) {
    try {
      errorHandler.onError(record, failure);
    } catch (RuntimeException handlerFailure) {
      handlerFailure.addSuppressed(failure);
      metrics.increment("async.handler.error");
      log.error(
          "Error handler failed for record '{}' on async worker {}",
          record.message(),
          settings.threadName(),
          handlerFailure);
    }
  }

  private void reportDropped() {
    long count = pendingDropped.getAndSet(0);
    if (count == 0) {
      return;
    }
    LogRecord report =
        LogRecord.of(Level.WARNING, OVERFLOW_MESSAGE, Location.UNKNOWN, Instant.ofEpochMilli(clock.nowMillis()));
    deliver(report, Fields.of(report, KeyValue.kv("count", count)));
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    workerAlive = false;
    metrics.increment("async.worker.uncaught");
    log.error("Async worker {} threw an uncaught exception", thread.getName(), throwable);
  }

  private record Task(LogRecord record, Fields fields) {}

  /**
   * Async drain tuning.
   *
   * @param capacity maximum records buffered between producers and the worker
   * @param overflow behaviour when the buffer is full
   * @param threadName worker thread name
   */
  public record Settings(int capacity, OverflowStrategy overflow, String threadName) {
    /**
     * Normalizes settings by clamping capacity and defaulting the overflow strategy and thread name.
     */
    public Settings {
      capacity = Math.max(1, capacity);
      overflow = Objects.requireNonNullElse(overflow, OverflowStrategy.BLOCK);
      threadName = threadName == null || threadName.isBlank() ? DEFAULT_THREAD_NAME : threadName.trim();
    }

    /**
     * Returns the default settings: 128 slots, blocking overflow, thread {@code rill-async}.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(DEFAULT_CAPACITY, OverflowStrategy.BLOCK, DEFAULT_THREAD_NAME);
    }

    /**
     * Returns a copy with a different capacity.
     *
     * @param newCapacity buffer size
     * @return updated settings
     */
    public Settings withCapacity(int newCapacity) {
      return new Settings(newCapacity, overflow, threadName);
    }

    /**
     * Returns a copy with a different overflow strategy.
     *
     * @param newOverflow overflow behaviour
     * @return updated settings
     */
    public Settings withOverflow(OverflowStrategy newOverflow) {
      return new Settings(capacity, newOverflow, threadName);
    }

    /**
     * Returns a copy with a different worker thread name.
     *
     * @param newThreadName thread name
     * @return updated settings
     */
    public Settings withThreadName(String newThreadName) {
      return new Settings(capacity, overflow, newThreadName);
    }
  }
}
