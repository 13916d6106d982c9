package ca.gc.cra.rill.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors behind asynchronous drains.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds an executor that runs exactly one long-lived worker task.
   *
   * <p>The executor accepts a single task; submitting a second while the first runs is rejected. Threads are
   * non-daemon so that an unclosed drain keeps the JVM alive instead of losing queued records.</p>
   *
   * @param name thread name; defaults to {@code rill-async} when blank
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured executor service
   */
  public static ExecutorService newDrainWorker(String name, UncaughtExceptionHandler handler) {
    String threadPrefix = (name == null || name.isBlank()) ? "rill-async" : name;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          int n = index.getAndIncrement();
          thread.setName(n == 0 ? threadPrefix : threadPrefix + "-" + n);
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
