package ca.gc.cra.rill.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void workerIsNamedNonDaemonThread() throws Exception {
    ExecutorService executor = ExecutorFactories.newDrainWorker("rill-exec-test", null);
    AtomicReference<String> name = new AtomicReference<>();
    AtomicBoolean daemon = new AtomicBoolean(true);
    try {
      executor.submit(() -> {
        name.set(Thread.currentThread().getName());
        daemon.set(Thread.currentThread().isDaemon());
      }).get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertEquals("rill-exec-test", name.get());
    assertFalse(daemon.get());
  }

  @Test
  void blankNameFallsBackToDefault() throws Exception {
    ExecutorService executor = ExecutorFactories.newDrainWorker(" ", null);
    try {
      String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertEquals("rill-async", name);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void rejectsSecondTaskWhileWorkerIsBusy() throws Exception {
    ExecutorService executor = ExecutorFactories.newDrainWorker("rill-busy", null);
    CountDownLatch running = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    try {
      executor.execute(() -> {
        running.countDown();
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertTrue(running.await(5, TimeUnit.SECONDS));

      assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> {}));
    } finally {
      release.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void uncaughtExceptionsReachTheHandler() throws Exception {
    CountDownLatch handled = new CountDownLatch(1);
    AtomicReference<Throwable> seen = new AtomicReference<>();
    ExecutorService executor = ExecutorFactories.newDrainWorker("rill-crash", (thread, ex) -> {
      seen.set(ex);
      handled.countDown();
    });
    try {
      executor.execute(() -> {
        throw new IllegalStateException("worker bug");
      });
      assertTrue(handled.await(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }

    assertEquals("worker bug", seen.get().getMessage());
  }
}
