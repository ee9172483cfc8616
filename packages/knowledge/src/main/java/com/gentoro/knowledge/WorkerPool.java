package com.gentoro.knowledge;

import com.gentoro.knowledge.exception.ValidationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared pool for semantic queries; daemon threads so it never blocks JVM shutdown. */
public final class WorkerPool implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(WorkerPool.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final ThreadPoolExecutor executor;

  public WorkerPool(int size) {
    if (size < 1) {
      throw new ValidationException("Worker pool size must be >= 1, got " + size);
    }
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            size,
            size,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "knowledge-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    this.executor.allowCoreThreadTimeOut(true);
  }

  public static int defaultSize() {
    return Math.max(4, Runtime.getRuntime().availableProcessors());
  }

  public ExecutorService executor() {
    return executor;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Worker pool did not stop within {}s; interrupting tasks", SHUTDOWN_WAIT_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
