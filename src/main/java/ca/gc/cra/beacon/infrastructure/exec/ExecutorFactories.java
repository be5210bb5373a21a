package ca.gc.cra.beacon.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named background threads BEACON owns.
 */
public final class ExecutorFactories {
  private static final AtomicInteger INSTANCE_INDEX = new AtomicInteger();

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded executor with an unbounded task queue.
   *
   * <p>Threads are daemons so an application that forgets to shut the client down can still exit.</p>
   *
   * @param prefix thread-name prefix, for example {@code beacon-sender}
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured executor service
   */
  public static ExecutorService newSingleWorker(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "beacon-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    int instance = INSTANCE_INDEX.getAndIncrement();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + instance);
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
