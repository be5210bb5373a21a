package ca.gc.cra.beacon.domain.context;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Captured context that can be re-established on another thread.
 *
 * <p>Work wrapped by a carrier observes the captured tags and correlation while it runs; the executing thread's
 * own context is restored afterwards.</p>
 *
 * @since 0.1.0
 */
public final class ContextCarrier {
  private final ContextPropagator propagator;
  private final ContextState state;

  ContextCarrier(ContextPropagator propagator, ContextState state) {
    this.propagator = propagator;
    this.state = state;
  }

  /**
   * Runs {@code task} on the current thread under the captured context.
   *
   * @param task work to run
   */
  public void run(Runnable task) {
    Objects.requireNonNull(task, "task");
    try (Scope ignored = propagator.install(state)) {
      task.run();
    }
  }

  /**
   * Calls {@code task} on the current thread under the captured context.
   *
   * @param task work to call
   * @param <T> result type
   * @return task result
   * @throws Exception whatever {@code task} throws
   */
  public <T> T call(Callable<T> task) throws Exception {
    Objects.requireNonNull(task, "task");
    try (Scope ignored = propagator.install(state)) {
      return task.call();
    }
  }

  /**
   * Wraps {@code task} so that it runs under the captured context wherever it is executed.
   *
   * @param task work to wrap
   * @return wrapped runnable
   */
  public Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> run(task);
  }

  /**
   * Wraps {@code task} so that it runs under the captured context wherever it is executed.
   *
   * @param task work to wrap
   * @param <T> result type
   * @return wrapped callable
   */
  public <T> Callable<T> wrap(Callable<T> task) {
    Objects.requireNonNull(task, "task");
    return () -> call(task);
  }
}
