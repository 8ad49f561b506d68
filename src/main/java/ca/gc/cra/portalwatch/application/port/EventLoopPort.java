package ca.gc.cra.portalwatch.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Single-threaded task dispatcher that owns all validation state.
 * <p><strong>Why:</strong> The prober, monitor and adapter are not synchronized; confining them to one loop removes
 * the need for locks.</p>
 * <p><strong>Role:</strong> Implemented by {@code SingleThreadEventLoop}; tests use a manual loop with a virtual
 * clock.</p>
 * <p><strong>Thread-safety:</strong> {@link #post(Runnable)} and {@link #schedule(Duration, Runnable)} may be called
 * from any thread; tasks run one at a time in submission order.</p>
 *
 * @since 0.1.0
 */
public interface EventLoopPort {
  /**
   * Queues a task for execution on the loop.
   *
   * @param task task to run; must not be {@code null}
   */
  void post(Runnable task);

  /**
   * Queues a task to run after a delay.
   *
   * @param delay delay before running; zero or negative runs as soon as possible
   * @param task task to run; must not be {@code null}
   * @return handle that prevents the task from running when cancelled first
   */
  Cancellable schedule(Duration delay, Runnable task);
}
