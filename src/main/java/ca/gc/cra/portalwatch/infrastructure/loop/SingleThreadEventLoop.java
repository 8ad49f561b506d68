package ca.gc.cra.portalwatch.infrastructure.loop;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.EventLoopPort;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventLoopPort} running every task on one daemon thread.
 * <p><strong>Why:</strong> The prober, monitor and adapter share mutable state without locks; running them on one
 * thread makes that safe.</p>
 * <p><strong>Thread-safety:</strong> Submission methods are thread-safe; tasks never overlap.</p>
 * <p><strong>Observability:</strong> A task that throws is logged at ERROR and the loop keeps running.</p>
 *
 * @since 0.1.0
 */
public final class SingleThreadEventLoop implements EventLoopPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);
  private static final AtomicInteger LOOP_INDEX = new AtomicInteger();

  private final ScheduledExecutorService executor;
  private volatile Thread loopThread;

  /**
   * Creates and starts a loop whose thread is named {@code <name>-<n>}.
   *
   * @param name thread-name prefix; blank defaults to {@code portalwatch-loop}
   */
  public SingleThreadEventLoop(String name) {
    String prefix = (name == null || name.isBlank()) ? "portalwatch-loop" : name;
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + LOOP_INDEX.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
          (t, ex) -> log.error("Uncaught exception on event loop thread {}", t.getName(), ex));
      loopThread = thread;
      return thread;
    };
    ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, factory);
    pool.setRemoveOnCancelPolicy(true);
    pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    this.executor = pool;
  }

  @Override
  public void post(Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      executor.execute(guarded(task));
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop shut down; dropping task");
    }
  }

  @Override
  public Cancellable schedule(Duration delay, Runnable task) {
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(task, "task");
    long millis = Math.max(0L, delay.toMillis());
    try {
      ScheduledFuture<?> future = executor.schedule(guarded(task), millis, TimeUnit.MILLISECONDS);
      return () -> future.cancel(false);
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop shut down; dropping scheduled task");
      return Cancellable.NONE;
    }
  }

  /**
   * Runs a task on the loop and waits for its value. Must not be called from the loop thread.
   *
   * @param task task to run
   * @param <T> result type
   * @return task result
   * @throws InterruptedException if the caller is interrupted while waiting
   * @throws ExecutionException if the task throws
   */
  public <T> T call(Callable<T> task) throws InterruptedException, ExecutionException {
    Objects.requireNonNull(task, "task");
    if (isLoopThread()) {
      throw new IllegalStateException("call() would deadlock on the event loop thread");
    }
    Future<T> future = executor.submit(task);
    return future.get();
  }

  /**
   * Reports whether the caller runs on the loop thread.
   *
   * @return {@code true} on the loop thread
   */
  public boolean isLoopThread() {
    return Thread.currentThread() == loopThread;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Event loop did not terminate within 5 seconds");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.error("Event loop task failed", ex);
      }
    };
  }
}
