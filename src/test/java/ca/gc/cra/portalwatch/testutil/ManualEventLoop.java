package ca.gc.cra.portalwatch.testutil;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.ClockPort;
import ca.gc.cra.portalwatch.application.port.EventLoopPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic event loop with a virtual clock. Tasks run only when the test calls {@link #runPending()} or
 * {@link #advance(Duration)}.
 */
public final class ManualEventLoop implements EventLoopPort, ClockPort {
  private final List<Task> tasks = new ArrayList<>();
  private long nowMillis;
  private long sequence;

  public ManualEventLoop() {
    this(1_000_000L);
  }

  public ManualEventLoop(long startMillis) {
    this.nowMillis = startMillis;
  }

  @Override
  public long nowMillis() {
    return nowMillis;
  }

  @Override
  public void post(Runnable task) {
    tasks.add(new Task(nowMillis, sequence++, task));
  }

  @Override
  public Cancellable schedule(Duration delay, Runnable task) {
    Task scheduled = new Task(nowMillis + Math.max(0L, delay.toMillis()), sequence++, task);
    tasks.add(scheduled);
    return () -> tasks.remove(scheduled);
  }

  /** Runs every task due at the current virtual time, including tasks they post. */
  public void runPending() {
    Optional<Task> next;
    while ((next = nextDue(nowMillis)).isPresent()) {
      Task task = next.get();
      tasks.remove(task);
      task.runnable.run();
    }
  }

  /**
   * Moves the clock forward, running tasks in due order at their due time.
   *
   * @param duration how far to move the clock
   */
  public void advance(Duration duration) {
    long target = nowMillis + duration.toMillis();
    runPending();
    Optional<Task> next;
    while ((next = nextDue(target)).isPresent()) {
      Task task = next.get();
      nowMillis = Math.max(nowMillis, task.dueMillis);
      tasks.remove(task);
      task.runnable.run();
      runPending();
    }
    nowMillis = target;
    runPending();
  }

  /**
   * Moves the clock without running anything.
   *
   * @param duration how far to move the clock
   */
  public void tick(Duration duration) {
    nowMillis += duration.toMillis();
  }

  public int pendingTasks() {
    return tasks.size();
  }

  /**
   * Returns the delay until the earliest queued task.
   *
   * @return delay, empty when nothing is queued
   */
  public Optional<Duration> nextDelay() {
    return tasks.stream()
        .min(Comparator.comparingLong((Task t) -> t.dueMillis).thenComparingLong(t -> t.sequence))
        .map(task -> Duration.ofMillis(Math.max(0L, task.dueMillis - nowMillis)));
  }

  private Optional<Task> nextDue(long limit) {
    return tasks.stream()
        .filter(task -> task.dueMillis <= limit)
        .min(Comparator.comparingLong((Task t) -> t.dueMillis).thenComparingLong(t -> t.sequence));
  }

  private static final class Task {
    final long dueMillis;
    final long sequence;
    final Runnable runnable;

    Task(long dueMillis, long sequence, Runnable runnable) {
      this.dueMillis = dueMillis;
      this.sequence = sequence;
      this.runnable = runnable;
    }
  }
}
