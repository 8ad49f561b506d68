package ca.gc.cra.portalwatch.infrastructure.loop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SingleThreadEventLoopTest {
  private SingleThreadEventLoop loop;

  @BeforeEach
  void setUp() {
    loop = new SingleThreadEventLoop("test-loop");
  }

  @AfterEach
  void tearDown() {
    loop.close();
  }

  @Test
  void postedTasksRunInOrderOnLoopThread() throws Exception {
    List<Integer> seen = new CopyOnWriteArrayList<>();
    AtomicBoolean onLoop = new AtomicBoolean(true);
    CountDownLatch done = new CountDownLatch(1);
    for (int i = 0; i < 5; i++) {
      int value = i;
      loop.post(() -> {
        seen.add(value);
        onLoop.compareAndSet(true, loop.isLoopThread());
      });
    }
    loop.post(done::countDown);

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals(List.of(0, 1, 2, 3, 4), seen);
    assertTrue(onLoop.get());
    assertFalse(loop.isLoopThread());
  }

  @Test
  void threadIsNamedAfterPrefix() throws Exception {
    String name = loop.call(() -> Thread.currentThread().getName());
    assertTrue(name.startsWith("test-loop-"), name);
    assertTrue(loop.call(() -> Thread.currentThread().isDaemon()));
  }

  @Test
  void scheduledTaskRunsAfterDelay() throws Exception {
    CountDownLatch fired = new CountDownLatch(1);
    long start = System.nanoTime();
    loop.schedule(Duration.ofMillis(50), fired::countDown);

    assertTrue(fired.await(5, TimeUnit.SECONDS));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
  }

  @Test
  void cancelledScheduledTaskNeverRuns() throws Exception {
    AtomicBoolean ran = new AtomicBoolean();
    Cancellable handle = loop.schedule(Duration.ofMillis(200), () -> ran.set(true));
    handle.cancel();

    CountDownLatch later = new CountDownLatch(1);
    loop.schedule(Duration.ofMillis(400), later::countDown);
    assertTrue(later.await(5, TimeUnit.SECONDS));
    assertFalse(ran.get());
  }

  @Test
  void failingTaskDoesNotStopLoop() throws Exception {
    loop.post(() -> {
      throw new IllegalStateException("boom");
    });
    assertEquals("still running", loop.call(() -> "still running"));
  }

  @Test
  void callPropagatesTaskFailure() {
    ExecutionException ex = assertThrows(ExecutionException.class, () -> loop.call(() -> {
      throw new IllegalArgumentException("bad");
    }));
    assertTrue(ex.getCause() instanceof IllegalArgumentException);
  }

  @Test
  void callFromLoopThreadIsRejected() throws Exception {
    Throwable failure = loop.call(() -> {
      try {
        loop.call(() -> "nested");
        return null;
      } catch (IllegalStateException ex) {
        return ex;
      }
    });
    assertTrue(failure instanceof IllegalStateException);
  }

  @Test
  void tasksAfterCloseAreDropped() {
    loop.close();
    AtomicBoolean ran = new AtomicBoolean();
    loop.post(() -> ran.set(true));
    Cancellable handle = loop.schedule(Duration.ZERO, () -> ran.set(true));
    handle.cancel();
    assertFalse(ran.get());
  }
}
