package ca.gc.cra.cadence.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cadence.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.cadence.testutil.Await;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TemporaryQueryReaperTest {
  private final ScheduledExecutorService scheduler = ExecutorFactories.newDispatcher("reaper-test");
  private final AtomicInteger sweeps = new AtomicInteger();

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void firesOnceAfterQuietPeriod() {
    TemporaryQueryReaper reaper = new TemporaryQueryReaper(scheduler, Duration.ofMillis(50), sweeps::incrementAndGet);
    runOnScheduler(reaper::rearm);

    Await.until(() -> sweeps.get() == 1, "sweep");
    assertFalse(callOnScheduler(reaper::isArmed));
  }

  @Test
  void rearmingPostponesTheSweep() throws Exception {
    TemporaryQueryReaper reaper = new TemporaryQueryReaper(scheduler, Duration.ofMillis(400), sweeps::incrementAndGet);
    runOnScheduler(reaper::rearm);
    Thread.sleep(200);
    runOnScheduler(reaper::rearm);
    Thread.sleep(250);

    assertEquals(0, sweeps.get());
    Await.until(() -> sweeps.get() == 1, "postponed sweep");
  }

  @Test
  void cancelPreventsSweep() throws Exception {
    TemporaryQueryReaper reaper = new TemporaryQueryReaper(scheduler, Duration.ofMillis(50), sweeps::incrementAndGet);
    runOnScheduler(reaper::rearm);
    assertTrue(callOnScheduler(reaper::isArmed));
    runOnScheduler(reaper::cancel);

    Thread.sleep(150);
    assertEquals(0, sweeps.get());
  }

  @Test
  void rejectsNonPositiveQuietPeriod() {
    assertThrows(IllegalArgumentException.class,
        () -> new TemporaryQueryReaper(scheduler, Duration.ZERO, sweeps::incrementAndGet));
  }

  private void runOnScheduler(Runnable task) {
    callOnScheduler(() -> {
      task.run();
      return null;
    });
  }

  private <T> T callOnScheduler(Callable<T> task) {
    try {
      return scheduler.submit(task).get(5, TimeUnit.SECONDS);
    } catch (Exception ex) {
      throw new AssertionError("scheduler task failed", ex);
    }
  }
}
