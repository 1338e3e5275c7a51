package ca.gc.cra.cadence.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Debounced timer that sweeps temporary queries out of the ledger once no new temporary query was submitted for a
 * quiet period.
 * <p>Each {@link #rearm()} restarts the quiet period. The sweep runs on the supplied scheduler, which for the
 * pipeline is its dispatcher thread. Not thread-safe; confined to that thread.</p>
 *
 * @since 0.1.0
 */
final class TemporaryQueryReaper {
  private final ScheduledExecutorService scheduler;
  private final Duration quietPeriod;
  private final Runnable sweep;
  private ScheduledFuture<?> pending;

  TemporaryQueryReaper(ScheduledExecutorService scheduler, Duration quietPeriod, Runnable sweep) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.quietPeriod = Objects.requireNonNull(quietPeriod, "quietPeriod");
    this.sweep = Objects.requireNonNull(sweep, "sweep");
    if (quietPeriod.isNegative() || quietPeriod.isZero()) {
      throw new IllegalArgumentException("quietPeriod must be positive");
    }
  }

  /**
   * Cancels any scheduled sweep and schedules a new one a full quiet period from now.
   */
  void rearm() {
    cancel();
    pending = scheduler.schedule(this::fire, quietPeriod.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Cancels the scheduled sweep, if any.
   */
  void cancel() {
    ScheduledFuture<?> current = pending;
    pending = null;
    if (current != null) {
      current.cancel(false);
    }
  }

  boolean isArmed() {
    return pending != null;
  }

  Duration quietPeriod() {
    return quietPeriod;
  }

  private void fire() {
    pending = null;
    sweep.run();
  }
}
