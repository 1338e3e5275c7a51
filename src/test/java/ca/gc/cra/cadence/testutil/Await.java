package ca.gc.cra.cadence.testutil;

import static org.junit.jupiter.api.Assertions.fail;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Deadline polling for asynchronous assertions.
 */
public final class Await {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private Await() {}

  public static void until(BooleanSupplier condition, String description) {
    until(condition, DEFAULT_TIMEOUT, description);
  }

  public static void until(BooleanSupplier condition, Duration timeout, String description) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() >= deadline) {
        fail("Timed out after " + timeout.toMillis() + " ms waiting for " + description);
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        fail("Interrupted while waiting for " + description);
      }
    }
  }
}
