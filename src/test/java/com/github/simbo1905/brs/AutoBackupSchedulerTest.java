package com.github.simbo1905.brs;

import static org.junit.Assert.*;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class AutoBackupSchedulerTest extends JulLoggingConfig {

  /// Every-minute schedule against a clock frozen just before a minute boundary, so each run is
  /// due a few milliseconds after the previous one.
  private static final Clock NEARLY_NEXT_MINUTE =
      Clock.fixed(Instant.parse("2025-03-15T10:00:59.980Z"), ZoneOffset.UTC);

  @Test
  public void testNextFireTimeFollowsTheSchedule() {
    try (var scheduler =
        new AutoBackupScheduler(
                CronSchedule.parse("hourly"),
                ZoneOffset.UTC,
                Clock.fixed(Instant.parse("2025-03-15T10:20:00Z"), ZoneOffset.UTC),
                () -> null)
            .start()) {
      assertEquals("2025-03-15T11:00Z", scheduler.nextFireTime().orElseThrow().toString());
    }
  }

  @Test
  public void testScheduleThatNeverFiresDoesNotLeakTheExecutor() {
    final var scheduler =
        new AutoBackupScheduler(
            CronSchedule.parse("0 0 31 2 *"), ZoneOffset.UTC, NEARLY_NEXT_MINUTE, () -> null);

    final var e = assertThrows(IllegalStateException.class, scheduler::start);

    assertTrue(e.getMessage().contains("never fires"));
    assertTrue(scheduler.isShutdown());
    assertTrue(scheduler.nextFireTime().isEmpty());
  }

  @Test
  public void testFailedRunDoesNotStopLaterRuns() throws InterruptedException {
    final var runs = new AtomicInteger();
    final var latch = new CountDownLatch(3);
    try (var ignored =
        new AutoBackupScheduler(
                CronSchedule.parse("* * * * *"),
                ZoneOffset.UTC,
                NEARLY_NEXT_MINUTE,
                () -> {
                  latch.countDown();
                  if (runs.incrementAndGet() == 1) {
                    throw new IOException("disk full");
                  }
                  return null;
                })
            .start()) {
      assertTrue("expected three runs", latch.await(10, TimeUnit.SECONDS));
    }
  }

  @Test
  public void testCloseStopsFurtherRuns() throws InterruptedException {
    final var runs = new AtomicInteger();
    final var first = new CountDownLatch(1);
    final var scheduler =
        new AutoBackupScheduler(
                CronSchedule.parse("* * * * *"),
                ZoneOffset.UTC,
                NEARLY_NEXT_MINUTE,
                () -> {
                  runs.incrementAndGet();
                  first.countDown();
                  return null;
                })
            .start();
    assertTrue(first.await(10, TimeUnit.SECONDS));

    scheduler.close();
    // a run already underway may still finish
    Thread.sleep(100);
    final int afterClose = runs.get();
    Thread.sleep(300);

    assertEquals(afterClose, runs.get());
    assertTrue(scheduler.nextFireTime().isEmpty());
    scheduler.close();
  }
}
