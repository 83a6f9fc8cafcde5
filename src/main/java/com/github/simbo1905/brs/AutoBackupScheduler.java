package com.github.simbo1905.brs;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Synchronized;

/// Fires a backup task at every time matched by a [CronSchedule] until closed.
///
/// Only the next firing is ever queued; it is computed afresh after each run so a slow run never
/// causes a burst of catch-up runs. A failing run is logged and the following one still fires.
public final class AutoBackupScheduler implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(AutoBackupScheduler.class.getName());

  private final CronSchedule schedule;
  private final ZoneId zone;
  private final Clock clock;
  private final StoreOperation<?> task;
  private final ScheduledExecutorService executor;

  private ScheduledFuture<?> pending;
  private ZonedDateTime nextFireTime;
  private boolean closed;

  AutoBackupScheduler(CronSchedule schedule, ZoneId zone, Clock clock, StoreOperation<?> task) {
    this.schedule = schedule;
    this.zone = zone;
    this.clock = clock;
    this.task = task;
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              final var thread = new Thread(r, "booking-store-auto-backup");
              thread.setDaemon(true);
              return thread;
            });
  }

  /// @throws IllegalStateException if the schedule never fires; the executor is shut down first
  AutoBackupScheduler start() {
    try {
      scheduleNext();
    } catch (RuntimeException e) {
      close();
      throw e;
    }
    return this;
  }

  boolean isShutdown() {
    return executor.isShutdown();
  }

  public CronSchedule schedule() {
    return schedule;
  }

  /// When the next run is due, or empty once closed.
  @Synchronized
  public Optional<ZonedDateTime> nextFireTime() {
    return closed ? Optional.empty() : Optional.ofNullable(nextFireTime);
  }

  @Synchronized
  private void scheduleNext() {
    if (closed) {
      return;
    }
    final var now = ZonedDateTime.now(clock.withZone(zone));
    nextFireTime = schedule.nextFireTime(now);
    final long delay = Math.max(0, Duration.between(now, nextFireTime).toMillis());
    pending = executor.schedule(this::fire, delay, TimeUnit.MILLISECONDS);
    logger.log(
        Level.FINE, () -> String.format("next scheduled backup at %s (in %dms)", nextFireTime, delay));
  }

  private void fire() {
    logger.log(Level.FINE, () -> "running scheduled backup " + schedule.expression());
    try {
      task.run();
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Scheduled backup failed: " + e.getMessage(), e);
    } finally {
      scheduleNext();
    }
  }

  @Override
  @Synchronized
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pending != null) {
      pending.cancel(false);
    }
    executor.shutdown();
    logger.log(Level.FINE, () -> "auto backup stopped " + schedule.expression());
  }
}
