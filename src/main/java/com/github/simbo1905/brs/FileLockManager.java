package com.github.simbo1905.brs;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Serialises mutations of the store file across threads and processes.
///
/// Across processes the lock is an advisory marker file (`<store>.lock`) created with
/// `CREATE_NEW`. Its content is an owner token and its modification time is refreshed every
/// `stale / 2` while held. A marker older than `stale` is abandoned and may be removed by the next
/// caller. Acquisition retries with exponential backoff and fails with [LockTimeoutException]
/// once the retries are exhausted.
///
/// Inside the JVM a fair read/write lock is layered underneath: writers hold its write side for
/// the duration of the operation, readers take its read side. Readers in other processes do not
/// take the marker and may still observe the file mid-rewrite when atomic writes are disabled.
public class FileLockManager {

  private static final Logger logger = Logger.getLogger(FileLockManager.class.getName());

  /// Heartbeats for held locks; daemon so an abandoned store never keeps the JVM alive.
  private static class LazyHeartbeat {
    static final ScheduledExecutorService EXECUTOR =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              final var thread = new Thread(r, "booking-store-lock-heartbeat");
              thread.setDaemon(true);
              return thread;
            });
  }

  @Getter private final Path lockFile;
  private final int retries;
  private final Duration minTimeout;
  private final Duration maxTimeout;
  private final double factor;
  private final Duration stale;
  private final Clock clock;
  private final GuardedReentrantReadWriteLock localLock = new GuardedReentrantReadWriteLock();

  public FileLockManager(BookingStoreConfig config) {
    this(
        config.lockFile(),
        config.lockRetries(),
        config.lockMinTimeout(),
        config.lockMaxTimeout(),
        config.lockBackoffFactor(),
        config.lockStale(),
        Clock.systemUTC());
  }

  FileLockManager(
      Path lockFile,
      int retries,
      Duration minTimeout,
      Duration maxTimeout,
      double factor,
      Duration stale,
      Clock clock) {
    this.lockFile = lockFile;
    this.retries = retries;
    this.minTimeout = minTimeout;
    this.maxTimeout = maxTimeout;
    this.factor = factor;
    this.stale = stale;
    this.clock = clock;
  }

  /// Runs the operation while holding the exclusive store lock, releasing it afterwards whether
  /// the operation succeeded or failed. Re-entrant for the thread that already holds it.
  ///
  /// @throws LockTimeoutException if the lock could not be acquired within the retry budget
  /// @throws IOException whatever the operation throws
  public <T> T withLock(StoreOperation<T> operation) throws IOException {
    if (localLock.isWriteLockedByCurrentThread()) {
      return operation.run();
    }
    // the marker is taken first so the bounded retry policy is the only wait between writers
    final var token = acquire();
    final ScheduledFuture<?> heartbeat = startHeartbeat(token);
    try (var ignored = localLock.writeLock()) {
      return operation.run();
    } finally {
      heartbeat.cancel(false);
      release(token);
    }
  }

  /// Runs a read-only operation under the in-process shared lock. It does not take the advisory
  /// file lock.
  public <T> T withReadLock(StoreOperation<T> operation) throws IOException {
    try (var ignored = localLock.readLock()) {
      return operation.run();
    }
  }

  /// Whether a live (non-stale) lock marker currently exists.
  public boolean isLocked() {
    try {
      return Files.exists(lockFile) && !isStale(Files.getLastModifiedTime(lockFile));
    } catch (IOException e) {
      logger.log(Level.WARNING, "Error checking file lock status: " + e.getMessage(), e);
      return false;
    }
  }

  /// The wait before retry number `attempt` (1-based).
  Duration backoff(int attempt) {
    final double millis = minTimeout.toMillis() * Math.pow(factor, attempt - 1);
    return Duration.ofMillis((long) Math.min(millis, maxTimeout.toMillis()));
  }

  private String acquire() throws IOException {
    final var token = UUID.randomUUID().toString();
    final var content = token.getBytes(StandardCharsets.UTF_8);
    final int attempts = retries + 1;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      if (tryCreate(content)) {
        final int acquiredOn = attempt;
        logger.log(
            Level.FINE,
            () -> String.format("acquired %s on attempt %d token=%s", lockFile, acquiredOn, token));
        return token;
      }
      if (removeIfStale()) {
        // retry immediately, the marker was abandoned
        if (tryCreate(content)) {
          return token;
        }
      }
      if (attempt < attempts) {
        sleep(backoff(attempt));
      }
    }
    logger.log(
        Level.WARNING, () -> String.format("gave up on %s after %d attempts", lockFile, attempts));
    throw new LockTimeoutException(lockFile, attempts);
  }

  private boolean tryCreate(byte[] content) throws IOException {
    try {
      Files.write(lockFile, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    }
  }

  /// Takes a stale marker out of the way by renaming it to a unique tombstone and re-checking
  /// the age of what was renamed. A contender that lost the race finds either no marker or a
  /// fresh one, which is put back.
  private boolean removeIfStale() throws IOException {
    final FileTime modified;
    try {
      modified = Files.getLastModifiedTime(lockFile);
    } catch (NoSuchFileException e) {
      // released between our create and our stat
      return true;
    }
    if (!isStale(modified)) {
      return false;
    }
    final Path tombstone =
        lockFile.resolveSibling(lockFile.getFileName() + ".stale-" + UUID.randomUUID());
    try {
      Files.move(lockFile, tombstone, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException e) {
      // another contender removed it first
      return true;
    }
    final FileTime moved = Files.getLastModifiedTime(tombstone);
    if (!isStale(moved)) {
      logger.log(
          Level.FINE,
          () -> String.format("marker %s was replaced before takeover, restoring it", lockFile));
      restore(tombstone);
      return false;
    }
    logger.log(
        Level.WARNING,
        () -> String.format("taking over stale lock %s last touched %s", lockFile, moved));
    Files.deleteIfExists(tombstone);
    return true;
  }

  private void restore(Path tombstone) throws IOException {
    try {
      Files.move(tombstone, lockFile);
    } catch (FileAlreadyExistsException e) {
      logger.log(
          Level.WARNING,
          () -> String.format("could not restore %s, a newer marker exists", lockFile));
      Files.deleteIfExists(tombstone);
    }
  }

  private boolean isStale(FileTime modified) {
    return clock.millis() - modified.toMillis() > stale.toMillis();
  }

  private ScheduledFuture<?> startHeartbeat(String token) {
    final long period = Math.max(1, stale.toMillis() / 2);
    return LazyHeartbeat.EXECUTOR.scheduleAtFixedRate(
        () -> touch(token), period, period, TimeUnit.MILLISECONDS);
  }

  private void touch(String token) {
    try {
      if (ownedBy(token)) {
        Files.setLastModifiedTime(lockFile, FileTime.fromMillis(clock.millis()));
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Error refreshing file lock " + lockFile + ": " + e.getMessage());
    }
  }

  /// Release failures are logged rather than thrown so the operation's own outcome propagates.
  private void release(String token) {
    try {
      if (ownedBy(token)) {
        Files.deleteIfExists(lockFile);
        logger.log(Level.FINE, () -> String.format("released %s token=%s", lockFile, token));
      } else {
        logger.log(
            Level.WARNING,
            () -> String.format("lock %s was taken over before release token=%s", lockFile, token));
      }
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Error releasing file lock " + lockFile, e);
    }
  }

  private boolean ownedBy(String token) throws IOException {
    try {
      return token.equals(new String(Files.readAllBytes(lockFile), StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      return false;
    }
  }

  private static void sleep(Duration duration) throws LockInterruptedException {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockInterruptedException(e);
    }
  }

  /// Lock acquisition was interrupted; the interrupt flag is restored.
  static final class LockInterruptedException extends InterruptedIOException {
    LockInterruptedException(InterruptedException cause) {
      super("Interrupted while waiting for the store lock");
      initCause(cause);
    }
  }
}
