package com.github.simbo1905.brs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileLockManagerTest extends JulLoggingConfig {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private Path lockFile;

  @Before
  public void setUp() {
    lockFile = tempFolder.getRoot().toPath().resolve("submissions.wbk.lock");
  }

  private FileLockManager manager(int retries, Duration stale) {
    return new FileLockManager(
        lockFile,
        retries,
        Duration.ofMillis(10),
        Duration.ofMillis(20),
        2.0,
        stale,
        Clock.systemUTC());
  }

  private void foreignMarker(Instant touched) throws IOException {
    Files.write(lockFile, "another-process".getBytes(StandardCharsets.UTF_8));
    Files.setLastModifiedTime(lockFile, FileTime.from(touched));
  }

  @Test
  public void testLockIsHeldDuringAndReleasedAfter() throws IOException {
    final var manager = manager(2, Duration.ofSeconds(10));

    final boolean heldInside =
        manager.withLock(() -> Files.exists(lockFile) && manager.isLocked());

    assertTrue(heldInside);
    assertFalse(Files.exists(lockFile));
    assertFalse(manager.isLocked());
  }

  @Test
  public void testLockIsReleasedWhenTheOperationFails() {
    final var manager = manager(2, Duration.ofSeconds(10));

    final var error =
        assertThrows(
            IOException.class,
            () ->
                manager.withLock(
                    () -> {
                      throw new IOException("boom");
                    }));

    assertEquals("boom", error.getMessage());
    assertFalse(Files.exists(lockFile));
  }

  @Test
  public void testRuntimeFailureAlsoReleases() {
    final var manager = manager(2, Duration.ofSeconds(10));
    assertThrows(
        IllegalStateException.class,
        () ->
            manager.withLock(
                () -> {
                  throw new IllegalStateException("boom");
                }));
    assertFalse(Files.exists(lockFile));
  }

  @Test
  public void testLiveForeignLockTimesOut() throws IOException {
    final var manager = manager(2, Duration.ofSeconds(10));
    foreignMarker(Instant.now());
    final var ran = new AtomicBoolean();

    final var error =
        assertThrows(
            LockTimeoutException.class,
            () ->
                manager.withLock(
                    () -> {
                      ran.set(true);
                      return null;
                    }));

    assertFalse(ran.get());
    assertThat(error.getAttempts(), is(3));
    assertEquals(lockFile, error.getLockedPath());
    assertTrue(error.isRetriable());
    assertTrue(manager.isLocked());
    assertEquals(
        "another-process", new String(Files.readAllBytes(lockFile), StandardCharsets.UTF_8));
  }

  @Test
  public void testStaleLockIsTakenOver() throws IOException {
    final var manager = manager(0, Duration.ofSeconds(10));
    foreignMarker(Instant.now().minus(Duration.ofMinutes(1)));
    assertFalse("a stale marker does not count as locked", manager.isLocked());

    final String result = manager.withLock(() -> "ran");

    assertEquals("ran", result);
    assertFalse(Files.exists(lockFile));
  }

  @Test
  public void testContendersForAStaleLockDoNotOverlap() throws Exception {
    foreignMarker(Instant.now().minus(Duration.ofMinutes(1)));
    final int contenders = 5;
    final var inside = new AtomicInteger();
    final var overlaps = new AtomicInteger();
    final var failures = new AtomicInteger();
    final var ran = new AtomicInteger();
    final var start = new CountDownLatch(1);
    final var done = new CountDownLatch(contenders);
    for (int i = 0; i < contenders; i++) {
      // one manager each, as separate processes would have
      final var manager =
          new FileLockManager(
              lockFile,
              50,
              Duration.ofMillis(2),
              Duration.ofMillis(20),
              2.0,
              Duration.ofSeconds(10),
              Clock.systemUTC());
      new Thread(
              () -> {
                try {
                  start.await();
                  manager.withLock(
                      () -> {
                        if (inside.incrementAndGet() > 1) {
                          overlaps.incrementAndGet();
                        }
                        sleep(5);
                        inside.decrementAndGet();
                        return ran.incrementAndGet();
                      });
                } catch (Exception e) {
                  failures.incrementAndGet();
                } finally {
                  done.countDown();
                }
              })
          .start();
    }
    start.countDown();
    assertTrue(done.await(30, TimeUnit.SECONDS));

    assertThat(failures.get(), is(0));
    assertThat(ran.get(), is(contenders));
    assertThat(overlaps.get(), is(0));
    assertFalse(Files.exists(lockFile));
    try (var leftovers = Files.list(tempFolder.getRoot().toPath())) {
      assertThat(leftovers.count(), is(0L));
    }
  }

  @Test
  public void testInterruptedWaitKeepsTheInterruptFlag() throws IOException {
    final var manager = manager(3, Duration.ofSeconds(10));
    foreignMarker(Instant.now());

    Thread.currentThread().interrupt();
    final InterruptedIOException e;
    try {
      e = assertThrows(InterruptedIOException.class, () -> manager.withLock(() -> "never"));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }

    assertTrue(e instanceof FileLockManager.LockInterruptedException);
    assertTrue(e.getCause() instanceof InterruptedException);
    assertTrue("the foreign marker is left alone", Files.exists(lockFile));
  }

  @Test
  public void testWithLockIsReentrant() throws IOException {
    final var manager = manager(0, Duration.ofSeconds(10));
    final int depth = manager.withLock(() -> manager.withLock(() -> manager.withLock(() -> 3)));
    assertThat(depth, is(3));
    assertFalse(Files.exists(lockFile));
  }

  @Test
  public void testBackoffDoublesUpToTheMaximum() {
    final var manager =
        new FileLockManager(
            lockFile,
            15,
            Duration.ofMillis(100),
            Duration.ofMillis(2000),
            2.0,
            Duration.ofSeconds(10),
            Clock.systemUTC());
    assertEquals(Duration.ofMillis(100), manager.backoff(1));
    assertEquals(Duration.ofMillis(200), manager.backoff(2));
    assertEquals(Duration.ofMillis(1600), manager.backoff(5));
    assertEquals(Duration.ofMillis(2000), manager.backoff(6));
    assertEquals(Duration.ofMillis(2000), manager.backoff(15));
  }

  @Test
  public void testHeartbeatKeepsALongHolderFresh() throws Exception {
    final var stale = Duration.ofMillis(600);
    final var manager = manager(0, stale);
    final var observed = new AtomicBoolean(true);

    manager.withLock(
        () -> {
          final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1500);
          while (System.nanoTime() < deadline) {
            if (!manager.isLocked()) {
              observed.set(false);
            }
            sleep(50);
          }
          return null;
        });

    assertTrue("the held marker went stale", observed.get());
    assertFalse(Files.exists(lockFile));
  }

  @Test
  public void testWritersInOneProcessDoNotOverlap() throws Exception {
    final var manager =
        new FileLockManager(
            lockFile,
            30,
            Duration.ofMillis(2),
            Duration.ofMillis(50),
            2.0,
            Duration.ofSeconds(10),
            Clock.systemUTC());
    final int threads = 6;
    final var inside = new AtomicInteger();
    final var overlaps = new AtomicInteger();
    final var failures = new AtomicInteger();
    final var start = new CountDownLatch(1);
    final var done = new CountDownLatch(threads);
    for (int i = 0; i < threads; i++) {
      new Thread(
              () -> {
                try {
                  start.await();
                  for (int round = 0; round < 5; round++) {
                    manager.withLock(
                        () -> {
                          if (inside.incrementAndGet() > 1) {
                            overlaps.incrementAndGet();
                          }
                          sleep(2);
                          inside.decrementAndGet();
                          return null;
                        });
                  }
                } catch (Exception e) {
                  failures.incrementAndGet();
                } finally {
                  done.countDown();
                }
              })
          .start();
    }
    start.countDown();
    assertTrue(done.await(30, TimeUnit.SECONDS));

    assertThat(failures.get(), is(0));
    assertThat(overlaps.get(), is(0));
    assertFalse(Files.exists(lockFile));
  }

  private static void sleep(long millis) throws IOException {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }
  }
}
