package com.github.simbo1905.brs;

import static com.github.simbo1905.brs.TestStores.START;
import static com.github.simbo1905.brs.TestStores.TODAY;
import static com.github.simbo1905.brs.TestStores.ZONE;
import static com.github.simbo1905.brs.TestStores.payload;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class BackupManagerTest extends JulLoggingConfig {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private MutableClock clock;
  private Path dataDirectory;

  @Before
  public void setUp() {
    clock = new MutableClock(START, ZONE);
    dataDirectory = tempFolder.getRoot().toPath().resolve("data");
  }

  @Test
  public void testNoStoreFileMeansNoBackup() throws IOException {
    final var config = TestStores.builder(dataDirectory, clock).build();
    final var backups = new BackupManager(config, new FileLockManager(config));

    assertTrue(backups.createBackup().isEmpty());
    assertTrue(backups.listBackups().isEmpty());
    assertTrue(backups.lastBackupTime().isEmpty());
  }

  @Test
  public void testBackupIsACopyNamedAfterTheStore() throws IOException {
    final var fixture = TestStores.fixture(dataDirectory, clock);
    fixture.store.add(payload(TODAY, "Someone"));

    final var backup = fixture.backups.createBackup().orElseThrow();

    assertEquals(fixture.config.backupDirectory(), backup.getParent());
    assertEquals("submissions_backup_2025-03-15_10-00-00-000.wbk", backup.getFileName().toString());
    assertArrayEquals(
        Files.readAllBytes(fixture.config.storeFile()), Files.readAllBytes(backup));
    final var listed = fixture.backups.listBackups();
    assertThat(listed.size(), is(1));
    assertEquals(backup, listed.get(0).path());
    assertThat(listed.get(0).sizeBytes(), is(Files.size(backup)));
    assertEquals(listed.get(0).created(), fixture.backups.lastBackupTime().orElseThrow());
  }

  @Test
  public void testRetentionKeepsTheNewest() throws IOException {
    final int retained = 4;
    final int extra = 3;
    final var config = TestStores.builder(dataDirectory, clock).maxBackups(retained).build();
    final var fixture = TestStores.fixture(config, NioStoreFileOperations.INSTANCE);

    final var created = new ArrayList<Path>();
    for (int i = 0; i < retained + extra; i++) {
      created.add(fixture.backups.createBackup().orElseThrow());
    }

    final var remaining =
        fixture.backups.listBackups().stream()
            .map(BackupManager.BackupInfo::path)
            .collect(Collectors.toList());
    assertThat(remaining.size(), is(retained));
    final var newest = new ArrayList<>(created.subList(extra, created.size()));
    Collections.reverse(newest);
    assertEquals(newest, remaining);
    for (Path pruned : created.subList(0, extra)) {
      assertFalse(pruned + " should be pruned", Files.exists(pruned));
    }
  }

  @Test
  public void testCleanIgnoresForeignFiles() throws IOException {
    final var config = TestStores.builder(dataDirectory, clock).maxBackups(1).build();
    final var fixture = TestStores.fixture(config, NioStoreFileOperations.INSTANCE);
    Files.createDirectories(config.backupDirectory());
    final var snapshot = config.backupDirectory().resolve("corrupted_1.wbk");
    final var note = config.backupDirectory().resolve("README.txt");
    Files.write(snapshot, new byte[] {1});
    Files.write(note, new byte[] {2});

    fixture.backups.createBackup();
    fixture.backups.createBackup();

    assertThat(fixture.backups.listBackups().size(), is(1));
    assertTrue(Files.exists(snapshot));
    assertTrue(Files.exists(note));
  }

  @Test
  public void testRestoreScenario() throws IOException {
    final var fixture = TestStores.fixture(dataDirectory, clock);
    final var kept = fixture.store.add(payload(TODAY, "Before backup"));
    final var backup = fixture.backups.createBackup().orElseThrow();
    final byte[] backupBytes = Files.readAllBytes(backup);
    fixture.store.add(payload(TODAY, "After backup"));
    final byte[] priorLive = Files.readAllBytes(fixture.config.storeFile());

    final var result = fixture.backups.restoreFromBackup(backup.getFileName().toString());

    assertArrayEquals(backupBytes, Files.readAllBytes(fixture.config.storeFile()));
    final var snapshot = result.snapshot().orElseThrow();
    assertTrue(snapshot.getFileName().toString().startsWith("corrupted_"));
    assertArrayEquals(priorLive, Files.readAllBytes(snapshot));
    assertEquals(List.of(kept), fixture.store.list());
    assertThat(fixture.store.summaryTotal(), is(1));
    assertFalse(fixture.lockManager.isLocked());
  }

  @Test
  public void testRestoreWithoutLiveFileStillRestores() throws IOException {
    final var fixture = TestStores.fixture(dataDirectory, clock);
    final var backup = fixture.backups.createBackup().orElseThrow();
    Files.delete(fixture.config.storeFile());

    final var result = fixture.backups.restoreFromBackup(backup.getFileName().toString());

    assertTrue(result.snapshot().isEmpty());
    assertArrayEquals(Files.readAllBytes(backup), Files.readAllBytes(fixture.config.storeFile()));
  }

  @Test
  public void testRestoreOfUnknownBackupFails() throws IOException {
    final var fixture = TestStores.fixture(dataDirectory, clock);
    final byte[] live = Files.readAllBytes(fixture.config.storeFile());

    assertThrows(
        BackupNotFoundException.class,
        () -> fixture.backups.restoreFromBackup("submissions_backup_1999-01-01_00-00-00-000.wbk"));
    assertThrows(
        BackupNotFoundException.class,
        () -> fixture.backups.restoreFromBackup("../submissions.wbk"));
    assertThrows(BackupNotFoundException.class, () -> fixture.backups.restoreFromBackup(""));

    assertArrayEquals(live, Files.readAllBytes(fixture.config.storeFile()));
  }

  @Test
  public void testFailedCopyIsReported() throws IOException {
    final var config = TestStores.builder(dataDirectory, clock).build();
    final var fixture =
        TestStores.fixture(config, new DelegatingExceptionFileOperations("copy", 1));

    final var error = assertThrows(StoreIOException.class, fixture.backups::createBackup);

    assertTrue(error.getMessage().startsWith("Backup of"));
    assertTrue(fixture.backups.listBackups().isEmpty());
  }

  @Test
  public void testFailedRestoreLeavesLiveFile() throws IOException {
    final var config = TestStores.builder(dataDirectory, clock).build();
    // call 1 is initialize, call 2 is the restore
    final var fixture =
        TestStores.fixture(config, new DelegatingExceptionFileOperations("writeAtomically", 2));
    final var backup = fixture.backups.createBackup().orElseThrow();
    final byte[] live = Files.readAllBytes(config.storeFile());

    assertThrows(
        StoreIOException.class,
        () -> fixture.backups.restoreFromBackup(backup.getFileName().toString()));

    assertArrayEquals(live, Files.readAllBytes(config.storeFile()));
    assertFalse(fixture.lockManager.isLocked());
  }

  @Test
  public void testAutoBackupDisabledByDefault() {
    final var config = TestStores.builder(dataDirectory, clock).build();
    assertTrue(new BackupManager(config, new FileLockManager(config)).scheduleAutoBackup().isEmpty());
  }

  @Test
  public void testAutoBackupUsesTheNamedInterval() throws IOException {
    final var config = TestStores.builder(dataDirectory, clock).autoBackup(true, "weekly").build();
    final var backups = new BackupManager(config, new FileLockManager(config));
    try (var scheduler = backups.scheduleAutoBackup().orElseThrow()) {
      assertEquals(CronSchedule.WEEKLY, scheduler.schedule().expression());
      // 2025-03-15 is a Saturday
      assertEquals(
          "2025-03-16T02:00Z", scheduler.nextFireTime().orElseThrow().toString());
    }
  }
}
