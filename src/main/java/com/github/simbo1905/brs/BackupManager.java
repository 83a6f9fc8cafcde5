package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;
import org.jetbrains.annotations.Nullable;

/// Point-in-time copies of the store file with a retention cap, plus restore.
///
/// Backups are named `<store>_backup_<yyyy-MM-dd_HH-mm-ss-SSS><ext>` with a UTC stamp. Only files
/// with that prefix and the store's extension count towards retention, so restore safety
/// snapshots (`corrupted_<epoch-ms><ext>`) are never pruned.
public class BackupManager {

  private static final Logger logger = Logger.getLogger(BackupManager.class.getName());

  static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS").withZone(ZoneOffset.UTC);

  static final String CORRUPTED_PREFIX = "corrupted_";

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private static final Comparator<BackupInfo> OLDEST_FIRST =
      Comparator.comparing(BackupInfo::created).thenComparing(BackupInfo::name);

  /// A backup file as listed in the backup directory.
  public record BackupInfo(String name, Path path, long sizeBytes, double sizeMB, Instant created) {}

  /// The outcome of a restore. The snapshot is absent when there was no live file to save or it
  /// could not be copied.
  public record RestoreResult(String backupName, Path restoredFrom, @Nullable Path safetySnapshot) {

    public Optional<Path> snapshot() {
      return Optional.ofNullable(safetySnapshot);
    }
  }

  @Getter private final BookingStoreConfig config;
  @Getter private final Path backupDirectory;
  private final Path storeFile;
  private final FileLockManager lockManager;
  private final StoreFileOperations fileOperations;

  public BackupManager(BookingStoreConfig config, FileLockManager lockManager) {
    this(config, lockManager, NioStoreFileOperations.INSTANCE);
  }

  BackupManager(
      BookingStoreConfig config, FileLockManager lockManager, StoreFileOperations fileOperations) {
    this.config = config;
    this.backupDirectory = config.backupDirectory();
    this.storeFile = config.storeFile();
    this.lockManager = lockManager;
    this.fileOperations = fileOperations;
  }

  /// Copies the live file into the backup directory and then applies retention.
  ///
  /// @return the new backup, or empty if there is no store file yet
  /// @throws StoreIOException if the copy fails
  @Synchronized
  public Optional<Path> createBackup() throws IOException {
    if (!fileOperations.exists(storeFile)) {
      logger.log(Level.FINE, () -> "no store file yet, skipping backup of " + storeFile);
      return Optional.empty();
    }
    final Path target;
    try {
      fileOperations.createDirectories(backupDirectory);
      target = lockManager.withReadLock(this::copyToNewBackup);
    } catch (StoreIOException e) {
      throw e;
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Backup failed: " + e.getMessage(), e);
      throw new StoreIOException("Backup of " + storeFile + " failed: " + e.getMessage(), e);
    }
    logger.info("Backup created: " + target.getFileName());
    cleanOldBackups();
    return Optional.of(target);
  }

  private Path copyToNewBackup() throws IOException {
    long millis = config.clock().millis();
    Path target = backupDirectory.resolve(backupName(millis));
    while (fileOperations.exists(target)) {
      target = backupDirectory.resolve(backupName(++millis));
    }
    fileOperations.copy(storeFile, target);
    return target;
  }

  String backupName(long epochMillis) {
    return backupPrefix() + STAMP.format(Instant.ofEpochMilli(epochMillis)) + config.storeExtension();
  }

  private String backupPrefix() {
    return config.storeName() + "_backup_";
  }

  /// Deletes the oldest backups, by modification time, until at most `maxBackups` remain. A file
  /// that cannot be deleted is logged and skipped.
  ///
  /// @return how many backups were deleted
  @Synchronized
  public int cleanOldBackups() throws IOException {
    final var backups = new ArrayList<>(listBackups());
    backups.sort(OLDEST_FIRST);
    final int excess = backups.size() - config.maxBackups();
    int deleted = 0;
    for (int i = 0; i < excess; i++) {
      final var backup = backups.get(i);
      try {
        fileOperations.delete(backup.path());
        deleted++;
        logger.log(Level.FINE, () -> "deleted old backup " + backup.name());
      } catch (IOException e) {
        logger.log(Level.WARNING, "Error deleting old backup " + backup.name(), e);
      }
    }
    if (deleted > 0) {
      final int count = deleted;
      logger.info(() -> String.format("Cleaned %d old backup(s)", count));
    }
    return deleted;
  }

  /// Every backup in the directory, newest first.
  public List<BackupInfo> listBackups() throws IOException {
    final var prefix = backupPrefix();
    final var extension = config.storeExtension();
    final var backups = new ArrayList<BackupInfo>();
    try {
      for (Path path : fileOperations.list(backupDirectory)) {
        final var name = path.getFileName().toString();
        if (name.startsWith(prefix) && name.endsWith(extension)) {
          backups.add(describe(path));
        }
      }
    } catch (IOException e) {
      throw new StoreIOException("Cannot list backups in " + backupDirectory, e);
    }
    backups.sort(OLDEST_FIRST.reversed());
    return backups;
  }

  private BackupInfo describe(Path path) throws IOException {
    final long size = fileOperations.size(path);
    return new BackupInfo(
        path.getFileName().toString(),
        path,
        size,
        BookingStore.round2(size / BYTES_PER_MB),
        fileOperations.lastModifiedTime(path).toInstant());
  }

  /// The modification time of the newest backup, or empty if there are none.
  public Optional<Instant> lastBackupTime() throws IOException {
    return listBackups().stream().findFirst().map(BackupInfo::created);
  }

  /// Replaces the live file with the named backup, byte for byte, while holding the store lock.
  ///
  /// The current live file is first copied to a `corrupted_<epoch-ms>` snapshot in the backup
  /// directory; that copy is best effort and a missing live file is tolerated.
  ///
  /// @throws BackupNotFoundException if there is no backup with that name
  /// @throws StoreIOException if the backup cannot be installed
  public RestoreResult restoreFromBackup(String backupName) throws IOException {
    final var source = resolveBackup(backupName);
    try {
      final var result =
          lockManager.withLock(
              () -> {
                final var snapshot = saveCurrent();
                final byte[] bytes = fileOperations.readAllBytes(source);
                if (config.atomicWrites()) {
                  fileOperations.writeAtomically(storeFile, bytes);
                } else {
                  fileOperations.write(storeFile, bytes);
                }
                return new RestoreResult(backupName, source, snapshot);
              });
      logger.info("Restored from backup: " + backupName);
      return result;
    } catch (LockTimeoutException e) {
      throw e;
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Restore from " + backupName + " failed: " + e.getMessage(), e);
      throw new StoreIOException(
          "Failed to restore from backup " + backupName + ": " + e.getMessage(), e);
    }
  }

  private Path resolveBackup(String backupName) throws BackupNotFoundException {
    if (backupName == null
        || backupName.isBlank()
        || backupName.contains("/")
        || backupName.contains("\\")
        || backupName.equals("..")
        || backupName.equals(".")) {
      throw new BackupNotFoundException(String.valueOf(backupName));
    }
    final var source = backupDirectory.resolve(backupName);
    if (!fileOperations.exists(source)) {
      throw new BackupNotFoundException(backupName);
    }
    return source;
  }

  private @Nullable Path saveCurrent() {
    if (!fileOperations.exists(storeFile)) {
      logger.log(Level.WARNING, "No current store file to save before restore");
      return null;
    }
    long millis = config.clock().millis();
    Path snapshot = backupDirectory.resolve(CORRUPTED_PREFIX + millis + config.storeExtension());
    while (fileOperations.exists(snapshot)) {
      snapshot = backupDirectory.resolve(CORRUPTED_PREFIX + ++millis + config.storeExtension());
    }
    try {
      fileOperations.copy(storeFile, snapshot);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not save current store file before restore", e);
      return null;
    }
    final var saved = snapshot;
    logger.info(() -> "Current file backed up as: " + saved.getFileName());
    return snapshot;
  }

  /// Starts recurring backups on the configured interval when auto backup is enabled.
  ///
  /// @return the running scheduler, which the caller closes, or empty when disabled
  /// @throws IllegalArgumentException if the interval is not a valid schedule expression
  public Optional<AutoBackupScheduler> scheduleAutoBackup() {
    if (!config.autoBackupEnabled()) {
      logger.info("Auto-backup is disabled");
      return Optional.empty();
    }
    final var schedule = CronSchedule.parse(config.backupInterval());
    final var scheduler =
        new AutoBackupScheduler(schedule, config.zone(), config.clock(), this::createBackup)
            .start();
    logger.info(
        () ->
            String.format(
                "Auto-backup scheduled: %s (%s)", config.backupInterval(), schedule.expression()));
    return Optional.of(scheduler);
  }
}
