package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.Nullable;

/// Size, row count and backup freshness checks. Advisory only: nothing here blocks a store
/// operation.
public class HealthMonitor {

  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  /// Backups older than this raise a warning.
  static final Duration BACKUP_STALE_AFTER = Duration.ofHours(24);

  /// More active warnings than this make the store critical.
  static final int CRITICAL_WARNING_COUNT = 2;

  public enum HealthStatus {
    HEALTHY(200),
    WARNING(200),
    CRITICAL(503),
    ERROR(500);

    private final int httpStatus;

    HealthStatus(int httpStatus) {
      this.httpStatus = httpStatus;
    }

    /// The HTTP status a front end should answer a health probe with.
    public int httpStatus() {
      return httpStatus;
    }
  }

  public record FileHealth(
      Path path, double sizeMB, long sizeBytes, Instant lastModified, int rowCount) {}

  public record Thresholds(
      int maxRows, int warningRows, double maxFileSizeMB, double warningFileSizeMB) {}

  public record BackupHealth(@Nullable Instant lastBackup, int backupCount, double totalBackupSizeMB) {}

  /// A point-in-time health report. On `ERROR` only `timestamp`, `error` and `warnings` are set.
  public record HealthReport(
      HealthStatus status,
      Instant timestamp,
      @Nullable FileHealth file,
      @Nullable Thresholds thresholds,
      @Nullable BackupHealth backup,
      List<String> warnings,
      @Nullable String error) {

    public HealthReport {
      warnings = List.copyOf(warnings);
    }
  }

  private final BookingStore store;
  private final BackupManager backupManager;
  private final BookingStoreConfig config;

  public HealthMonitor(BookingStore store, BackupManager backupManager) {
    this.store = store;
    this.backupManager = backupManager;
    this.config = store.getConfig();
  }

  public Thresholds thresholds() {
    return new Thresholds(
        config.maxRows(), config.warningRows(), config.maxFileSizeMB(), config.warningFileSizeMB());
  }

  /// The store file size in MB, 0 if it does not exist. Logs when a threshold is crossed.
  public double fileSizeMB() throws IOException {
    final double sizeMB = store.fileSizeBytes() / BYTES_PER_MB;
    if (sizeMB > config.maxFileSizeMB()) {
      logger.severe(
          () ->
              String.format(
                  "Store file exceeds maximum size: %.2fMB > %sMB. Consider archiving old records immediately",
                  sizeMB, config.maxFileSizeMB()));
    } else if (sizeMB > config.warningFileSizeMB()) {
      logger.warning(
          () ->
              String.format(
                  "Store file is %.2fMB (warning threshold: %sMB)",
                  sizeMB, config.warningFileSizeMB()));
    }
    return sizeMB;
  }

  /// The number of data rows. Logs when a threshold is crossed.
  public int rowCount() throws IOException {
    final int rows = store.rowCount();
    if (rows > config.maxRows()) {
      logger.severe(
          () ->
              String.format(
                  "Store file exceeds maximum rows: %d > %d. Archive old records",
                  rows, config.maxRows()));
    } else if (rows > config.warningRows()) {
      logger.warning(
          () ->
              String.format(
                  "Store file has %d rows (warning threshold: %d). Consider archiving old records soon",
                  rows, config.warningRows()));
    }
    return rows;
  }

  /// Aggregates size, rows and backups into one report. Any failure yields an `ERROR` report
  /// rather than an exception.
  public HealthReport healthCheck() {
    final var now = config.clock().instant();
    try {
      final double sizeMB = fileSizeMB();
      final int rows = rowCount();
      final var backups = backupManager.listBackups();
      final var lastBackup = backups.isEmpty() ? null : backups.get(0).created();
      final var fileOperations = store.fileOperations();
      final var path = store.getFilePath();

      final var warnings = new ArrayList<String>();
      if (sizeMB > config.warningFileSizeMB()) {
        warnings.add(
            String.format(
                "File size is %.2fMB (threshold: %sMB)", sizeMB, config.warningFileSizeMB()));
      }
      if (rows > config.warningRows()) {
        warnings.add(String.format("Row count is %d (threshold: %d)", rows, config.warningRows()));
      }
      if (lastBackup == null) {
        warnings.add("No backups found");
      } else {
        final var age = Duration.between(lastBackup, now);
        if (age.compareTo(BACKUP_STALE_AFTER) > 0) {
          warnings.add(String.format("Last backup was %.1f hours ago", age.toMinutes() / 60.0));
        }
      }

      final HealthStatus status;
      if (warnings.isEmpty()) {
        status = HealthStatus.HEALTHY;
      } else if (warnings.size() > CRITICAL_WARNING_COUNT) {
        status = HealthStatus.CRITICAL;
      } else {
        status = HealthStatus.WARNING;
      }

      final double totalBackupMB =
          BookingStore.round2(
              backups.stream().mapToLong(BackupManager.BackupInfo::sizeBytes).sum() / BYTES_PER_MB);
      final var report =
          new HealthReport(
              status,
              now,
              new FileHealth(
                  path,
                  BookingStore.round2(sizeMB),
                  store.fileSizeBytes(),
                  fileOperations.lastModifiedTime(path).toInstant(),
                  rows),
              thresholds(),
              new BackupHealth(lastBackup, backups.size(), totalBackupMB),
              warnings,
              null);
      logger.log(
          Level.FINE, () -> String.format("health %s warnings=%s", status, report.warnings()));
      return report;
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Health check failed: " + e.getMessage(), e);
      return new HealthReport(
          HealthStatus.ERROR,
          now,
          null,
          null,
          null,
          List.of("Failed to perform health check"),
          e.getMessage() == null ? e.getClass().getName() : e.getMessage());
    }
  }
}
