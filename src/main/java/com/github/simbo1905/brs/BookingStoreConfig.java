package com.github.simbo1905.brs;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/// Immutable settings shared by every component of one booking store. Build one with
/// [BookingServiceBuilder].
public record BookingStoreConfig(
    Path storeFile,
    Path backupDirectory,
    Path exportDirectory,
    Path archiveDirectory,
    int lockRetries,
    Duration lockMinTimeout,
    Duration lockMaxTimeout,
    double lockBackoffFactor,
    Duration lockStale,
    int warningRows,
    int maxRows,
    double warningFileSizeMB,
    double maxFileSizeMB,
    int maxBackups,
    boolean autoBackupEnabled,
    String backupInterval,
    int maxBookingsPerDay,
    int availabilityHorizonDays,
    ZoneId zone,
    Clock clock,
    boolean atomicWrites) {

  public BookingStoreConfig {
    Objects.requireNonNull(storeFile, "storeFile");
    Objects.requireNonNull(backupDirectory, "backupDirectory");
    Objects.requireNonNull(exportDirectory, "exportDirectory");
    Objects.requireNonNull(archiveDirectory, "archiveDirectory");
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(backupInterval, "backupInterval");
    if (lockRetries < 0) {
      throw new IllegalArgumentException("lockRetries must be non-negative, got " + lockRetries);
    }
    if (lockMinTimeout.isNegative() || lockMaxTimeout.compareTo(lockMinTimeout) < 0) {
      throw new IllegalArgumentException(
          String.format(
              "lock timeouts must satisfy 0 <= min <= max, got min=%s max=%s",
              lockMinTimeout, lockMaxTimeout));
    }
    if (lockBackoffFactor < 1.0) {
      throw new IllegalArgumentException(
          "lockBackoffFactor must be at least 1, got " + lockBackoffFactor);
    }
    if (lockStale.isZero() || lockStale.isNegative()) {
      throw new IllegalArgumentException("lockStale must be positive, got " + lockStale);
    }
    if (maxBackups < 1) {
      throw new IllegalArgumentException("maxBackups must be at least 1, got " + maxBackups);
    }
    if (maxBookingsPerDay < 1) {
      throw new IllegalArgumentException(
          "maxBookingsPerDay must be at least 1, got " + maxBookingsPerDay);
    }
    if (availabilityHorizonDays < 1) {
      throw new IllegalArgumentException(
          "availabilityHorizonDays must be at least 1, got " + availabilityHorizonDays);
    }
  }

  /// The store file name without its extension, e.g. `submissions`.
  public String storeName() {
    final var fileName = storeFile.getFileName().toString();
    final int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  /// The store file extension including the dot, or empty.
  public String storeExtension() {
    final var fileName = storeFile.getFileName().toString();
    final int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(dot) : "";
  }

  /// The advisory lock marker that sits next to the store file.
  public Path lockFile() {
    return storeFile.resolveSibling(storeFile.getFileName() + ".lock");
  }
}
