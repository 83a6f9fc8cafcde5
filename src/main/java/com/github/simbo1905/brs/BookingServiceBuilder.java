package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fluent builder for a [BookingService]. Unset values take the defaults below.
///
/// Example usage:
/// <pre>
/// try (BookingService service = BookingService.Builder()
///     .dataDirectory("/var/lib/bookings")
///     .maxBookingsPerDay(3)
///     .autoBackup(true, "daily")
///     .open()) {
///   service.submit(payload);
/// }
/// </pre>
public class BookingServiceBuilder {

  private static final Logger logger = Logger.getLogger(BookingServiceBuilder.class.getName());

  public static final String DEFAULT_STORE_FILE_NAME = "submissions.wbk";
  public static final int DEFAULT_LOCK_RETRIES = 15;
  public static final Duration DEFAULT_LOCK_MIN_TIMEOUT = Duration.ofMillis(100);
  public static final Duration DEFAULT_LOCK_MAX_TIMEOUT = Duration.ofMillis(2000);
  public static final double DEFAULT_LOCK_BACKOFF_FACTOR = 2.0;
  public static final Duration DEFAULT_LOCK_STALE = Duration.ofSeconds(10);
  public static final int DEFAULT_WARNING_ROWS = 10_000;
  public static final int DEFAULT_MAX_ROWS = 50_000;
  public static final double DEFAULT_WARNING_FILE_SIZE_MB = 5;
  public static final double DEFAULT_MAX_FILE_SIZE_MB = 10;
  public static final int DEFAULT_MAX_BACKUPS = 30;
  public static final String DEFAULT_BACKUP_INTERVAL = "daily";
  public static final int DEFAULT_MAX_BOOKINGS_PER_DAY = 3;
  public static final int DEFAULT_AVAILABILITY_HORIZON_DAYS = 90;

  private Path dataDirectory = Paths.get("data");
  private Path storeFile;
  private Path backupDirectory;
  private Path exportDirectory;
  private Path archiveDirectory;
  private int lockRetries = DEFAULT_LOCK_RETRIES;
  private Duration lockMinTimeout = DEFAULT_LOCK_MIN_TIMEOUT;
  private Duration lockMaxTimeout = DEFAULT_LOCK_MAX_TIMEOUT;
  private double lockBackoffFactor = DEFAULT_LOCK_BACKOFF_FACTOR;
  private Duration lockStale = DEFAULT_LOCK_STALE;
  private int warningRows = DEFAULT_WARNING_ROWS;
  private int maxRows = DEFAULT_MAX_ROWS;
  private double warningFileSizeMB = DEFAULT_WARNING_FILE_SIZE_MB;
  private double maxFileSizeMB = DEFAULT_MAX_FILE_SIZE_MB;
  private int maxBackups = DEFAULT_MAX_BACKUPS;
  private boolean autoBackupEnabled = false;
  private String backupInterval = DEFAULT_BACKUP_INTERVAL;
  private int maxBookingsPerDay = DEFAULT_MAX_BOOKINGS_PER_DAY;
  private int availabilityHorizonDays = DEFAULT_AVAILABILITY_HORIZON_DAYS;
  private ZoneId zone = ZoneId.systemDefault();
  private Clock clock;
  private boolean atomicWrites = true;

  /// Only tests swap this, to inject filesystem failures.
  private StoreFileOperations fileOperations = NioStoreFileOperations.INSTANCE;

  /// Sets the directory holding the store file and, unless set separately, the backup, export
  /// and archive directories.
  ///
  /// @param dataDirectory the data directory
  /// @return this builder for chaining
  public BookingServiceBuilder dataDirectory(Path dataDirectory) {
    this.dataDirectory = dataDirectory;
    return this;
  }

  /// Sets the data directory from a string, normalised.
  ///
  /// @param dataDirectory the data directory
  /// @return this builder for chaining
  public BookingServiceBuilder dataDirectory(String dataDirectory) {
    this.dataDirectory = Paths.get(dataDirectory).normalize();
    return this;
  }

  public BookingServiceBuilder storeFile(Path storeFile) {
    this.storeFile = storeFile;
    return this;
  }

  public BookingServiceBuilder backupDirectory(Path backupDirectory) {
    this.backupDirectory = backupDirectory;
    return this;
  }

  public BookingServiceBuilder exportDirectory(Path exportDirectory) {
    this.exportDirectory = exportDirectory;
    return this;
  }

  public BookingServiceBuilder archiveDirectory(Path archiveDirectory) {
    this.archiveDirectory = archiveDirectory;
    return this;
  }

  /// Sets the lock retry policy: after the first attempt up to `retries` further attempts are
  /// made, waiting `minTimeout * factor^n` capped at `maxTimeout` between them.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder lockRetries(
      int retries, Duration minTimeout, Duration maxTimeout, double factor) {
    this.lockRetries = retries;
    this.lockMinTimeout = minTimeout;
    this.lockMaxTimeout = maxTimeout;
    this.lockBackoffFactor = factor;
    return this;
  }

  /// Sets the age after which a lock marker is considered abandoned and may be taken over.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder lockStale(Duration lockStale) {
    this.lockStale = lockStale;
    return this;
  }

  public BookingServiceBuilder rowThresholds(int warningRows, int maxRows) {
    if (warningRows < 0 || maxRows < warningRows) {
      throw new IllegalArgumentException(
          String.format(
              "row thresholds must satisfy 0 <= warning <= max, got warning=%d max=%d",
              warningRows, maxRows));
    }
    this.warningRows = warningRows;
    this.maxRows = maxRows;
    return this;
  }

  public BookingServiceBuilder fileSizeThresholdsMB(double warningMB, double maxMB) {
    if (warningMB < 0 || maxMB < warningMB) {
      throw new IllegalArgumentException(
          String.format(
              "size thresholds must satisfy 0 <= warning <= max, got warning=%.2f max=%.2f",
              warningMB, maxMB));
    }
    this.warningFileSizeMB = warningMB;
    this.maxFileSizeMB = maxMB;
    return this;
  }

  /// Sets how many timestamped backups are retained; the oldest are pruned first.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder maxBackups(int maxBackups) {
    this.maxBackups = maxBackups;
    return this;
  }

  /// Enables or disables the recurring backup.
  ///
  /// @param interval `hourly`, `daily` (02:00), `weekly` (Sunday 02:00) or a five field cron
  /// expression
  /// @return this builder for chaining
  public BookingServiceBuilder autoBackup(boolean enabled, String interval) {
    this.autoBackupEnabled = enabled;
    this.backupInterval = interval;
    return this;
  }

  public BookingServiceBuilder maxBookingsPerDay(int maxBookingsPerDay) {
    this.maxBookingsPerDay = maxBookingsPerDay;
    return this;
  }

  /// Sets how many days ahead the next-available search looks.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder availabilityHorizonDays(int days) {
    this.availabilityHorizonDays = days;
    return this;
  }

  /// Sets the zone that defines calendar days.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder zone(ZoneId zone) {
    this.zone = zone;
    return this;
  }

  /// Sets the clock used for submission times, "today" and backup names. Defaults to the
  /// system clock in the configured zone.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder clock(Clock clock) {
    this.clock = clock;
    return this;
  }

  /// Chooses between a temp-file-and-rename rewrite (default) and an in-place rewrite.
  ///
  /// @return this builder for chaining
  public BookingServiceBuilder atomicWrites(boolean atomicWrites) {
    this.atomicWrites = atomicWrites;
    return this;
  }

  BookingServiceBuilder fileOperations(StoreFileOperations fileOperations) {
    this.fileOperations = fileOperations;
    return this;
  }

  StoreFileOperations fileOperations() {
    return fileOperations;
  }

  /// Overlays settings from the environment. Each setting is read from an environment variable
  /// `com.github.simbo1905.brs.BookingStoreConfig.<NAME>` and then from a system property of the
  /// same name, the property winning. Recognised names: `DATA_DIR`, `MAX_ROWS`,
  /// `MAX_FILE_SIZE_MB`, `AUTO_BACKUP_ENABLED` and `BACKUP_INTERVAL`.
  ///
  /// @return this builder for chaining
  /// @throws IllegalArgumentException if a value cannot be parsed
  public BookingServiceBuilder fromEnvironment() {
    final var dataDir = setting("DATA_DIR");
    if (dataDir != null) {
      dataDirectory(dataDir);
    }
    final var rows = setting("MAX_ROWS");
    if (rows != null) {
      this.maxRows = parseInt("MAX_ROWS", rows);
    }
    final var size = setting("MAX_FILE_SIZE_MB");
    if (size != null) {
      this.maxFileSizeMB = parseInt("MAX_FILE_SIZE_MB", size);
    }
    final var enabled = setting("AUTO_BACKUP_ENABLED");
    if (enabled != null) {
      this.autoBackupEnabled = Boolean.parseBoolean(enabled.trim());
    }
    final var interval = setting("BACKUP_INTERVAL");
    if (interval != null && !interval.isBlank()) {
      this.backupInterval = interval.trim();
    }
    return this;
  }

  static String settingKey(String name) {
    return String.format("%s.%s", BookingStoreConfig.class.getName(), name);
  }

  private static String setting(String name) {
    final var key = settingKey(name);
    return System.getProperty(key, System.getenv(key));
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer, got '%s'", settingKey(name), value), e);
    }
  }

  /// Resolves defaults and validates the settings.
  ///
  /// @throws IllegalArgumentException if any setting is out of range
  public BookingStoreConfig build() {
    final var config =
        new BookingStoreConfig(
            storeFile != null ? storeFile : dataDirectory.resolve(DEFAULT_STORE_FILE_NAME),
            backupDirectory != null ? backupDirectory : dataDirectory.resolve("backups"),
            exportDirectory != null ? exportDirectory : dataDirectory.resolve("exports"),
            archiveDirectory != null ? archiveDirectory : dataDirectory.resolve("archives"),
            lockRetries,
            lockMinTimeout,
            lockMaxTimeout,
            lockBackoffFactor,
            lockStale,
            warningRows,
            maxRows,
            warningFileSizeMB,
            maxFileSizeMB,
            maxBackups,
            autoBackupEnabled,
            backupInterval.trim(),
            maxBookingsPerDay,
            availabilityHorizonDays,
            zone,
            clock != null ? clock : Clock.system(zone),
            atomicWrites);
    logger.log(Level.FINE, () -> "built " + config);
    return config;
  }

  /// Builds the configuration, initialises the store file if absent and schedules the automatic
  /// backup when enabled.
  ///
  /// @throws IOException if the store cannot be initialised
  public BookingService open() throws IOException {
    return BookingService.open(build(), fileOperations);
  }
}
