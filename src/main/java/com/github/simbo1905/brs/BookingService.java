package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// The booking store as a whole: one store file with its lock, backups, archives, admission cap
/// and health checks.
///
/// Every mutation runs in the same order: the requested date (if any) is validated, the live file
/// is backed up, and then the store rewrites the file under the lock. A backup that fails aborts
/// the mutation. Validation outcomes come back as values; infrastructure failures are thrown.
public class BookingService implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(BookingService.class.getName());

  /// Minimum length of a search query once trimmed.
  public static final int MIN_SEARCH_LENGTH = 2;

  /// Service lifecycle
  /// <ul>
  ///   <li><b>NEW</b> - components wired, store file not yet initialised</li>
  ///   <li><b>OPEN</b> - store file present and operational</li>
  ///   <li><b>CLOSED</b> - closed via close(); auto backup stopped</li>
  /// </ul>
  enum ServiceState {
    NEW,
    OPEN,
    CLOSED
  }

  private volatile ServiceState state = ServiceState.NEW;

  @Getter private final BookingStoreConfig config;
  @Getter private final FileLockManager lockManager;
  @Getter private final BookingStore store;
  @Getter private final BackupManager backupManager;
  @Getter private final Archiver archiver;
  @Getter private final AdmissionScheduler admissionScheduler;
  @Getter private final HealthMonitor healthMonitor;
  private AutoBackupScheduler autoBackup;

  BookingService(BookingStoreConfig config, StoreFileOperations fileOperations) {
    this.config = config;
    this.lockManager = new FileLockManager(config);
    this.store =
        new BookingStore(
            config, lockManager, fileOperations, new SubmissionIdGenerator(config.clock()));
    this.backupManager = new BackupManager(config, lockManager, fileOperations);
    this.archiver = new Archiver(store, backupManager, fileOperations);
    this.admissionScheduler = new AdmissionScheduler(store);
    this.healthMonitor = new HealthMonitor(store, backupManager);
  }

  /// Wires the components, creates the store file if absent and starts the automatic backup when
  /// enabled.
  static BookingService open(BookingStoreConfig config, StoreFileOperations fileOperations)
      throws IOException {
    final var service = new BookingService(config, fileOperations);
    service.store.initialize();
    service.autoBackup = service.backupManager.scheduleAutoBackup().orElse(null);
    service.state = ServiceState.OPEN;
    logger.log(Level.FINE, () -> "opened booking store " + config.storeFile());
    return service;
  }

  /// Creates a new builder.
  ///
  /// Example usage:
  /// <pre>
  /// BookingService service = BookingService.Builder()
  ///     .dataDirectory("/var/lib/bookings")
  ///     .open();
  /// </pre>
  public static BookingServiceBuilder Builder() {
    return new BookingServiceBuilder();
  }

  /// Admits a new booking. A past or full date is refused without touching the file, as is a
  /// date that filled up between validation and the locked write.
  ///
  /// @throws StoreIOException if the backup or the write fails
  /// @throws LockTimeoutException if the store stays locked
  public SubmissionResult submit(SubmissionPayload payload) throws IOException {
    ensureOpen();
    Objects.requireNonNull(payload, "payload");
    final var bookingDate = payload.bookingDate();
    if (bookingDate != null) {
      final var validation = admissionScheduler.validate(bookingDate);
      if (!validation.valid()) {
        logger.log(Level.FINE, () -> "refused " + bookingDate + ": " + validation.message());
        return SubmissionResult.rejected(validation);
      }
    }
    backupManager.createBackup();
    try {
      return SubmissionResult.accepted(store.add(payload));
    } catch (CapacityExceededException e) {
      logger.log(Level.FINE, () -> "lost the last slot on " + e.getDate());
      final var availability =
          AdmissionScheduler.Availability.of(e.getDate(), e.getCount(), e.getMax());
      return SubmissionResult.rejected(
          AdmissionScheduler.BookingValidation.full(
              availability, admissionScheduler.nextAvailableDate(e.getDate()).orElse(null)));
    }
  }

  public List<SubmissionRecord> list(SubmissionFilter filter) throws IOException {
    ensureOpen();
    return store.list(filter);
  }

  public Page<SubmissionRecord> list(SubmissionFilter filter, int page, int limit)
      throws IOException {
    ensureOpen();
    return store.list(filter, page, limit);
  }

  public Optional<SubmissionRecord> getById(String id) throws IOException {
    ensureOpen();
    return store.getById(id);
  }

  /// Applies an admin update after backing up the file. Admin updates are not subject to the
  /// daily cap.
  ///
  /// @throws RecordNotFoundException if there is no such id
  public SubmissionRecord update(String id, SubmissionUpdate update) throws IOException {
    ensureOpen();
    backupManager.createBackup();
    return store.update(id, update);
  }

  /// @throws RecordNotFoundException if there is no such id
  public void delete(String id) throws IOException {
    ensureOpen();
    backupManager.createBackup();
    store.delete(id);
  }

  /// @throws IllegalArgumentException if the trimmed query is shorter than two characters
  public List<SubmissionRecord> search(String query) throws IOException {
    ensureOpen();
    if (query == null || query.trim().length() < MIN_SEARCH_LENGTH) {
      throw new IllegalArgumentException(
          "Search query must be at least " + MIN_SEARCH_LENGTH + " characters");
    }
    return store.search(query.trim());
  }

  public StoreStatistics statistics() throws IOException {
    ensureOpen();
    return store.statistics();
  }

  public Path exportFiltered(SubmissionFilter filter) throws IOException {
    ensureOpen();
    return store.exportFiltered(filter);
  }

  public SortedMap<LocalDate, Integer> bookingCountsBetween(LocalDate start, LocalDate end)
      throws IOException {
    ensureOpen();
    return store.bookingCountsBetween(start, end);
  }

  public AdmissionScheduler.Availability isAvailable(LocalDate date) throws IOException {
    ensureOpen();
    return admissionScheduler.isAvailable(date);
  }

  public Optional<AdmissionScheduler.NextAvailableDate> nextAvailableDate(LocalDate from)
      throws IOException {
    ensureOpen();
    return admissionScheduler.nextAvailableDate(from);
  }

  public AdmissionScheduler.BookingValidation validate(LocalDate date) throws IOException {
    ensureOpen();
    return admissionScheduler.validate(date);
  }

  public Optional<Path> createBackup() throws IOException {
    ensureOpen();
    return backupManager.createBackup();
  }

  public List<BackupManager.BackupInfo> listBackups() throws IOException {
    ensureOpen();
    return backupManager.listBackups();
  }

  public BackupManager.RestoreResult restoreFromBackup(String backupName) throws IOException {
    ensureOpen();
    return backupManager.restoreFromBackup(backupName);
  }

  public Archiver.ArchiveResult archiveOlderThan(int months) throws IOException {
    ensureOpen();
    return archiver.archiveOlderThan(months);
  }

  public HealthMonitor.HealthReport healthCheck() {
    ensureOpen();
    return healthMonitor.healthCheck();
  }

  /// The automatic backup, when enabled.
  public Optional<AutoBackupScheduler> autoBackup() {
    return Optional.ofNullable(autoBackup);
  }

  ServiceState getState() {
    return state;
  }

  public boolean isClosed() {
    return state == ServiceState.CLOSED;
  }

  private void ensureOpen() {
    if (state != ServiceState.OPEN) {
      throw new IllegalStateException("Service is in state " + state + ", expected OPEN");
    }
  }

  /// Stops the automatic backup. The store file needs no closing.
  @Override
  @Synchronized
  public void close() {
    logger.log(Level.FINE, () -> String.format("close called on %s", config.storeFile()));
    try {
      if (autoBackup != null) {
        autoBackup.close();
      }
    } finally {
      autoBackup = null;
      state = ServiceState.CLOSED;
    }
  }
}
