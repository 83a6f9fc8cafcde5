package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import lombok.Getter;

/// The record store: a single workbook file holding every live submission plus a summary sheet.
///
/// Every mutation reads the whole file, transforms it in memory and rewrites the whole file while
/// holding the [FileLockManager] lock. Reads take only the in-process shared lock. Callers that
/// need crash recovery take a backup before mutating (see [BookingService]).
public class BookingStore {

  private static final Logger logger = Logger.getLogger(BookingStore.class.getName());

  static final Comparator<SubmissionRecord> NEWEST_FIRST =
      Comparator.comparing(SubmissionRecord::submissionDate)
          .thenComparing(SubmissionRecord::id)
          .reversed();

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  @Getter private final Path filePath;
  @Getter private final BookingStoreConfig config;
  @Getter private final FileLockManager lockManager;
  private final StoreFileOperations fileOperations;
  private final SubmissionIdGenerator idGenerator;

  public BookingStore(BookingStoreConfig config, FileLockManager lockManager) {
    this(
        config,
        lockManager,
        NioStoreFileOperations.INSTANCE,
        new SubmissionIdGenerator(config.clock()));
  }

  BookingStore(
      BookingStoreConfig config,
      FileLockManager lockManager,
      StoreFileOperations fileOperations,
      SubmissionIdGenerator idGenerator) {
    this.config = config;
    this.filePath = config.storeFile();
    this.lockManager = lockManager;
    this.fileOperations = fileOperations;
    this.idGenerator = idGenerator;
  }

  /// Creates the store file with its header row and a zero summary if it does not exist.
  ///
  /// @return true if the file was created, false if it already existed
  /// @throws StoreIOException if the file cannot be written
  public boolean initialize() throws IOException {
    final var parent = filePath.toAbsolutePath().getParent();
    try {
      fileOperations.createDirectories(parent);
    } catch (IOException e) {
      throw new StoreIOException("Cannot create data directory " + parent, e);
    }
    return lockManager.withLock(
        () -> {
          if (fileOperations.exists(filePath)) {
            logger.log(Level.FINE, () -> "store file already exists " + filePath);
            return false;
          }
          writeWorkbook(SubmissionSheets.newStore(now()));
          logger.info("Store file initialized at " + filePath);
          return true;
        });
  }

  public boolean exists() {
    return fileOperations.exists(filePath);
  }

  /// Appends a new pending record with a freshly assigned id and submission date.
  ///
  /// When the payload carries a booking date the daily cap is re-checked under the lock, so a
  /// date that filled up after the caller validated it is still refused.
  ///
  /// @return the stored record
  /// @throws CapacityExceededException if the booking date is already full
  /// @throws StoreIOException if the file cannot be read or written
  /// @throws LockTimeoutException if the store stays locked
  public SubmissionRecord add(SubmissionPayload payload) throws IOException {
    Objects.requireNonNull(payload, "payload");
    return lockManager.withLock(
        () -> {
          final var workbook = readWorkbook();
          final var records = records(workbook);
          final var bookingDate = payload.bookingDate();
          if (bookingDate != null) {
            final int count = (int) records.stream().filter(r -> r.occupies(bookingDate)).count();
            if (count >= config.maxBookingsPerDay()) {
              throw new CapacityExceededException(bookingDate, count, config.maxBookingsPerDay());
            }
          }
          final var ids = records.stream().map(SubmissionRecord::id).collect(Collectors.toSet());
          String id = idGenerator.nextId();
          while (ids.contains(id)) {
            id = idGenerator.nextId();
          }
          final var now = now();
          final var record = SubmissionRecord.create(id, now, payload);
          workbook.sheet(SubmissionSheets.SUBMISSIONS).addRow(SubmissionSheets.toRow(record));
          SubmissionSheets.updateSummary(workbook, SubmissionSheets.summaryTotal(workbook) + 1, now);
          writeWorkbook(workbook);
          logger.log(Level.FINE, () -> "added " + record.id());
          return record;
        });
  }

  /// All records matching the filter, newest submission first.
  public List<SubmissionRecord> list(SubmissionFilter filter) throws IOException {
    final var effective = filter == null ? SubmissionFilter.ALL : filter;
    return select(effective::matches);
  }

  public List<SubmissionRecord> list() throws IOException {
    return list(SubmissionFilter.ALL);
  }

  public Page<SubmissionRecord> list(SubmissionFilter filter, int page, int limit)
      throws IOException {
    return Page.of(list(filter), page, limit);
  }

  public Optional<SubmissionRecord> getById(String id) throws IOException {
    return select(r -> r.id().equals(id)).stream().findFirst();
  }

  /// Overwrites only the supplied fields of one record.
  ///
  /// @return the record as stored after the update
  /// @throws RecordNotFoundException if no row has that id
  public SubmissionRecord update(String id, SubmissionUpdate update) throws IOException {
    Objects.requireNonNull(update, "update");
    return lockManager.withLock(
        () -> {
          final var workbook = readWorkbook();
          final var sheet = workbook.sheet(SubmissionSheets.SUBMISSIONS);
          final int row = rowOf(sheet, id);
          final var updated = SubmissionSheets.fromRow(sheet, row).apply(update);
          sheet.setRow(row, SubmissionSheets.toRow(updated));
          SubmissionSheets.updateSummary(workbook, SubmissionSheets.summaryTotal(workbook), now());
          writeWorkbook(workbook);
          logger.log(Level.FINE, () -> String.format("updated %s with %s", id, update));
          return updated;
        });
  }

  /// Removes one record and decrements the cached total, never below zero.
  ///
  /// @throws RecordNotFoundException if no row has that id; the file is left unchanged
  public void delete(String id) throws IOException {
    lockManager.withLock(
        () -> {
          final var workbook = readWorkbook();
          final var sheet = workbook.sheet(SubmissionSheets.SUBMISSIONS);
          sheet.removeRow(rowOf(sheet, id));
          SubmissionSheets.updateSummary(workbook, SubmissionSheets.summaryTotal(workbook) - 1, now());
          writeWorkbook(workbook);
          logger.log(Level.FINE, () -> "deleted " + id);
          return null;
        });
  }

  /// Case-insensitive substring match on name, city, shala name and id; plain substring match
  /// on the two phone-like numbers.
  public List<SubmissionRecord> search(String query) throws IOException {
    Objects.requireNonNull(query, "query");
    final var lower = query.toLowerCase(Locale.ROOT);
    return select(
        r ->
            containsIgnoreCase(r.name(), lower)
                || contains(r.upiNumber(), query)
                || contains(r.whatsappNumber(), query)
                || containsIgnoreCase(r.ayambilShalaName(), lower)
                || containsIgnoreCase(r.city(), lower)
                || containsIgnoreCase(r.id(), lower));
  }

  public StoreStatistics statistics() throws IOException {
    final var records = list();
    final var today = today();
    return new StoreStatistics(
        records.size(),
        (int)
            records.stream()
                .filter(r -> LocalDate.ofInstant(r.submissionDate(), config.zone()).equals(today))
                .count(),
        countStatus(records, SubmissionStatus.PENDING),
        countStatus(records, SubmissionStatus.REVIEWED),
        countStatus(records, SubmissionStatus.ARCHIVED),
        round2(fileSizeBytes() / BYTES_PER_MB));
  }

  /// Writes the filtered records to a new file in the export directory. The live store is not
  /// touched.
  ///
  /// @return the path of the export file
  public Path exportFiltered(SubmissionFilter filter) throws IOException {
    final var records = list(filter);
    final var directory = config.exportDirectory();
    try {
      fileOperations.createDirectories(directory);
      final var stamp = DateTimeFormatter.ISO_LOCAL_DATE.format(today());
      long unique = config.clock().millis();
      Path target = directory.resolve(exportName(stamp, unique));
      while (fileOperations.exists(target)) {
        target = directory.resolve(exportName(stamp, ++unique));
      }
      fileOperations.write(
          target, WorkbookCodec.encode(SubmissionSheets.listing(SubmissionSheets.EXPORT, records)));
      final var exported = target;
      logger.log(Level.FINE, () -> String.format("exported %d rows to %s", records.size(), exported));
      return target;
    } catch (StoreIOException e) {
      throw e;
    } catch (IOException e) {
      throw new StoreIOException("Export failed: " + e.getMessage(), e);
    }
  }

  /// Number of rows holding a slot on the day: live rows with that booking date whose status is
  /// not archived.
  public int countForDate(LocalDate date) throws IOException {
    Objects.requireNonNull(date, "date");
    return select(r -> r.occupies(date)).size();
  }

  /// Per-day slot counts for booking dates in the inclusive range. Days without bookings are
  /// absent.
  public SortedMap<LocalDate, Integer> bookingCountsBetween(LocalDate start, LocalDate end)
      throws IOException {
    final var counts = new TreeMap<LocalDate, Integer>();
    for (SubmissionRecord record : list()) {
      final var day = record.bookingDate();
      if (day != null
          && record.status() != SubmissionStatus.ARCHIVED
          && !day.isBefore(start)
          && !day.isAfter(end)) {
        counts.merge(day, 1, Integer::sum);
      }
    }
    return counts;
  }

  /// Number of data rows, excluding the header.
  public int rowCount() throws IOException {
    return lockManager.withReadLock(
        () -> readWorkbook().sheet(SubmissionSheets.SUBMISSIONS).rowCount());
  }

  /// The total held in the summary sheet.
  public int summaryTotal() throws IOException {
    return lockManager.withReadLock(() -> SubmissionSheets.summaryTotal(readWorkbook()));
  }

  /// Size of the store file in bytes, 0 if it does not exist.
  public long fileSizeBytes() throws IOException {
    if (!fileOperations.exists(filePath)) {
      return 0;
    }
    try {
      return fileOperations.size(filePath);
    } catch (IOException e) {
      throw new StoreIOException("Cannot stat " + filePath, e);
    }
  }

  /// The calendar day "now" falls on in the configured zone.
  LocalDate today() {
    return LocalDate.ofInstant(config.clock().instant(), config.zone());
  }

  Instant now() {
    return config.clock().instant();
  }

  StoreFileOperations fileOperations() {
    return fileOperations;
  }

  /// Reads and decodes the whole store file. The caller holds whichever lock it needs.
  Workbook readWorkbook() throws StoreIOException {
    final byte[] bytes;
    try {
      bytes = fileOperations.readAllBytes(filePath);
    } catch (IOException e) {
      throw new StoreIOException("Cannot read store file " + filePath + ": " + e.getMessage(), e);
    }
    final var workbook = WorkbookCodec.decode(bytes);
    if (workbook.findSheet(SubmissionSheets.SUBMISSIONS).isEmpty()) {
      throw new StoreIOException("Store file has no " + SubmissionSheets.SUBMISSIONS + " sheet");
    }
    return workbook;
  }

  /// Encodes and rewrites the whole store file. The caller holds the exclusive lock.
  void writeWorkbook(Workbook workbook) throws StoreIOException {
    final var bytes = WorkbookCodec.encode(workbook);
    try {
      if (config.atomicWrites()) {
        fileOperations.writeAtomically(filePath, bytes);
      } else {
        fileOperations.write(filePath, bytes);
      }
    } catch (IOException e) {
      throw new StoreIOException("Cannot write store file " + filePath + ": " + e.getMessage(), e);
    }
    logger.log(Level.FINEST, () -> String.format("wrote %d bytes to %s", bytes.length, filePath));
  }

  /// Decodes every data row of the submissions sheet, in file order.
  static List<SubmissionRecord> records(Workbook workbook) throws StoreIOException {
    final var sheet = workbook.sheet(SubmissionSheets.SUBMISSIONS);
    final var records = new ArrayList<SubmissionRecord>(sheet.rowCount());
    final var seen = new HashSet<String>();
    for (int row = 0; row < sheet.rowCount(); row++) {
      final var record = SubmissionSheets.fromRow(sheet, row);
      if (!seen.add(record.id())) {
        logger.log(Level.WARNING, "duplicate id in store file " + record.id());
      }
      records.add(record);
    }
    return records;
  }

  private List<SubmissionRecord> select(Predicate<SubmissionRecord> predicate) throws IOException {
    final var records = lockManager.withReadLock(() -> records(readWorkbook()));
    return records.stream()
        .filter(predicate)
        .sorted(NEWEST_FIRST)
        .collect(Collectors.toList());
  }

  private static int rowOf(Sheet sheet, String id) {
    for (int row = 0; row < sheet.rowCount(); row++) {
      if (Objects.equals(id, sheet.cell(row, SubmissionSheets.ID))) {
        return row;
      }
    }
    throw new RecordNotFoundException(id);
  }

  private String exportName(String stamp, long unique) {
    return String.format("export_%s_%d%s", stamp, unique, config.storeExtension());
  }

  private static int countStatus(List<SubmissionRecord> records, SubmissionStatus status) {
    return (int) records.stream().filter(r -> r.status() == status).count();
  }

  private static boolean containsIgnoreCase(String value, String lowerQuery) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(lowerQuery);
  }

  private static boolean contains(String value, String query) {
    return value != null && value.contains(query);
  }

  static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
