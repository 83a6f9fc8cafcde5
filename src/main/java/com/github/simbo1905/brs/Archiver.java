package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.Nullable;

/// Moves old rows out of the live store into a separate archive file.
///
/// A row's age is its booking date, or the calendar day of its submission when it has none. Rows
/// strictly before the cutoff are written to `archive_<cutoff>_<N>records<ext>` and then removed
/// from the live store, highest row index first, in one locked rewrite. Rows keep the status they
/// had; the soft `archived` status is unrelated to this sweep.
public class Archiver {

  private static final Logger logger = Logger.getLogger(Archiver.class.getName());

  /// What a sweep did. `archivePath` is null when nothing qualified and no file was written.
  public record ArchiveResult(int archivedCount, @Nullable Path archivePath, LocalDate cutoffDate) {

    public Optional<Path> archiveFile() {
      return Optional.ofNullable(archivePath);
    }
  }

  private final BookingStore store;
  private final BackupManager backupManager;
  private final StoreFileOperations fileOperations;
  private final Path archiveDirectory;

  public Archiver(BookingStore store, BackupManager backupManager) {
    this(store, backupManager, store.fileOperations());
  }

  Archiver(BookingStore store, BackupManager backupManager, StoreFileOperations fileOperations) {
    this.store = store;
    this.backupManager = backupManager;
    this.fileOperations = fileOperations;
    this.archiveDirectory = store.getConfig().archiveDirectory();
  }

  /// The cutoff for a sweep run now: today minus the given number of months.
  public LocalDate cutoffFor(int months) {
    if (months < 0) {
      throw new IllegalArgumentException("months must be non-negative, got " + months);
    }
    return store.today().minusMonths(months);
  }

  /// Archives every live row older than `months` months.
  ///
  /// @throws ArchivalException wrapping whatever failed; the live store is only changed by the
  ///     final rewrite
  public ArchiveResult archiveOlderThan(int months) throws ArchivalException {
    final var cutoff = cutoffFor(months);
    try {
      backupManager.createBackup();
      return store.getLockManager().withLock(() -> sweep(cutoff));
    } catch (ArchivalException e) {
      throw e;
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Archive failed: " + e.getMessage(), e);
      throw new ArchivalException("Archive failed: " + e.getMessage(), e);
    }
  }

  private ArchiveResult sweep(LocalDate cutoff) throws IOException {
    final var workbook = store.readWorkbook();
    final var sheet = workbook.sheet(SubmissionSheets.SUBMISSIONS);
    final var rows = new ArrayList<Integer>();
    final var archived = new ArrayList<SubmissionRecord>();
    for (int row = 0; row < sheet.rowCount(); row++) {
      final var record = SubmissionSheets.fromRow(sheet, row);
      if (ageOf(record).isBefore(cutoff)) {
        rows.add(row);
        archived.add(record);
      }
    }
    if (archived.isEmpty()) {
      logger.log(Level.FINE, () -> "no records to archive before " + cutoff);
      return new ArchiveResult(0, null, cutoff);
    }
    fileOperations.createDirectories(archiveDirectory);
    final var archivePath = archivePath(cutoff, archived.size());
    fileOperations.write(
        archivePath, WorkbookCodec.encode(SubmissionSheets.listing(SubmissionSheets.ARCHIVE, archived)));

    for (int i = rows.size() - 1; i >= 0; i--) {
      sheet.removeRow(rows.get(i));
    }
    SubmissionSheets.updateSummary(workbook, sheet.rowCount(), store.now());
    store.writeWorkbook(workbook);
    logger.info(
        () -> String.format("Archived %d records to %s", archived.size(), archivePath));
    return new ArchiveResult(archived.size(), archivePath, cutoff);
  }

  LocalDate ageOf(SubmissionRecord record) {
    return record.bookingDate() != null
        ? record.bookingDate()
        : LocalDate.ofInstant(record.submissionDate(), store.getConfig().zone());
  }

  private Path archivePath(LocalDate cutoff, int count) {
    final var stem = String.format("archive_%s_%drecords", cutoff, count);
    final var extension = store.getConfig().storeExtension();
    var path = archiveDirectory.resolve(stem + extension);
    for (int n = 2; fileOperations.exists(path); n++) {
      path = archiveDirectory.resolve(stem + "_" + n + extension);
    }
    return path;
  }
}
