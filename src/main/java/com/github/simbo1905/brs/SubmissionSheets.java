package com.github.simbo1905.brs;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

/// Layout of the store file: the `Submissions` sheet with one row per record and the `Summary`
/// sheet of metric/value pairs. Converts between records and rows.
final class SubmissionSheets {

  static final String SUBMISSIONS = "Submissions";
  static final String SUMMARY = "Summary";
  static final String EXPORT = "Submissions Export";
  static final String ARCHIVE = "Archived Submissions";

  static final String TOTAL_METRIC = "Total Submissions";
  static final String LAST_UPDATED_METRIC = "Last Updated";

  static final int ID = 0;
  static final int SUBMISSION_DATE = 1;
  static final int BOOKING_DATE = 2;
  static final int NAME = 3;
  static final int UPI_NUMBER = 4;
  static final int WHATSAPP_NUMBER = 5;
  static final int AYAMBIL_SHALA_NAME = 6;
  static final int CITY = 7;
  static final int STATUS = 8;
  static final int IP_ADDRESS = 9;

  /// Headers are bilingual, Gujarati first.
  static final List<Column> COLUMNS =
      List.of(
          new Column("ID", "id", 25),
          new Column("સબમિશન તારીખ (Submission Date)", "submissionDate", 20),
          new Column("બુકિંગ તારીખ (Booking Date)", "bookingDate", 20),
          new Column("નામ (Name)", "name", 30),
          new Column("UPI નંબર (UPI Number)", "upiNumber", 15),
          new Column("WhatsApp નંબર (WhatsApp Number)", "whatsappNumber", 15),
          new Column("આયંબિલ શાળા નામ (Ayambil Shala Name)", "ayambilShalaName", 40),
          new Column("શહેર (City)", "city", 20),
          new Column("સ્થિતિ (Status)", "status", 15),
          new Column("IP Address", "ipAddress", 20));

  static final List<Column> SUMMARY_COLUMNS =
      List.of(new Column("Metric", "metric", 30), new Column("Value", "value", 20));

  private SubmissionSheets() {}

  /// A fresh store: empty submissions sheet plus a summary with a zero total.
  static Workbook newStore(Instant now) {
    final var workbook = new Workbook();
    workbook.addSheet(new Sheet(SUBMISSIONS, COLUMNS, HeaderStyle.BOLD_GREY));
    final var summary = workbook.addSheet(new Sheet(SUMMARY, SUMMARY_COLUMNS, HeaderStyle.BOLD));
    summary.addRow(List.of(TOTAL_METRIC, "0"));
    summary.addRow(List.of(LAST_UPDATED_METRIC, now.toString()));
    return workbook;
  }

  /// A single-sheet workbook of records, used for exports and archives.
  static Workbook listing(String sheetName, List<SubmissionRecord> records) {
    final var workbook = new Workbook();
    final var sheet = workbook.addSheet(new Sheet(sheetName, COLUMNS, HeaderStyle.BOLD_GREY));
    records.forEach(r -> sheet.addRow(toRow(r)));
    return workbook;
  }

  static List<String> toRow(SubmissionRecord record) {
    return Arrays.asList(
        record.id(),
        record.submissionDate().toString(),
        record.bookingDate() == null ? "" : record.bookingDate().toString(),
        record.name(),
        record.upiNumber(),
        record.whatsappNumber(),
        record.ayambilShalaName(),
        record.city(),
        record.status().wireName(),
        record.ipAddress());
  }

  /// @throws StoreIOException if a mandatory cell is missing or unparsable
  static SubmissionRecord fromRow(Sheet sheet, int index) throws StoreIOException {
    try {
      final var id = sheet.cell(index, ID);
      if (id == null || id.isEmpty()) {
        throw new StoreIOException("Row " + index + " of " + sheet.name() + " has no id");
      }
      final var booking = sheet.cell(index, BOOKING_DATE);
      return new SubmissionRecord(
          id,
          Instant.parse(sheet.cell(index, SUBMISSION_DATE)),
          booking == null || booking.isEmpty() ? null : LocalDate.parse(booking),
          sheet.cell(index, NAME),
          sheet.cell(index, UPI_NUMBER),
          sheet.cell(index, WHATSAPP_NUMBER),
          sheet.cell(index, AYAMBIL_SHALA_NAME),
          sheet.cell(index, CITY),
          SubmissionStatus.fromWireName(sheet.cell(index, STATUS)),
          sheet.cell(index, IP_ADDRESS) == null ? "" : sheet.cell(index, IP_ADDRESS));
    } catch (DateTimeParseException | IllegalArgumentException | NullPointerException e) {
      throw new StoreIOException(
          String.format("Row %d of %s is malformed: %s", index, sheet.name(), e.getMessage()), e);
    }
  }

  /// Reads the cached total, or 0 when the summary sheet is missing or unreadable.
  static int summaryTotal(Workbook workbook) {
    return workbook
        .findSheet(SUMMARY)
        .map(
            summary -> {
              final int row = metricRow(summary, TOTAL_METRIC);
              if (row < 0) {
                return 0;
              }
              try {
                return Integer.parseInt(summary.cell(row, 1));
              } catch (NumberFormatException e) {
                return 0;
              }
            })
        .orElse(0);
  }

  /// Stores the total (floored at zero) and stamps the last-updated time.
  static void updateSummary(Workbook workbook, int total, Instant now) {
    workbook
        .findSheet(SUMMARY)
        .ifPresent(
            summary -> {
              setMetric(summary, TOTAL_METRIC, Integer.toString(Math.max(0, total)));
              setMetric(summary, LAST_UPDATED_METRIC, now.toString());
            });
  }

  static String lastUpdated(Workbook workbook) {
    return workbook
        .findSheet(SUMMARY)
        .map(
            summary -> {
              final int row = metricRow(summary, LAST_UPDATED_METRIC);
              return row < 0 ? null : summary.cell(row, 1);
            })
        .orElse(null);
  }

  private static void setMetric(Sheet summary, String metric, String value) {
    final int row = metricRow(summary, metric);
    if (row < 0) {
      summary.addRow(List.of(metric, value));
    } else {
      summary.setCell(row, 1, value);
    }
  }

  private static int metricRow(Sheet summary, String metric) {
    for (int r = 0; r < summary.rowCount(); r++) {
      if (metric.equals(summary.cell(r, 0))) {
        return r;
      }
    }
    return -1;
  }
}
