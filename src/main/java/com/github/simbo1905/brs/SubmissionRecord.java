package com.github.simbo1905.brs;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/// One booking row of the store file. The id, submission date and ip address are fixed at
/// creation; everything else may be changed by an admin update.
public record SubmissionRecord(
    String id,
    Instant submissionDate,
    @Nullable LocalDate bookingDate,
    String name,
    String upiNumber,
    String whatsappNumber,
    String ayambilShalaName,
    String city,
    SubmissionStatus status,
    String ipAddress) {

  public SubmissionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(submissionDate, "submissionDate");
    Objects.requireNonNull(status, "status");
  }

  /// Creates the pending record for a freshly admitted payload.
  static SubmissionRecord create(String id, Instant submissionDate, SubmissionPayload payload) {
    return new SubmissionRecord(
        id,
        submissionDate,
        payload.bookingDate(),
        payload.name(),
        payload.upiNumber(),
        payload.whatsappNumber(),
        payload.ayambilShalaName(),
        payload.city(),
        SubmissionStatus.PENDING,
        payload.ipAddress() == null ? "" : payload.ipAddress());
  }

  /// Returns a copy with only the supplied fields of the update applied.
  SubmissionRecord apply(SubmissionUpdate update) {
    return new SubmissionRecord(
        id,
        submissionDate,
        update.bookingDate() != null ? update.bookingDate() : bookingDate,
        supplied(update.name()) ? update.name() : name,
        supplied(update.upiNumber()) ? update.upiNumber() : upiNumber,
        supplied(update.whatsappNumber()) ? update.whatsappNumber() : whatsappNumber,
        supplied(update.ayambilShalaName()) ? update.ayambilShalaName() : ayambilShalaName,
        supplied(update.city()) ? update.city() : city,
        update.status() != null ? update.status() : status,
        ipAddress);
  }

  /// Whether this row holds one of the daily slots for the given day.
  boolean occupies(LocalDate day) {
    return bookingDate != null && bookingDate.equals(day) && status != SubmissionStatus.ARCHIVED;
  }

  private static boolean supplied(String value) {
    return value != null && !value.isEmpty();
  }
}
