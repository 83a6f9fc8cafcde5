package com.github.simbo1905.brs;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/// The outcome of a submission: either the stored record, or the validation that refused the
/// booking date.
public record SubmissionResult(
    boolean accepted,
    @Nullable SubmissionRecord record,
    @Nullable AdmissionScheduler.BookingValidation validation) {

  static SubmissionResult accepted(SubmissionRecord record) {
    return new SubmissionResult(true, record, null);
  }

  static SubmissionResult rejected(AdmissionScheduler.BookingValidation validation) {
    return new SubmissionResult(false, null, validation);
  }

  public Optional<SubmissionRecord> stored() {
    return Optional.ofNullable(record);
  }
}
