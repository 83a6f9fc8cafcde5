package com.github.simbo1905.brs;

import java.util.Locale;

/// Review state of a submission. Every live row carries exactly one of these.
///
/// `ARCHIVED` here is the admin-driven soft archival. Rows moved out by the archival sweep are
/// physically removed from the live store and never carry this status.
public enum SubmissionStatus {
  PENDING("pending"),
  REVIEWED("reviewed"),
  ARCHIVED("archived");

  private final String wireName;

  SubmissionStatus(String wireName) {
    this.wireName = wireName;
  }

  /// The lower-case name written into the store file.
  public String wireName() {
    return wireName;
  }

  /// Parses a stored or supplied status name, ignoring case.
  ///
  /// @throws IllegalArgumentException if the name is not one of pending, reviewed, archived
  public static SubmissionStatus fromWireName(String name) {
    if (name != null) {
      final var lower = name.trim().toLowerCase(Locale.ROOT);
      for (SubmissionStatus status : values()) {
        if (status.wireName.equals(lower)) {
          return status;
        }
      }
    }
    throw new IllegalArgumentException(
        "Status must be one of: pending, reviewed, archived, got " + name);
  }

  @Override
  public String toString() {
    return wireName;
  }
}
