package com.github.simbo1905.brs;

import org.jetbrains.annotations.Nullable;

/// Equality filter over status and city. A `null` criterion matches everything.
public record SubmissionFilter(@Nullable SubmissionStatus status, @Nullable String city) {

  public static final SubmissionFilter ALL = new SubmissionFilter(null, null);

  public static SubmissionFilter byStatus(SubmissionStatus status) {
    return new SubmissionFilter(status, null);
  }

  public static SubmissionFilter byCity(String city) {
    return new SubmissionFilter(null, city);
  }

  boolean matches(SubmissionRecord record) {
    if (status != null && record.status() != status) {
      return false;
    }
    return city == null || city.equals(record.city());
  }
}
