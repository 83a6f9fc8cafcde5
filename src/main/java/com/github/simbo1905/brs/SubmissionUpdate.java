package com.github.simbo1905.brs;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/// A partial admin update. A `null` (or empty string) field leaves the stored value untouched.
public record SubmissionUpdate(
    @Nullable SubmissionStatus status,
    @Nullable LocalDate bookingDate,
    @Nullable String name,
    @Nullable String upiNumber,
    @Nullable String whatsappNumber,
    @Nullable String ayambilShalaName,
    @Nullable String city) {

  /// The only field names an update may carry.
  public static final Set<String> ALLOWED_FIELDS =
      Set.of(
          "status",
          "bookingDate",
          "name",
          "upiNumber",
          "whatsappNumber",
          "ayambilShalaName",
          "city");

  public static SubmissionUpdate status(SubmissionStatus status) {
    return new SubmissionUpdate(status, null, null, null, null, null, null);
  }

  public static SubmissionUpdate city(String city) {
    return new SubmissionUpdate(null, null, null, null, null, null, city);
  }

  public static SubmissionUpdate bookingDate(LocalDate bookingDate) {
    return new SubmissionUpdate(null, bookingDate, null, null, null, null, null);
  }

  /// Builds an update from loosely typed request fields.
  ///
  /// @throws IllegalArgumentException for a field outside [#ALLOWED_FIELDS], an unknown status
  /// or a booking date that is not `yyyy-MM-dd`
  public static SubmissionUpdate fromFields(Map<String, String> fields) {
    for (String key : fields.keySet()) {
      if (!ALLOWED_FIELDS.contains(key)) {
        throw new IllegalArgumentException("Field may not be updated: " + key);
      }
    }
    final var status = fields.get("status");
    final var bookingDate = fields.get("bookingDate");
    LocalDate parsedDate = null;
    if (bookingDate != null && !bookingDate.isEmpty()) {
      try {
        parsedDate = LocalDate.parse(bookingDate.trim());
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid bookingDate " + bookingDate, e);
      }
    }
    return new SubmissionUpdate(
        status == null || status.isEmpty() ? null : SubmissionStatus.fromWireName(status),
        parsedDate,
        fields.get("name"),
        fields.get("upiNumber"),
        fields.get("whatsappNumber"),
        fields.get("ayambilShalaName"),
        fields.get("city"));
  }
}
