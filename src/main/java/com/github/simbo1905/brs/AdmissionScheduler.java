package com.github.simbo1905.brs;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.Nullable;

/// Enforces the per-day booking cap and finds open days.
///
/// A day's count is the number of live rows whose booking date is that calendar day and whose
/// status is not `archived`.
public class AdmissionScheduler {

  private static final Logger logger = Logger.getLogger(AdmissionScheduler.class.getName());

  /// Occupancy of one day. `remaining` never goes below zero.
  public record Availability(LocalDate date, boolean available, int count, int max, int remaining) {

    static Availability of(LocalDate date, int count, int max) {
      return new Availability(date, count < max, count, max, Math.max(0, max - count));
    }
  }

  /// The first open day found by a forward search.
  public record NextAvailableDate(LocalDate date, int count, int remaining) {}

  public enum Rejection {
    PAST_DATE,
    CAPACITY_EXCEEDED
  }

  /// The outcome of validating a requested booking date. A rejected date due to capacity carries
  /// the suggested next open day when one exists within the horizon.
  public record BookingValidation(
      boolean valid,
      LocalDate date,
      @Nullable Rejection rejection,
      String message,
      @Nullable Availability availability,
      @Nullable NextAvailableDate nextAvailable) {

    static BookingValidation accepted(Availability availability) {
      return new BookingValidation(
          true,
          availability.date(),
          null,
          String.format(
              "Date is available (%d/%d bookings)", availability.count(), availability.max()),
          availability,
          null);
    }

    static BookingValidation pastDate(LocalDate date) {
      return new BookingValidation(
          false, date, Rejection.PAST_DATE, "Past dates cannot be booked", null, null);
    }

    static BookingValidation full(Availability availability, @Nullable NextAvailableDate next) {
      return new BookingValidation(
          false,
          availability.date(),
          Rejection.CAPACITY_EXCEEDED,
          String.format(
              "This date is fully booked (%d/%d bookings)",
              availability.count(), availability.max()),
          availability,
          next);
    }

    public Optional<NextAvailableDate> suggestion() {
      return Optional.ofNullable(nextAvailable);
    }

    /// For callers that prefer exceptions to inspecting the result.
    ///
    /// @throws PastDateException if the date is before today
    /// @throws CapacityExceededException if the date is full
    public BookingValidation orElseThrow() {
      if (rejection == Rejection.PAST_DATE) {
        throw new PastDateException(date);
      }
      if (rejection == Rejection.CAPACITY_EXCEEDED) {
        throw new CapacityExceededException(date, availability.count(), availability.max());
      }
      return this;
    }
  }

  private final BookingStore store;
  private final int maxPerDay;
  private final int horizonDays;

  public AdmissionScheduler(BookingStore store) {
    this.store = store;
    this.maxPerDay = store.getConfig().maxBookingsPerDay();
    this.horizonDays = store.getConfig().availabilityHorizonDays();
  }

  public int countForDate(LocalDate date) throws IOException {
    return store.countForDate(date);
  }

  public Availability isAvailable(LocalDate date) throws IOException {
    return Availability.of(date, countForDate(date), maxPerDay);
  }

  public Optional<NextAvailableDate> nextAvailableDate(LocalDate from) throws IOException {
    return nextAvailableDate(from, horizonDays);
  }

  /// Scans `horizonDays` days forward starting at `from` inclusive and returns the first day with
  /// a free slot.
  public Optional<NextAvailableDate> nextAvailableDate(LocalDate from, int horizonDays)
      throws IOException {
    Objects.requireNonNull(from, "from");
    if (horizonDays < 1) {
      throw new IllegalArgumentException("horizonDays must be at least 1, got " + horizonDays);
    }
    final var counts = store.bookingCountsBetween(from, from.plusDays(horizonDays - 1L));
    for (int i = 0; i < horizonDays; i++) {
      final var day = from.plusDays(i);
      final int count = counts.getOrDefault(day, 0);
      if (count < maxPerDay) {
        return Optional.of(new NextAvailableDate(day, count, maxPerDay - count));
      }
    }
    logger.log(
        Level.FINE,
        () -> String.format("no open day within %d days of %s", horizonDays, from));
    return Optional.empty();
  }

  /// Rejects past days, then full days. Today is bookable.
  public BookingValidation validate(LocalDate date) throws IOException {
    Objects.requireNonNull(date, "date");
    if (date.isBefore(store.today())) {
      return BookingValidation.pastDate(date);
    }
    final var availability = isAvailable(date);
    if (availability.available()) {
      return BookingValidation.accepted(availability);
    }
    final var next = nextAvailableDate(date).orElse(null);
    logger.log(
        Level.FINE,
        () -> String.format("%s is full, suggesting %s", date, next == null ? "none" : next.date()));
    return BookingValidation.full(availability, next);
  }
}
