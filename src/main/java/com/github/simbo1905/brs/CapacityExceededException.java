package com.github.simbo1905.brs;

import java.time.LocalDate;

/// The booking date already holds the maximum number of bookings.
public class CapacityExceededException extends IllegalStateException {

  private final LocalDate date;
  private final int count;
  private final int max;

  public CapacityExceededException(LocalDate date, int count, int max) {
    super(String.format("This date is fully booked (%d/%d bookings): %s", count, max, date));
    this.date = date;
    this.count = count;
    this.max = max;
  }

  public LocalDate getDate() {
    return date;
  }

  public int getCount() {
    return count;
  }

  public int getMax() {
    return max;
  }
}
