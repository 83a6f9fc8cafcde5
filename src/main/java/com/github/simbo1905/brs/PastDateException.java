package com.github.simbo1905.brs;

import java.time.LocalDate;

/// The booking date lies before today.
public class PastDateException extends IllegalArgumentException {

  private final LocalDate date;

  public PastDateException(LocalDate date) {
    super("Past dates cannot be booked: " + date);
    this.date = date;
  }

  public LocalDate getDate() {
    return date;
  }
}
