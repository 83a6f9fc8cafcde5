package com.github.simbo1905.brs;

/// Point-in-time counts over the live store plus its size on disk.
///
/// @param total all live rows
/// @param today rows submitted on the current calendar day
/// @param fileSizeMB store file size in MiB rounded to two places
public record StoreStatistics(
    int total, int today, int pending, int reviewed, int archived, double fileSizeMB) {

  @Override
  public String toString() {
    return String.format(
        "StoreStatistics[total=%d, today=%d, pending=%d, reviewed=%d, archived=%d, sizeMB=%.2f]",
        total, today, pending, reviewed, archived, fileSizeMB);
  }
}
