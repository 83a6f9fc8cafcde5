package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.stream.Stream;

/// Shared fixtures: a fixed "now", quick lock retries and sample payloads.
final class TestStores {

  static final ZoneId ZONE = ZoneOffset.UTC;

  /// Tests that do not care about wall time run on this day.
  static final Instant START = Instant.parse("2025-03-15T10:00:00Z");

  static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

  private TestStores() {}

  static BookingServiceBuilder builder(Path dataDirectory, Clock clock) {
    return BookingService.Builder()
        .dataDirectory(dataDirectory)
        .zone(ZONE)
        .clock(clock)
        .lockRetries(20, Duration.ofMillis(5), Duration.ofMillis(100), 2.0);
  }

  static SubmissionPayload payload(LocalDate bookingDate, String name) {
    return payload(bookingDate, name, "Ahmedabad");
  }

  static SubmissionPayload payload(LocalDate bookingDate, String name, String city) {
    return new SubmissionPayload(
        bookingDate, name, "9876543210@upi", "9876543210", "Shree Shantinath Shala", city, "127.0.0.1");
  }

  static Fixture fixture(Path dataDirectory, Clock clock) throws IOException {
    return fixture(builder(dataDirectory, clock).build(), NioStoreFileOperations.INSTANCE);
  }

  /// Wires and initialises the components the way [BookingService] does.
  static Fixture fixture(BookingStoreConfig config, StoreFileOperations fileOperations)
      throws IOException {
    final var fixture = new Fixture(config, fileOperations);
    fixture.store.initialize();
    return fixture;
  }

  static final class Fixture {
    final BookingStoreConfig config;
    final FileLockManager lockManager;
    final BookingStore store;
    final BackupManager backups;

    Fixture(BookingStoreConfig config, StoreFileOperations fileOperations) {
      this.config = config;
      this.lockManager = new FileLockManager(config);
      this.store =
          new BookingStore(
              config, lockManager, fileOperations, new SubmissionIdGenerator(config.clock()));
      this.backups = new BackupManager(config, lockManager, fileOperations);
    }
  }

  static void deleteRecursively(Path root) throws IOException {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
        Files.deleteIfExists(path);
      }
    }
  }
}
