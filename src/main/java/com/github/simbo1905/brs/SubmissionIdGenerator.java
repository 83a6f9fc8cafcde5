package com.github.simbo1905.brs;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/// Generates submission ids of the form `VRT-<unix-ms>-<8 upper-case hex>`.
///
/// The millisecond part never repeats within one JVM: when two ids are requested in the same
/// millisecond the second borrows the next millisecond. Across processes the 32 random bits make a
/// collision improbable, and ids are never reused because the time part only moves forward.
public class SubmissionIdGenerator {

  public static final String PREFIX = "VRT-";

  /// Defer the SecureRandom seed until the first id is needed.
  private static class LazyRandom {
    static final SecureRandom RANDOM = new SecureRandom();
  }

  private final Clock clock;
  private final AtomicLong lastMillis = new AtomicLong();

  public SubmissionIdGenerator(Clock clock) {
    this.clock = clock;
  }

  /// Strictly increasing milliseconds, at least the wall clock.
  long nextMillis() {
    final long now = clock.millis();
    return lastMillis.updateAndGet(last -> Math.max(now, last + 1));
  }

  public String nextId() {
    final int random = LazyRandom.RANDOM.nextInt();
    return PREFIX + nextMillis() + "-" + String.format(Locale.ROOT, "%08X", random);
  }

  /// Whether the text has the shape of a generated id.
  public static boolean isWellFormed(String id) {
    return id != null && id.matches("VRT-\\d+-[0-9A-F]{8}");
  }
}
