package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;

/// The store lock could not be acquired within the retry budget. The resource is busy and the
/// caller may retry later.
public class LockTimeoutException extends IOException {

  private final Path lockedPath;
  private final int attempts;

  public LockTimeoutException(Path lockedPath, int attempts) {
    super(
        String.format(
            "File is currently locked by another process. Please try again in a moment. path=%s attempts=%d",
            lockedPath, attempts));
    this.lockedPath = lockedPath;
    this.attempts = attempts;
  }

  public Path getLockedPath() {
    return lockedPath;
  }

  public int getAttempts() {
    return attempts;
  }

  /// Lock contention is always worth another try.
  public boolean isRetriable() {
    return true;
  }
}
