package com.github.simbo1905.brs;

import java.io.IOException;

/// An archival sweep failed. If the failure happened before the live store was rewritten the
/// live store is untouched; a partial archive file may be left behind.
public class ArchivalException extends IOException {

  public ArchivalException(String message, Throwable cause) {
    super(message, cause);
  }
}
