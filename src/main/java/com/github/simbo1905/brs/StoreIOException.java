package com.github.simbo1905.brs;

import java.io.IOException;

/// The store file (or one of its siblings) could not be read, parsed or written.
public class StoreIOException extends IOException {

  public StoreIOException(String message) {
    super(message);
  }

  public StoreIOException(String message, Throwable cause) {
    super(message, cause);
  }
}
