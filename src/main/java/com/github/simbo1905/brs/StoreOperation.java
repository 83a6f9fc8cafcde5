package com.github.simbo1905.brs;

import java.io.IOException;

/// A unit of work run while holding one of the store locks.
@FunctionalInterface
public interface StoreOperation<T> {
  T run() throws IOException;
}
