package com.github.simbo1905.brs;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// A guarded wrapper around ReentrantReadWriteLock that returns AutoCloseable guards, making it
/// impossible to forget to unlock. Readers of the store file take the read guard; the writer that
/// holds the advisory file lock takes the write guard.
final class GuardedReentrantReadWriteLock {
  private final ReentrantReadWriteLock lock;

  GuardedReentrantReadWriteLock(boolean fair) {
    this.lock = new ReentrantReadWriteLock(fair);
  }

  GuardedReentrantReadWriteLock() {
    this(true);
  }

  /// Returns an AutoCloseable read lock guard. Usage:
  /// <pre>
  /// try (var ignored = guardedLock.readLock()) {
  ///   // read operations here
  /// }
  /// </pre>
  LockGuard readLock() {
    return new LockGuard(lock.readLock());
  }

  /// Returns an AutoCloseable write lock guard.
  LockGuard writeLock() {
    return new LockGuard(lock.writeLock());
  }

  boolean isWriteLockedByCurrentThread() {
    return lock.isWriteLockedByCurrentThread();
  }

  /// A lock guard that automatically releases the lock when closed.
  static final class LockGuard implements AutoCloseable {
    private final Lock lock;

    LockGuard(Lock lock) {
      this.lock = lock;
      lock.lock();
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
