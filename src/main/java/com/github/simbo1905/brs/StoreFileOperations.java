package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

/// The filesystem calls made by the store, the backup manager and the archiver. Tests wrap the
/// default implementation to inject failures at a chosen call.
interface StoreFileOperations {

  boolean exists(Path path);

  byte[] readAllBytes(Path path) throws IOException;

  /// Writes the bytes in place, truncating any previous content.
  void write(Path path, byte[] data) throws IOException;

  /// Writes the bytes to a sibling temporary file and renames it over the target.
  void writeAtomically(Path path, byte[] data) throws IOException;

  /// Copies `source` over `target`, replacing it.
  void copy(Path source, Path target) throws IOException;

  void delete(Path path) throws IOException;

  long size(Path path) throws IOException;

  FileTime lastModifiedTime(Path path) throws IOException;

  /// Regular files directly inside the directory; empty when the directory does not exist.
  List<Path> list(Path directory) throws IOException;

  void createDirectories(Path directory) throws IOException;
}
