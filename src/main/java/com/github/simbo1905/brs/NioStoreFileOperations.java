package com.github.simbo1905.brs;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// [StoreFileOperations] over `java.nio.file.Files`.
final class NioStoreFileOperations implements StoreFileOperations {

  private static final Logger logger = Logger.getLogger(NioStoreFileOperations.class.getName());

  static final NioStoreFileOperations INSTANCE = new NioStoreFileOperations();

  @Override
  public boolean exists(Path path) {
    return Files.exists(path);
  }

  @Override
  public byte[] readAllBytes(Path path) throws IOException {
    return Files.readAllBytes(path);
  }

  @Override
  public void write(Path path, byte[] data) throws IOException {
    Files.write(
        path,
        data,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
  }

  @Override
  public void writeAtomically(Path path, byte[] data) throws IOException {
    final var directory = path.toAbsolutePath().getParent();
    final var temp = Files.createTempFile(directory, path.getFileName() + ".", ".tmp");
    try {
      Files.write(temp, data, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
      try {
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        logger.log(
            Level.FINE, () -> "atomic move not supported, falling back to replace for " + path);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public void copy(Path source, Path target) throws IOException {
    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
  }

  @Override
  public void delete(Path path) throws IOException {
    Files.delete(path);
  }

  @Override
  public long size(Path path) throws IOException {
    return Files.size(path);
  }

  @Override
  public FileTime lastModifiedTime(Path path) throws IOException {
    return Files.getLastModifiedTime(path);
  }

  @Override
  public List<Path> list(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (var entries = Files.list(directory)) {
      return entries.filter(Files::isRegularFile).collect(Collectors.toList());
    }
  }

  @Override
  public void createDirectories(Path directory) throws IOException {
    Files.createDirectories(directory);
  }
}
