package com.github.simbo1905.brs;

import java.nio.file.NoSuchFileException;

/// A restore named a backup that does not exist in the backup directory.
public class BackupNotFoundException extends NoSuchFileException {

  public BackupNotFoundException(String backupName) {
    super(backupName, null, "Backup not found");
  }
}
