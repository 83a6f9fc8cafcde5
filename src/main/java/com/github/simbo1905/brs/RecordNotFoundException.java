package com.github.simbo1905.brs;

/// No live row has the given id.
public class RecordNotFoundException extends IllegalArgumentException {

  private final String id;

  public RecordNotFoundException(String id) {
    super("Submission not found: " + id);
    this.id = id;
  }

  public String getId() {
    return id;
  }
}
