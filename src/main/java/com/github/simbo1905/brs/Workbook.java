package com.github.simbo1905.brs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An ordered set of uniquely named sheets; the in-memory form of one store, export or archive file.
public final class Workbook {

  private final List<Sheet> sheets = new ArrayList<>();

  public Sheet addSheet(Sheet sheet) {
    if (findSheet(sheet.name()).isPresent()) {
      throw new IllegalArgumentException("Sheet exists: " + sheet.name());
    }
    sheets.add(sheet);
    return sheet;
  }

  public Optional<Sheet> findSheet(String name) {
    return sheets.stream().filter(s -> s.name().equals(name)).findFirst();
  }

  /// @throws IllegalStateException if there is no sheet with that name
  public Sheet sheet(String name) {
    return findSheet(name)
        .orElseThrow(() -> new IllegalStateException("Workbook has no sheet named " + name));
  }

  public List<Sheet> sheets() {
    return Collections.unmodifiableList(sheets);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Workbook && sheets.equals(((Workbook) o).sheets));
  }

  @Override
  public int hashCode() {
    return Objects.hash(sheets);
  }

  @Override
  public String toString() {
    return "Workbook" + sheets;
  }
}
