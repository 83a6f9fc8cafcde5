package com.github.simbo1905.brs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A named table of string cells. Row 0 of the data is the first row after the header; the
/// header itself is described by the columns. A cell may be `null`.
public final class Sheet {

  private final String name;
  private final List<Column> columns;
  private final HeaderStyle headerStyle;
  private final List<List<String>> rows = new ArrayList<>();

  public Sheet(String name, List<Column> columns, HeaderStyle headerStyle) {
    this.name = Objects.requireNonNull(name, "name");
    this.columns = List.copyOf(columns);
    this.headerStyle = Objects.requireNonNull(headerStyle, "headerStyle");
  }

  public String name() {
    return name;
  }

  public List<Column> columns() {
    return columns;
  }

  public HeaderStyle headerStyle() {
    return headerStyle;
  }

  public int rowCount() {
    return rows.size();
  }

  public List<String> row(int index) {
    return Collections.unmodifiableList(rows.get(index));
  }

  public List<List<String>> rows() {
    return Collections.unmodifiableList(rows);
  }

  public void addRow(List<String> cells) {
    rows.add(new ArrayList<>(cells));
  }

  public void setRow(int index, List<String> cells) {
    rows.set(index, new ArrayList<>(cells));
  }

  public void removeRow(int index) {
    rows.remove(index);
  }

  /// Returns the cell or `null` when the row is shorter than the column.
  public String cell(int row, int column) {
    final var cells = rows.get(row);
    return column < cells.size() ? cells.get(column) : null;
  }

  public void setCell(int row, int column, String value) {
    final var cells = rows.get(row);
    while (cells.size() <= column) {
      cells.add(null);
    }
    cells.set(column, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Sheet)) return false;
    Sheet other = (Sheet) o;
    return name.equals(other.name)
        && columns.equals(other.columns)
        && headerStyle.equals(other.headerStyle)
        && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, columns, headerStyle, rows);
  }

  @Override
  public String toString() {
    return String.format("Sheet[name=%s, columns=%d, rows=%d]", name, columns.size(), rows.size());
  }
}
