package com.datalens.analytics.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered, immutable sequence of rows sharing one column schema. The schema is the column order
 * of the first row; every stage that enumerates columns uses this list, so rows whose own key
 * order differs are still read in schema order.
 */
public final class Dataset {

  private static final Dataset EMPTY = new Dataset(List.of(), List.of());

  private final List<String> columns;
  private final List<DataRow> rows;

  private Dataset(List<String> columns, List<DataRow> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  public static Dataset empty() {
    return EMPTY;
  }

  /** Builds a dataset whose schema is taken from the first row. */
  public static Dataset of(List<DataRow> rows) {
    if (rows == null || rows.isEmpty()) {
      return EMPTY;
    }
    return new Dataset(
        List.copyOf(rows.get(0).columnNames()), Collections.unmodifiableList(new ArrayList<>(rows)));
  }

  /** Builds a dataset with an explicit schema, used when a stage rebuilds rows of a known dataset. */
  public static Dataset of(List<String> columns, List<DataRow> rows) {
    if (rows == null || rows.isEmpty()) {
      return EMPTY;
    }
    return new Dataset(
        List.copyOf(columns), Collections.unmodifiableList(new ArrayList<>(rows)));
  }

  public List<String> getColumns() {
    return columns;
  }

  @JsonValue
  public List<DataRow> getRows() {
    return rows;
  }

  public DataRow getRow(int index) {
    return rows.get(index);
  }

  public int size() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** First {@code limit} rows, same schema. */
  public Dataset head(int limit) {
    if (limit >= rows.size()) {
      return this;
    }
    return of(columns, rows.subList(0, Math.max(0, limit)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Dataset)) {
      return false;
    }
    Dataset other = (Dataset) o;
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + rows.hashCode();
  }

  @Override
  public String toString() {
    return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
  }
}
