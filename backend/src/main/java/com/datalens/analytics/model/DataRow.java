package com.datalens.analytics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

/** One record of a {@link Dataset}: an ordered, immutable mapping from column name to value. */
public final class DataRow {

  private final Map<String, FieldValue> values;

  private DataRow(Map<String, FieldValue> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** Copies the given mapping, keeping its iteration order. Null values are stored as missing. */
  public static DataRow of(Map<String, FieldValue> values) {
    Map<String, FieldValue> copy = new LinkedHashMap<>();
    values.forEach((column, value) -> copy.put(column, value == null ? FieldValue.missing() : value));
    return new DataRow(copy);
  }

  /** Value for the column; an absent column reads as missing. */
  public FieldValue get(String column) {
    return values.getOrDefault(column, FieldValue.missing());
  }

  public Set<String> columnNames() {
    return values.keySet();
  }

  @JsonValue
  public Map<String, FieldValue> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataRow)) {
      return false;
    }
    return values.equals(((DataRow) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
