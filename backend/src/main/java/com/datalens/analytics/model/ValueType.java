package com.datalens.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Variant tag of a {@link FieldValue}. Column inference only ever yields NUMBER or TEXT. */
public enum ValueType {
  NUMBER,
  TEXT,
  MISSING;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
