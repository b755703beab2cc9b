package com.datalens.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Traffic-light status of a {@link QualityReport}. */
public enum QualityStatus {
  GREEN,
  YELLOW,
  RED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
