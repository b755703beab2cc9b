package com.datalens.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckStatus {
  PASS,
  WARNING,
  FAIL;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
