package com.datalens.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QualityCheck {
  String name;
  CheckStatus status;
  String message;
}
