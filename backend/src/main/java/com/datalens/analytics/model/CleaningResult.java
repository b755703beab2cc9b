package com.datalens.analytics.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A cleaned dataset paired with the ordered statements describing what cleaning changed. */
@Value
@Builder
public class CleaningResult {
  Dataset cleanedData;
  @Singular("reportLine") List<String> report;
  int duplicatesRemoved;
  int valuesImputed;
  int valuesNormalized;
}
