package com.datalens.analytics.service.cleaning;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

/** Turns stage counts into the statements shown to whoever reviews a cleaning run. */
@Component
public class CleaningReportBuilder {

  static final String EMPTY_DATASET = "Empty dataset provided.";
  static final String NOTHING_TO_CLEAN =
      "No significant cleaning required. Dataset structure is healthy.";

  // Statement order is fixed: duplicates, missing values, normalization.
  public List<String> build(int duplicatesRemoved, int valuesImputed, int valuesNormalized) {
    List<String> report = new ArrayList<>();
    if (duplicatesRemoved > 0) {
      report.add(String.format("Removed %d duplicate records.", duplicatesRemoved));
    }
    if (valuesImputed > 0) {
      report.add(
          String.format("Handled %d missing or null values via imputation.", valuesImputed));
    }
    if (valuesNormalized > 0) {
      report.add(
          String.format("Normalized %d string entries (whitespace/casing).", valuesNormalized));
    }
    if (report.isEmpty()) {
      report.add(NOTHING_TO_CLEAN);
    }
    return report;
  }

  public List<String> emptyDataset() {
    return List.of(EMPTY_DATASET);
  }
}
