package com.datalens.analytics.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Aggregated fitness assessment of a dataset. Derived from a dataset and never stored apart from
 * it; recompute whenever the dataset changes.
 */
@Value
@Builder
public class QualityReport {

  private static final QualityReport EMPTY =
      QualityReport.builder().score(0).status(QualityStatus.RED).build();

  int score;
  QualityStatus status;
  @Singular List<QualityCheck> checks;

  /** Fixed report for a dataset with no rows. */
  public static QualityReport empty() {
    return EMPTY;
  }

  @JsonIgnore
  public boolean isBlocking() {
    return status == QualityStatus.RED;
  }
}
