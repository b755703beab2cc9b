package com.datalens.analytics.service.quality;

import lombok.Builder;
import lombok.Value;

/**
 * Policy knobs for {@link DataQualityAssessmentService}. Ratios are fractions of all cells; row
 * and column minimums are exclusive (a check passes only when the count is strictly greater).
 */
@Value
@Builder
public class QualityThresholds {

  @Builder.Default double completenessWarnRatio = 0.05;
  @Builder.Default double completenessFailRatio = 0.20;
  @Builder.Default int minRobustRows = 50;
  @Builder.Default int minDiverseColumns = 3;
  @Builder.Default int failPenalty = 40;
  @Builder.Default int warningPenalty = 15;

  public static QualityThresholds defaults() {
    return QualityThresholds.builder().build();
  }
}
