package com.datalens.analytics.exception;

import com.datalens.analytics.model.QualityReport;

/** Analysis refused because the dataset's quality status is red. */
public class AnalysisBlockedException extends RuntimeException {

  private final transient QualityReport qualityReport;

  public AnalysisBlockedException(QualityReport qualityReport) {
    super(
        "Dataset quality is too low for analysis (score "
            + qualityReport.getScore()
            + "). Clean the dataset or upload more complete data.");
    this.qualityReport = qualityReport;
  }

  public QualityReport getQualityReport() {
    return qualityReport;
  }
}
