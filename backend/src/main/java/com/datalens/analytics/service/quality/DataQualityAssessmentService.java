package com.datalens.analytics.service.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.model.CheckStatus;
import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.QualityCheck;
import com.datalens.analytics.model.QualityReport;
import com.datalens.analytics.model.QualityStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Scores a dataset's fitness for analysis. Three independent checks run in a fixed order
 * (completeness, robustness, feature diversity) and are folded into a 0-100 score and a
 * traffic-light status.
 *
 * <p>The assessment is informational. Whether a red report blocks analysis is decided by the
 * caller.
 */
@Slf4j
@Service
public class DataQualityAssessmentService {

  static final String COMPLETENESS = "Completeness";
  static final String ROBUSTNESS = "Robustness";
  static final String FEATURE_DIVERSITY = "Feature Diversity";

  private final QualityThresholds thresholds;

  @Autowired
  public DataQualityAssessmentService(DataLensProperties properties) {
    this(properties.getQuality().toThresholds());
  }

  public DataQualityAssessmentService(QualityThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public QualityReport assess(Dataset dataset) {
    if (dataset == null || dataset.isEmpty()) {
      return QualityReport.empty();
    }

    List<QualityCheck> checks = new ArrayList<>(3);
    checks.add(checkCompleteness(dataset));
    checks.add(checkRobustness(dataset));
    checks.add(checkFeatureDiversity(dataset));

    long failCount = checks.stream().filter(c -> c.getStatus() == CheckStatus.FAIL).count();
    long warningCount = checks.stream().filter(c -> c.getStatus() == CheckStatus.WARNING).count();

    QualityStatus status = QualityStatus.GREEN;
    if (failCount > 0) {
      status = QualityStatus.RED;
    } else if (warningCount > 1) {
      status = QualityStatus.YELLOW;
    }

    long penalty =
        failCount * thresholds.getFailPenalty() + warningCount * thresholds.getWarningPenalty();
    int score = (int) Math.max(0, 100 - penalty);

    log.debug(
        "Quality assessment: rows={}, columns={}, score={}, status={}",
        dataset.size(),
        dataset.columnCount(),
        score,
        status);

    return QualityReport.builder().score(score).status(status).checks(checks).build();
  }

  QualityCheck checkCompleteness(Dataset dataset) {
    double missingRatio = missingRatio(dataset);
    CheckStatus status;
    if (missingRatio < thresholds.getCompletenessWarnRatio()) {
      status = CheckStatus.PASS;
    } else if (missingRatio < thresholds.getCompletenessFailRatio()) {
      status = CheckStatus.WARNING;
    } else {
      status = CheckStatus.FAIL;
    }
    return QualityCheck.builder()
        .name(COMPLETENESS)
        .status(status)
        .message(String.format(Locale.ROOT, "%.1f%% missing data.", missingRatio * 100))
        .build();
  }

  QualityCheck checkRobustness(Dataset dataset) {
    int rowCount = dataset.size();
    return QualityCheck.builder()
        .name(ROBUSTNESS)
        .status(rowCount > thresholds.getMinRobustRows() ? CheckStatus.PASS : CheckStatus.WARNING)
        .message(rowCount + " rows detected.")
        .build();
  }

  QualityCheck checkFeatureDiversity(Dataset dataset) {
    int columnCount = dataset.columnCount();
    return QualityCheck.builder()
        .name(FEATURE_DIVERSITY)
        .status(
            columnCount > thresholds.getMinDiverseColumns()
                ? CheckStatus.PASS
                : CheckStatus.WARNING)
        .message(columnCount + " columns identified.")
        .build();
  }

  /** Fraction of all cells (rows x schema columns) that are missing. */
  public double missingRatio(Dataset dataset) {
    long cells = (long) dataset.size() * dataset.columnCount();
    if (cells == 0) {
      return 0.0;
    }
    long missing = 0;
    for (DataRow row : dataset.getRows()) {
      for (String column : dataset.getColumns()) {
        if (row.get(column).isMissing()) {
          missing++;
        }
      }
    }
    return (double) missing / cells;
  }
}
