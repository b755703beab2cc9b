package com.datalens.analytics.service.cleaning;

import java.util.Map;

import org.springframework.stereotype.Service;

import com.datalens.analytics.model.CleaningResult;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.TransformationResult;
import com.datalens.analytics.model.ValueType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the cleaning stages in their fixed order: deduplicate, normalize, impute, then report. The
 * input dataset is never modified; an empty dataset yields an empty result rather than an error.
 *
 * <p>Rows are deduplicated on the values they will have once normalized and imputed, so the
 * cleaned dataset holds no two equal rows and a second pass changes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetCleaningService {

  private final DeduplicationService deduplicationService;
  private final ValueNormalizationService normalizationService;
  private final ColumnTypeInferrer columnTypeInferrer;
  private final MissingValueImputationService imputationService;
  private final CleaningReportBuilder reportBuilder;

  public CleaningResult clean(Dataset dataset) {
    if (dataset == null || dataset.isEmpty()) {
      log.info("Cleaning skipped: empty dataset");
      return CleaningResult.builder()
          .cleanedData(Dataset.empty())
          .report(reportBuilder.emptyDataset())
          .build();
    }

    long startTime = System.currentTimeMillis();

    Map<String, ValueType> columnTypes =
        columnTypeInferrer.inferColumnTypes(normalizationService.normalize(dataset).getDataset());
    TransformationResult deduplicated =
        deduplicationService.removeDuplicates(
            dataset,
            (column, value) ->
                imputationService.fill(
                    normalizationService.normalize(value), columnTypes.get(column)));
    TransformationResult normalized = normalizationService.normalize(deduplicated.getDataset());
    TransformationResult imputed =
        imputationService.impute(normalized.getDataset(), columnTypes);

    CleaningResult result =
        CleaningResult.builder()
            .cleanedData(imputed.getDataset())
            .report(
                reportBuilder.build(
                    deduplicated.getChangeCount(),
                    imputed.getChangeCount(),
                    normalized.getChangeCount()))
            .duplicatesRemoved(deduplicated.getChangeCount())
            .valuesImputed(imputed.getChangeCount())
            .valuesNormalized(normalized.getChangeCount())
            .build();

    log.info(
        "Cleaned dataset in {} ms: rows {} -> {}, duplicates={}, imputed={}, normalized={}",
        System.currentTimeMillis() - startTime,
        dataset.size(),
        result.getCleanedData().size(),
        result.getDuplicatesRemoved(),
        result.getValuesImputed(),
        result.getValuesNormalized());
    log.debug("Inferred column types: {}", columnTypes);
    return result;
  }
}
