package com.datalens.analytics.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.dto.AnalysisSummary;
import com.datalens.analytics.dto.CleaningResponse;
import com.datalens.analytics.dto.DatasetResponse;
import com.datalens.analytics.dto.DatasetSummary;
import com.datalens.analytics.exception.AnalysisBlockedException;
import com.datalens.analytics.exception.DatasetNotFoundException;
import com.datalens.analytics.model.CleaningResult;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.QualityReport;
import com.datalens.analytics.service.analysis.AnalysisClient;
import com.datalens.analytics.service.cleaning.DatasetCleaningService;
import com.datalens.analytics.service.export.DatasetExportService;
import com.datalens.analytics.service.ingestion.CsvDatasetParser;
import com.datalens.analytics.service.ingestion.DatasetConverter;
import com.datalens.analytics.service.quality.DataQualityAssessmentService;
import com.datalens.analytics.service.storage.DatasetSession;
import com.datalens.analytics.service.storage.DatasetSessionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Upload, clean, export and analyze lifecycle of a stored dataset. The dataset handed to export
 * and analysis is always the current one: cleaned if cleaning has run, raw otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetWorkflowService {

  static final String NOTHING_TO_ANALYZE = "No data available to analyze after cleaning.";

  private final CsvDatasetParser csvDatasetParser;
  private final DatasetConverter datasetConverter;
  private final DataQualityAssessmentService qualityAssessmentService;
  private final DatasetCleaningService cleaningService;
  private final DatasetExportService exportService;
  private final AnalysisClient analysisClient;
  private final DatasetSessionStore sessionStore;
  private final DataLensProperties properties;

  public DatasetResponse ingestCsv(String fileName, InputStream csvStream) throws IOException {
    Dataset dataset = csvDatasetParser.parse(csvStream);
    return ingest(fileName, dataset);
  }

  public DatasetResponse ingestRows(String name, List<Map<String, Object>> rows) {
    Dataset dataset = datasetConverter.toDataset(rows);
    if (dataset.isEmpty()) {
      throw new IllegalArgumentException("'data' must be a non-empty array.");
    }
    return ingest(name, dataset);
  }

  public DatasetResponse describe(String datasetId) {
    return toResponse(requireSession(datasetId));
  }

  public List<DatasetSummary> listDatasets() {
    return sessionStore.getAllSessions().stream()
        .map(this::toSummary)
        .collect(Collectors.toList());
  }

  /** Cleans the raw data of a stored dataset. Cleaning again starts over from the raw data. */
  public CleaningResponse clean(String datasetId) {
    DatasetSession session = requireSession(datasetId);
    CleaningResult result = cleaningService.clean(session.getRawData());

    DatasetSession updated = sessionStore.attachCleaning(datasetId, result);
    if (updated == null) {
      throw new DatasetNotFoundException(datasetId);
    }

    log.info("Dataset {} cleaned: {}", datasetId, result.getReport());
    return toCleaningResponse(
        datasetId,
        session.getRawData(),
        result,
        result.getCleanedData().head(properties.getUpload().getPreviewRows()));
  }

  public String export(String datasetId) {
    return exportService.export(requireSession(datasetId).currentDataset());
  }

  public AnalysisSummary analyze(String datasetId) {
    Dataset current = requireSession(datasetId).currentDataset();
    if (current.isEmpty()) {
      throw new IllegalArgumentException(NOTHING_TO_ANALYZE);
    }

    QualityReport quality = qualityAssessmentService.assess(current);
    if (quality.isBlocking() && properties.getAnalysis().isBlockOnRedQuality()) {
      log.warn("Analysis of dataset {} refused: quality score {}", datasetId, quality.getScore());
      throw new AnalysisBlockedException(quality);
    }

    return analysisClient.analyze(current);
  }

  public boolean delete(String datasetId) {
    return sessionStore.deleteSession(datasetId);
  }

  public void deleteAll() {
    sessionStore.clear();
  }

  public int datasetCount() {
    return sessionStore.size();
  }

  // Stateless operations over a dataset supplied in the request

  public QualityReport assessRows(List<Map<String, Object>> rows) {
    return qualityAssessmentService.assess(datasetConverter.toDataset(rows));
  }

  public CleaningResponse cleanRows(List<Map<String, Object>> rows) {
    Dataset dataset = datasetConverter.toDataset(rows);
    CleaningResult result = cleaningService.clean(dataset);
    return toCleaningResponse(null, dataset, result, result.getCleanedData());
  }

  private DatasetResponse ingest(String sourceName, Dataset dataset) {
    DatasetSession session = sessionStore.store(sourceName, dataset);
    DatasetResponse response = toResponse(session);
    log.info(
        "Ingested dataset {} from {}: {} rows, {} columns, quality {} ({})",
        session.getDatasetId(),
        sourceName,
        dataset.size(),
        dataset.columnCount(),
        response.getQuality().getStatus(),
        response.getQuality().getScore());
    return response;
  }

  private DatasetSession requireSession(String datasetId) {
    DatasetSession session = sessionStore.getSession(datasetId);
    if (session == null) {
      throw new DatasetNotFoundException(datasetId);
    }
    return session;
  }

  private DatasetResponse toResponse(DatasetSession session) {
    Dataset current = session.currentDataset();
    return DatasetResponse.builder()
        .datasetId(session.getDatasetId())
        .sourceName(session.getSourceName())
        .rowCount(current.size())
        .columns(session.getRawData().getColumns())
        .quality(qualityAssessmentService.assess(current))
        .preview(current.head(properties.getUpload().getPreviewRows()))
        .cleaned(session.isCleaned())
        .cleaningReport(session.isCleaned() ? session.getCleaning().getReport() : null)
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .build();
  }

  private DatasetSummary toSummary(DatasetSession session) {
    Dataset current = session.currentDataset();
    return DatasetSummary.builder()
        .datasetId(session.getDatasetId())
        .sourceName(session.getSourceName())
        .rowCount(current.size())
        .columnCount(session.getRawData().columnCount())
        .qualityStatus(qualityAssessmentService.assess(current).getStatus())
        .cleaned(session.isCleaned())
        .createdAt(session.getCreatedAt())
        .build();
  }

  private CleaningResponse toCleaningResponse(
      String datasetId, Dataset raw, CleaningResult result, Dataset data) {
    return CleaningResponse.builder()
        .datasetId(datasetId)
        .rowsBefore(raw.size())
        .rowsAfter(result.getCleanedData().size())
        .report(result.getReport())
        .duplicatesRemoved(result.getDuplicatesRemoved())
        .valuesImputed(result.getValuesImputed())
        .valuesNormalized(result.getValuesNormalized())
        .quality(qualityAssessmentService.assess(result.getCleanedData()))
        .data(data)
        .build();
  }
}
