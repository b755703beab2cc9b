package com.datalens.analytics.service.storage;

import java.time.LocalDateTime;

import com.datalens.analytics.model.CleaningResult;
import com.datalens.analytics.model.Dataset;

import lombok.Builder;
import lombok.Value;

/**
 * State of one uploaded dataset: the raw data as ingested and, once cleaning has run, its result.
 * Sessions are replaced on change, never modified.
 */
@Value
@Builder(toBuilder = true)
public class DatasetSession {
  String datasetId;
  String sourceName;
  Dataset rawData;
  CleaningResult cleaning;
  LocalDateTime createdAt;
  LocalDateTime updatedAt;

  public boolean isCleaned() {
    return cleaning != null;
  }

  /** Cleaned data when cleaning has run, otherwise the raw data. */
  public Dataset currentDataset() {
    return isCleaned() ? cleaning.getCleanedData() : rawData;
  }
}
