package com.datalens.analytics.dto;

import java.time.LocalDateTime;

import com.datalens.analytics.model.QualityStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetSummary {

  @JsonProperty("dataset_id")
  private String datasetId;

  @JsonProperty("source_name")
  private String sourceName;

  @JsonProperty("row_count")
  private int rowCount;

  @JsonProperty("column_count")
  private int columnCount;

  @JsonProperty("quality_status")
  private QualityStatus qualityStatus;

  @JsonProperty("cleaned")
  private boolean cleaned;

  @JsonProperty("created_at")
  private LocalDateTime createdAt;
}
