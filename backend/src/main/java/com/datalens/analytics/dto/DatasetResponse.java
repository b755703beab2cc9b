package com.datalens.analytics.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.QualityReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Current state of a stored dataset, as returned after upload and on lookup. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetResponse {

  @JsonProperty("dataset_id")
  private String datasetId;

  @JsonProperty("source_name")
  private String sourceName;

  @JsonProperty("row_count")
  private Integer rowCount;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("quality")
  private QualityReport quality;

  @JsonProperty("preview")
  private Dataset preview;

  @JsonProperty("cleaned")
  private Boolean cleaned;

  @JsonProperty("cleaning_report")
  private List<String> cleaningReport;

  @JsonProperty("created_at")
  private LocalDateTime createdAt;

  @JsonProperty("updated_at")
  private LocalDateTime updatedAt;
}
