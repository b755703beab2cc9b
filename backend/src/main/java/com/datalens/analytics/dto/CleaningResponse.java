package com.datalens.analytics.dto;

import java.util.List;

import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.QualityReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CleaningResponse {

  @JsonProperty("dataset_id")
  private String datasetId;

  @JsonProperty("rows_before")
  private Integer rowsBefore;

  @JsonProperty("rows_after")
  private Integer rowsAfter;

  @JsonProperty("report")
  private List<String> report;

  @JsonProperty("duplicates_removed")
  private Integer duplicatesRemoved;

  @JsonProperty("values_imputed")
  private Integer valuesImputed;

  @JsonProperty("values_normalized")
  private Integer valuesNormalized;

  // Quality of the cleaned data
  @JsonProperty("quality")
  private QualityReport quality;

  // Full cleaned data for stateless calls, a preview for stored datasets
  @JsonProperty("data")
  private Dataset data;
}
