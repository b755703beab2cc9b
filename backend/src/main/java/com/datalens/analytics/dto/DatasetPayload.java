package com.datalens.analytics.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** JSON form of a dataset: an array of row objects, all sharing the first row's keys. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetPayload {

  @JsonProperty("name")
  private String name;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;
}
