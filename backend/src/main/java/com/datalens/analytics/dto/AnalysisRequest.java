package com.datalens.analytics.dto;

import com.datalens.analytics.model.Dataset;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body sent to the analytics engine: {@code {"data": [ {...}, ... ]}}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
  private Dataset data;
}
