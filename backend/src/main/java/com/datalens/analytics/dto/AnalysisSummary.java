package com.datalens.analytics.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Narrative and chart payload produced by the remote analytics engine. Relayed to clients as-is;
 * only the top-level sections are typed and unknown fields are tolerated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisSummary {

  private BiOverview biOverview;
  private Descriptive descriptive;
  private Diagnostic diagnostic;
  private Predictive predictive;
  private Prescriptive prescriptive;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class BiOverview {
    private List<LabeledValue> composition;
    private List<NamedValue> trend;
    private List<CategoryValue> distribution;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class LabeledValue {
    private String label;
    private Double value;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class NamedValue {
    private String name;
    private Double value;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CategoryValue {
    private String category;
    private Double value;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Descriptive {
    private List<Kpi> kpis;
    private String narrative;
    private List<Object> chartData;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class Kpi {
    private String label;
    // number or preformatted text
    private Object value;
    private String change;
    private String trend;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Diagnostic {
    private String narrative;
    private List<Correlation> correlations;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Correlation {
    private String factor;
    private String relationship;
    private Double strength;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Predictive {
    private String narrative;
    private List<Object> forecast;
    private Double confidence;
    private String modelExplanation;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Prescriptive {
    private String narrative;
    private List<Recommendation> recommendations;
    private String disclaimer;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Recommendation {
    private String action;
    private String impact;
    private String priority;
  }
}
