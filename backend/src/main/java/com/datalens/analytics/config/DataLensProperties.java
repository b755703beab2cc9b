package com.datalens.analytics.config;

import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.datalens.analytics.service.quality.QualityThresholds;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "datalens")
public class DataLensProperties {

  private Quality quality = new Quality();
  private Cleaning cleaning = new Cleaning();
  private Analysis analysis = new Analysis();
  private Upload upload = new Upload();
  private Export export = new Export();

  @Data
  public static class Quality {
    private double completenessWarnRatio = 0.05;
    private double completenessFailRatio = 0.20;
    private int minRobustRows = 50;
    private int minDiverseColumns = 3;
    private int failPenalty = 40;
    private int warningPenalty = 15;

    public QualityThresholds toThresholds() {
      return QualityThresholds.builder()
          .completenessWarnRatio(completenessWarnRatio)
          .completenessFailRatio(completenessFailRatio)
          .minRobustRows(minRobustRows)
          .minDiverseColumns(minDiverseColumns)
          .failPenalty(failPenalty)
          .warningPenalty(warningPenalty)
          .build();
    }
  }

  @Data
  public static class Cleaning {
    private String textPlaceholder = "Unspecified";
    private long numberPlaceholder = 0;
  }

  @Data
  public static class Analysis {
    private String baseUrl = "http://127.0.0.1:5000";
    private String path = "/analyze";
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 120000;
    // Refuse to send a dataset whose quality status is red.
    private boolean blockOnRedQuality = true;
  }

  @Data
  public static class Upload {
    private long maxFileSize = 10485760;
    private Set<String> allowedExtensions = new LinkedHashSet<>(Set.of("csv"));
    private int previewRows = 10;
  }

  @Data
  public static class Export {
    private String separator = ",";
    private String fileName = "cleaned_analytics_dataset.csv";
  }
}
