package com.datalens.analytics.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;

import com.datalens.analytics.service.quality.QualityThresholds;

@SpringBootTest(classes = DataLensPropertiesTest.PropertiesConfig.class)
@TestPropertySource(
    properties = {
      "datalens.quality.completeness-warn-ratio=0.1",
      "datalens.quality.min-robust-rows=100",
      "datalens.cleaning.text-placeholder=N/A",
      "datalens.analysis.base-url=http://engine:7000",
      "datalens.analysis.block-on-red-quality=false",
      "datalens.upload.allowed-extensions=csv,tsv",
      "datalens.export.separator=;"
    })
class DataLensPropertiesTest {

  @Configuration
  @EnableConfigurationProperties(DataLensProperties.class)
  static class PropertiesConfig {}

  @Autowired private DataLensProperties properties;

  @Test
  void shouldBindConfiguredValues() {
    assertThat(properties.getQuality().getCompletenessWarnRatio()).isEqualTo(0.1);
    assertThat(properties.getQuality().getMinRobustRows()).isEqualTo(100);
    assertThat(properties.getCleaning().getTextPlaceholder()).isEqualTo("N/A");
    assertThat(properties.getAnalysis().getBaseUrl()).isEqualTo("http://engine:7000");
    assertThat(properties.getAnalysis().isBlockOnRedQuality()).isFalse();
    assertThat(properties.getUpload().getAllowedExtensions()).containsExactlyInAnyOrder("csv", "tsv");
    assertThat(properties.getExport().getSeparator()).isEqualTo(";");
  }

  @Test
  void shouldKeepDefaultsForUnsetValues() {
    assertThat(properties.getQuality().getCompletenessFailRatio()).isEqualTo(0.20);
    assertThat(properties.getQuality().getMinDiverseColumns()).isEqualTo(3);
    assertThat(properties.getAnalysis().getPath()).isEqualTo("/analyze");
    assertThat(properties.getAnalysis().getReadTimeoutMs()).isEqualTo(120000);
    assertThat(properties.getUpload().getPreviewRows()).isEqualTo(10);
  }

  @Test
  void shouldExposeQualityThresholds() {
    QualityThresholds thresholds = properties.getQuality().toThresholds();

    assertThat(thresholds.getCompletenessWarnRatio()).isEqualTo(0.1);
    assertThat(thresholds.getMinRobustRows()).isEqualTo(100);
    assertThat(thresholds.getFailPenalty()).isEqualTo(40);
  }
}
