package com.datalens.analytics.service.cleaning;

import static com.datalens.analytics.fixtures.TestFixtures.dataset;
import static com.datalens.analytics.fixtures.TestFixtures.rawRow;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.TransformationResult;
import com.datalens.analytics.model.ValueType;

class MissingValueImputationServiceTest {

  private DataLensProperties properties;
  private MissingValueImputationService imputationService;

  @BeforeEach
  void setUp() {
    properties = new DataLensProperties();
    imputationService = new MissingValueImputationService(properties);
  }

  @Test
  void shouldFillNumberColumnsWithZeroAndOthersWithPlaceholder() {
    Dataset data =
        dataset(rawRow("qty", null, "label", "x"), rawRow("qty", 4, "label", null));

    TransformationResult result =
        imputationService.impute(
            data, Map.of("qty", ValueType.NUMBER, "label", ValueType.TEXT));

    assertThat(result.getChangeCount()).isEqualTo(2);
    assertThat(result.getDataset().getRow(0).get("qty")).isEqualTo(FieldValue.number(0));
    assertThat(result.getDataset().getRow(1).get("label"))
        .isEqualTo(FieldValue.text("Unspecified"));
  }

  @Test
  void shouldDefaultToTextWhenColumnTypeUnknown() {
    Dataset data = dataset(rawRow("x", null));

    TransformationResult result = imputationService.impute(data, Map.of());

    assertThat(result.getDataset().getRow(0).get("x")).isEqualTo(FieldValue.text("Unspecified"));
  }

  @Test
  void shouldUseConfiguredPlaceholders() {
    properties.getCleaning().setTextPlaceholder("N/A");
    properties.getCleaning().setNumberPlaceholder(-1L);
    Dataset data = dataset(rawRow("n", null, "t", ""));

    TransformationResult result =
        imputationService.impute(data, Map.of("n", ValueType.NUMBER, "t", ValueType.TEXT));

    assertThat(result.getDataset().getRow(0).get("n")).isEqualTo(FieldValue.number(-1));
    assertThat(result.getDataset().getRow(0).get("t")).isEqualTo(FieldValue.text("N/A"));
  }

  @Test
  void shouldReportZeroWhenNothingIsMissing() {
    Dataset data = dataset(rawRow("a", 1, "b", "x"));

    TransformationResult result =
        imputationService.impute(data, Map.of("a", ValueType.NUMBER, "b", ValueType.TEXT));

    assertThat(result.getChangeCount()).isZero();
    assertThat(result.getDataset()).isEqualTo(data);
  }

  @Test
  void shouldFillOnlyMissingValues() {
    assertThat(imputationService.fill(FieldValue.missing(), ValueType.NUMBER))
        .isEqualTo(FieldValue.number(0));
    assertThat(imputationService.fill(FieldValue.missing(), null))
        .isEqualTo(FieldValue.text("Unspecified"));
    assertThat(imputationService.fill(FieldValue.text("x"), ValueType.NUMBER))
        .isEqualTo(FieldValue.text("x"));
  }
}
