package com.datalens.analytics.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CleaningReportBuilderTest {

  private final CleaningReportBuilder builder = new CleaningReportBuilder();

  @Test
  void shouldListNonZeroCountsInFixedOrder() {
    assertThat(builder.build(2, 5, 1))
        .containsExactly(
            "Removed 2 duplicate records.",
            "Handled 5 missing or null values via imputation.",
            "Normalized 1 string entries (whitespace/casing).");
  }

  @Test
  void shouldSkipZeroCounts() {
    assertThat(builder.build(0, 3, 0))
        .containsExactly("Handled 3 missing or null values via imputation.");
  }

  @Test
  void shouldReportHealthyDatasetWhenNothingChanged() {
    assertThat(builder.build(0, 0, 0))
        .containsExactly("No significant cleaning required. Dataset structure is healthy.");
  }
}
