package com.datalens.analytics.service.cleaning;

import static com.datalens.analytics.fixtures.TestFixtures.dataset;
import static com.datalens.analytics.fixtures.TestFixtures.rawRow;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.TransformationResult;

class DeduplicationServiceTest {

  private DeduplicationService deduplicationService;

  @BeforeEach
  void setUp() {
    deduplicationService = new DeduplicationService();
  }

  @Test
  void shouldKeepFirstOccurrenceAndPreserveOrder() {
    Dataset data =
        dataset(
            rawRow("id", 1, "name", "a"),
            rawRow("id", 2, "name", "b"),
            rawRow("id", 1, "name", "a"),
            rawRow("id", 3, "name", "c"),
            rawRow("id", 2, "name", "b"));

    TransformationResult result = deduplicationService.removeDuplicates(data);

    assertThat(result.getChangeCount()).isEqualTo(2);
    assertThat(result.getDataset().getRows())
        .extracting(row -> row.get("id"))
        .containsExactly(FieldValue.number(1), FieldValue.number(2), FieldValue.number(3));
  }

  @Test
  void shouldNotMergeRowsThatDifferInOneColumn() {
    Dataset data = dataset(rawRow("id", 1, "name", "a"), rawRow("id", 1, "name", "a "));

    TransformationResult result = deduplicationService.removeDuplicates(data);

    assertThat(result.getChangeCount()).isZero();
    assertThat(result.getDataset().size()).isEqualTo(2);
  }

  @Test
  void shouldDistinguishNumberFromTextWithSameDigits() {
    Dataset data = dataset(rawRow("code", 7), rawRow("code", "7"));

    assertThat(deduplicationService.removeDuplicates(data).getChangeCount()).isZero();
  }

  @Test
  void shouldTreatAllMissingEncodingsAsEqual() {
    Dataset data =
        dataset(rawRow("a", 1, "b", null), rawRow("a", 1, "b", ""), rawRow("a", 1));

    TransformationResult result = deduplicationService.removeDuplicates(data);

    assertThat(result.getChangeCount()).isEqualTo(2);
    assertThat(result.getDataset().size()).isEqualTo(1);
  }

  @Test
  void shouldCompareRowsByColumnOrderNotKeyOrder() {
    Dataset data = dataset(rawRow("a", 1, "b", "x"), rawRow("b", "x", "a", 1));

    assertThat(deduplicationService.removeDuplicates(data).getChangeCount()).isEqualTo(1);
  }

  @Test
  void shouldTreatNumericScaleAsIrrelevant() {
    Dataset data = dataset(rawRow("v", 1), rawRow("v", 1.0));

    assertThat(deduplicationService.removeDuplicates(data).getChangeCount()).isEqualTo(1);
  }

  @Test
  void shouldLeaveInputDatasetUntouched() {
    Dataset data = dataset(rawRow("a", 1), rawRow("a", 1));

    deduplicationService.removeDuplicates(data);

    assertThat(data.size()).isEqualTo(2);
  }

  @Test
  void shouldCompareCanonicalFormButKeepFirstRowAsIs() {
    Dataset data = dataset(rawRow("a", "x ", "b", 1), rawRow("a", "x", "b", 1));

    TransformationResult result =
        deduplicationService.removeDuplicates(
            data,
            (column, value) -> value.isText() ? FieldValue.text(value.asText().strip()) : value);

    assertThat(result.getChangeCount()).isEqualTo(1);
    assertThat(result.getDataset().getRow(0).get("a")).isEqualTo(FieldValue.text("x "));
  }
}
