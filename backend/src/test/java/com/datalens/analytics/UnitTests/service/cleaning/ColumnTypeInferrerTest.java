package com.datalens.analytics.service.cleaning;

import static com.datalens.analytics.fixtures.TestFixtures.dataset;
import static com.datalens.analytics.fixtures.TestFixtures.rawRow;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.ValueType;

class ColumnTypeInferrerTest {

  private ColumnTypeInferrer inferrer;

  @BeforeEach
  void setUp() {
    inferrer = new ColumnTypeInferrer();
  }

  @Test
  void shouldUseFirstPresentValueToDecideType() {
    Dataset data =
        dataset(
            rawRow("amount", null, "name", ""),
            rawRow("amount", "", "name", "Ada"),
            rawRow("amount", 12, "name", 7),
            rawRow("amount", "n/a", "name", "Bob"));

    assertThat(inferrer.inferColumnType(data, "amount")).isEqualTo(ValueType.NUMBER);
    assertThat(inferrer.inferColumnType(data, "name")).isEqualTo(ValueType.TEXT);
  }

  @Test
  void shouldTreatColumnWithoutPresentValuesAsText() {
    Dataset data = dataset(rawRow("a", null, "b", 1), rawRow("a", "", "b", 2));

    assertThat(inferrer.inferColumnType(data, "a")).isEqualTo(ValueType.TEXT);
  }

  @Test
  void shouldTreatUnknownColumnAsText() {
    Dataset data = dataset(rawRow("a", 1));

    assertThat(inferrer.inferColumnType(data, "missing_column")).isEqualTo(ValueType.TEXT);
  }

  @Test
  void shouldInferEveryColumnInSchemaOrder() {
    Dataset data = dataset(rawRow("z", 1, "y", "text", "x", null));

    Map<String, ValueType> types = inferrer.inferColumnTypes(data);

    assertThat(types).containsOnlyKeys("z", "y", "x");
    assertThat(types.keySet()).containsExactly("z", "y", "x");
    assertThat(types.get("z")).isEqualTo(ValueType.NUMBER);
    assertThat(types.get("y")).isEqualTo(ValueType.TEXT);
    assertThat(types.get("x")).isEqualTo(ValueType.TEXT);
  }
}
