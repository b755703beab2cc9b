package com.datalens.analytics.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.TransformationResult;
import com.datalens.analytics.model.ValueType;

import lombok.RequiredArgsConstructor;

/**
 * Replaces every missing value with its column's default: a numeric placeholder for number
 * columns, a text placeholder for everything else.
 */
@Component
@RequiredArgsConstructor
public class MissingValueImputationService {

  private final DataLensProperties properties;

  /**
   * @param columnTypes inferred type per column, see {@link ColumnTypeInferrer#inferColumnTypes}
   */
  public TransformationResult impute(Dataset dataset, Map<String, ValueType> columnTypes) {
    List<String> columns = dataset.getColumns();
    List<DataRow> rows = new ArrayList<>(dataset.size());
    int imputed = 0;

    for (DataRow row : dataset.getRows()) {
      Map<String, FieldValue> values = new LinkedHashMap<>();
      for (String column : columns) {
        FieldValue value = row.get(column);
        if (value.isMissing()) {
          imputed++;
        }
        values.put(column, fill(value, columnTypes.get(column)));
      }
      rows.add(DataRow.of(values));
    }

    return new TransformationResult(Dataset.of(columns, rows), imputed);
  }

  /** The value itself, or its column's placeholder when missing. Untyped columns count as text. */
  public FieldValue fill(FieldValue value, ValueType columnType) {
    return value.isMissing() ? placeholderFor(columnType) : value;
  }

  FieldValue placeholderFor(ValueType columnType) {
    DataLensProperties.Cleaning cleaning = properties.getCleaning();
    return columnType == ValueType.NUMBER
        ? FieldValue.number(cleaning.getNumberPlaceholder())
        : FieldValue.text(cleaning.getTextPlaceholder());
  }
}
