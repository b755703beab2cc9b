package com.datalens.analytics.service.cleaning;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.ValueType;

/**
 * Decides the value type of a column from its data: the first row (in dataset order) holding a
 * present value determines the type. A column with no present value is treated as text.
 */
@Component
public class ColumnTypeInferrer {

  public ValueType inferColumnType(Dataset dataset, String column) {
    for (DataRow row : dataset.getRows()) {
      FieldValue value = row.get(column);
      if (!value.isMissing()) {
        return value.getType();
      }
    }
    return ValueType.TEXT;
  }

  /** One lookup table for all columns, so imputation never rescans the dataset per cell. */
  public Map<String, ValueType> inferColumnTypes(Dataset dataset) {
    Map<String, ValueType> types = new LinkedHashMap<>();
    for (String column : dataset.getColumns()) {
      types.put(column, inferColumnType(dataset, column));
    }
    return types;
  }
}
