package com.datalens.analytics.service.ingestion;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;

/**
 * Boundary between loosely typed row maps (deserialized JSON, parsed CSV) and {@link Dataset}.
 * Absent keys, {@code null} and empty strings all become {@link FieldValue#missing()} here.
 */
@Component
public class DatasetConverter {

  public Dataset toDataset(List<?> rawRows) {
    if (rawRows == null || rawRows.isEmpty()) {
      return Dataset.empty();
    }

    List<String> columns = null;
    List<DataRow> rows = new ArrayList<>(rawRows.size());
    for (int i = 0; i < rawRows.size(); i++) {
      Object rawRow = rawRows.get(i);
      if (!(rawRow instanceof Map)) {
        throw new IllegalArgumentException("Row " + i + " is not an object");
      }
      Map<?, ?> rawMap = (Map<?, ?>) rawRow;
      if (columns == null) {
        columns = new ArrayList<>();
        for (Object key : rawMap.keySet()) {
          columns.add(String.valueOf(key));
        }
      }
      rows.add(toRow(rawMap, columns));
    }
    return Dataset.of(columns, rows);
  }

  public FieldValue toFieldValue(Object raw) {
    if (raw == null) {
      return FieldValue.missing();
    }
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return FieldValue.number(((Number) raw).longValue());
    }
    if (raw instanceof Number) {
      // BigDecimal and BigInteger included: values are held at double range and precision
      double number = ((Number) raw).doubleValue();
      if (!Double.isFinite(number)) {
        return FieldValue.text(raw.toString());
      }
      return FieldValue.number(BigDecimal.valueOf(number));
    }
    return FieldValue.text(raw.toString());
  }

  public List<Map<String, Object>> toRawRows(Dataset dataset) {
    List<Map<String, Object>> rawRows = new ArrayList<>(dataset.size());
    for (DataRow row : dataset.getRows()) {
      Map<String, Object> rawRow = new LinkedHashMap<>();
      for (String column : dataset.getColumns()) {
        rawRow.put(column, row.get(column).toRaw());
      }
      rawRows.add(rawRow);
    }
    return rawRows;
  }

  // Keys outside the schema are dropped; schema columns absent from this row read as missing.
  private DataRow toRow(Map<?, ?> rawMap, List<String> columns) {
    Map<String, FieldValue> values = new LinkedHashMap<>();
    for (String column : columns) {
      values.put(column, toFieldValue(rawMap.get(column)));
    }
    return DataRow.of(values);
  }
}
