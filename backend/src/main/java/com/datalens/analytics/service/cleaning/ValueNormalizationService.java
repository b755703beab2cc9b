package com.datalens.analytics.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.TransformationResult;

/**
 * Canonicalizes text values by stripping leading and trailing whitespace. Numbers and missing
 * values pass through. Text that is only whitespace becomes missing.
 *
 * <p>Whitespace means ASCII controls TAB through CR, every Unicode space or line/paragraph
 * separator (including NBSP) and the byte order mark.
 */
@Component
public class ValueNormalizationService {

  public TransformationResult normalize(Dataset dataset) {
    List<String> columns = dataset.getColumns();
    List<DataRow> rows = new ArrayList<>(dataset.size());
    int changed = 0;

    for (DataRow row : dataset.getRows()) {
      Map<String, FieldValue> values = new LinkedHashMap<>();
      for (String column : columns) {
        FieldValue original = row.get(column);
        FieldValue normalized = normalize(original);
        if (!normalized.equals(original)) {
          changed++;
        }
        values.put(column, normalized);
      }
      rows.add(DataRow.of(values));
    }

    return new TransformationResult(Dataset.of(columns, rows), changed);
  }

  public FieldValue normalize(FieldValue value) {
    if (!value.isText()) {
      return value;
    }
    String stripped = trimWhitespace(value.asText());
    return stripped.equals(value.asText()) ? value : FieldValue.text(stripped);
  }

  public static String trimWhitespace(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(start, end);
  }

  private static boolean isWhitespace(char c) {
    return (c >= '\t' && c <= '\r') || c == '\uFEFF' || Character.isSpaceChar(c);
  }
}
