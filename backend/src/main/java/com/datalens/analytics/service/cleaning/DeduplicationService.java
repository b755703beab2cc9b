package com.datalens.analytics.service.cleaning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

import org.springframework.stereotype.Component;

import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.model.TransformationResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Removes rows identical in every column, keeping the first occurrence. Rows are compared by
 * their values read in the dataset's column order, so key insertion order inside a row never
 * matters. Kept rows are returned unchanged even when compared in canonical form.
 */
@Slf4j
@Component
public class DeduplicationService {

  public TransformationResult removeDuplicates(Dataset dataset) {
    return removeDuplicates(dataset, (column, value) -> value);
  }

  /**
   * @param canonicalizer maps a column and its value to the form rows are compared in
   */
  public TransformationResult removeDuplicates(
      Dataset dataset, BiFunction<String, FieldValue, FieldValue> canonicalizer) {
    List<String> columns = dataset.getColumns();
    Set<List<FieldValue>> seen = new HashSet<>();
    List<DataRow> unique = new ArrayList<>(dataset.size());

    for (DataRow row : dataset.getRows()) {
      if (seen.add(canonicalKey(row, columns, canonicalizer))) {
        unique.add(row);
      }
    }

    int removed = dataset.size() - unique.size();
    log.debug("Deduplication kept {} of {} rows", unique.size(), dataset.size());
    return new TransformationResult(Dataset.of(columns, unique), removed);
  }

  private List<FieldValue> canonicalKey(
      DataRow row,
      List<String> columns,
      BiFunction<String, FieldValue, FieldValue> canonicalizer) {
    List<FieldValue> key = new ArrayList<>(columns.size());
    for (String column : columns) {
      key.add(canonicalizer.apply(column, row.get(column)));
    }
    return key;
  }
}
