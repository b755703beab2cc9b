package com.datalens.analytics.service.ingestion;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.model.FieldValue;
import com.datalens.analytics.service.cleaning.ValueNormalizationService;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads an uploaded CSV file into a {@link Dataset}. The first non-blank line is the header.
 * Cells are trimmed; a cell that parses as a finite double becomes a number, an empty cell
 * becomes missing, anything else is text.
 */
@Slf4j
@Service
public class CsvDatasetParser {

  static final String EMPTY_FILE_MESSAGE = "File is empty or missing headers.";

  public Dataset parse(InputStream csvStream) throws IOException {
    List<String> headers = null;
    List<DataRow> rows = new ArrayList<>();
    int paddedRows = 0;

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] line;
      while ((line = reader.readNext()) != null) {
        if (isBlank(line)) {
          continue;
        }
        if (headers == null) {
          headers = readHeaders(line);
          continue;
        }
        if (line.length < headers.size()) {
          paddedRows++;
        }
        rows.add(toRow(headers, line));
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }

    if (headers == null || rows.isEmpty()) {
      throw new IllegalArgumentException(EMPTY_FILE_MESSAGE);
    }
    if (paddedRows > 0) {
      log.debug("{} rows had fewer cells than the header and were padded as missing", paddedRows);
    }

    log.info("Parsed CSV with {} columns and {} rows", headers.size(), rows.size());
    return Dataset.of(headers, rows);
  }

  FieldValue parseCell(String cell) {
    if (cell == null) {
      return FieldValue.missing();
    }
    String trimmed = ValueNormalizationService.trimWhitespace(cell);
    if (trimmed.isEmpty()) {
      return FieldValue.missing();
    }
    double number;
    try {
      number = new BigDecimal(trimmed).doubleValue();
    } catch (NumberFormatException e) {
      return FieldValue.text(trimmed);
    }
    // Out of double range, e.g. 1e999999999, stays text
    return Double.isFinite(number)
        ? FieldValue.number(BigDecimal.valueOf(number))
        : FieldValue.text(trimmed);
  }

  private List<String> readHeaders(String[] line) {
    List<String> headers = new ArrayList<>(line.length);
    for (String header : line) {
      String name = header == null ? "" : ValueNormalizationService.trimWhitespace(header);
      if (headers.contains(name)) {
        throw new IllegalArgumentException("Duplicate column name in header: " + name);
      }
      headers.add(name);
    }
    return headers;
  }

  private DataRow toRow(List<String> headers, String[] line) {
    Map<String, FieldValue> values = new LinkedHashMap<>();
    for (int i = 0; i < headers.size(); i++) {
      values.put(headers.get(i), i < line.length ? parseCell(line[i]) : FieldValue.missing());
    }
    return DataRow.of(values);
  }

  private boolean isBlank(String[] line) {
    for (String cell : line) {
      if (cell != null && !ValueNormalizationService.trimWhitespace(cell).isEmpty()) {
        return false;
      }
    }
    return true;
  }
}
