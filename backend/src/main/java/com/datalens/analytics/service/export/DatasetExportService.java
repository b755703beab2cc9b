package com.datalens.analytics.service.export;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.model.DataRow;
import com.datalens.analytics.model.Dataset;

import lombok.RequiredArgsConstructor;

/**
 * Writes a dataset as delimited text: one header line of column names, then one line per row.
 * Values are not quoted or escaped, so a value containing the separator shifts the columns of its
 * line.
 */
@Service
@RequiredArgsConstructor
public class DatasetExportService {

  private final DataLensProperties properties;

  public String export(Dataset dataset) {
    if (dataset == null || dataset.isEmpty()) {
      return "";
    }

    String separator = properties.getExport().getSeparator();
    List<String> lines = new ArrayList<>(dataset.size() + 1);
    lines.add(String.join(separator, dataset.getColumns()));
    for (DataRow row : dataset.getRows()) {
      List<String> cells = new ArrayList<>(dataset.columnCount());
      for (String column : dataset.getColumns()) {
        cells.add(row.get(column).render());
      }
      lines.add(String.join(separator, cells));
    }
    return String.join("\n", lines);
  }
}
