package com.datalens.analytics.exception;

public class DatasetNotFoundException extends ResourceNotFoundException {

  public DatasetNotFoundException(String datasetId) {
    super("Dataset not found: " + datasetId);
  }
}
