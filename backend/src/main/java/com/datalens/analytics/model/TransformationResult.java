package com.datalens.analytics.model;

import lombok.Value;

/** Output of a single cleaning stage: the new dataset and how many changes the stage made. */
@Value
public class TransformationResult {
  Dataset dataset;
  int changeCount;
}
