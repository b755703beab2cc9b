package com.datalens.analytics.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.datalens.analytics.dto.CleaningResponse;
import com.datalens.analytics.dto.DatasetPayload;
import com.datalens.analytics.model.QualityReport;
import com.datalens.analytics.service.DatasetWorkflowService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Stateless assessment and cleaning of a dataset sent in the request body. Nothing is stored. */
@Slf4j
@RestController
@RequestMapping("/api/quality")
@RequiredArgsConstructor
@Tag(name = "Quality", description = "Stateless quality assessment and cleaning")
public class QualityController {

  private final DatasetWorkflowService workflowService;

  @PostMapping(
      value = "/assess",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Assess dataset quality",
      description = "Completeness, robustness and feature diversity checks with a 0-100 score")
  public ResponseEntity<QualityReport> assess(@Valid @RequestBody DatasetPayload payload) {
    log.debug("Assessing {} rows", payload.getData().size());
    return ResponseEntity.ok(workflowService.assessRows(payload.getData()));
  }

  @PostMapping(
      value = "/clean",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Clean a dataset",
      description = "Returns the cleaned rows together with the cleaning report")
  public ResponseEntity<CleaningResponse> clean(@Valid @RequestBody DatasetPayload payload) {
    log.debug("Cleaning {} rows", payload.getData().size());
    return ResponseEntity.ok(workflowService.cleanRows(payload.getData()));
  }
}
