package com.datalens.analytics.controller;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.dto.AnalysisSummary;
import com.datalens.analytics.dto.CleaningResponse;
import com.datalens.analytics.dto.DatasetPayload;
import com.datalens.analytics.dto.DatasetResponse;
import com.datalens.analytics.dto.DatasetSummary;
import com.datalens.analytics.service.DatasetWorkflowService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Datasets", description = "Upload, assess, clean, export and analyze datasets")
public class DatasetController {

  private final DatasetWorkflowService workflowService;
  private final DataLensProperties properties;

  @PostMapping(
      value = "/datasets/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a CSV dataset",
      description = "Parses an uploaded CSV file, stores it and returns its quality assessment")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Dataset stored and assessed",
            content = @Content(schema = @Schema(implementation = DatasetResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or request",
            content = @Content)
      })
  public ResponseEntity<DatasetResponse> uploadCsv(
      @Parameter(description = "CSV file with a header line", required = true)
          @RequestParam("file")
          MultipartFile file)
      throws IOException {
    validateFile(file);
    log.info("Received upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
    return ResponseEntity.ok(
        workflowService.ingestCsv(file.getOriginalFilename(), file.getInputStream()));
  }

  @PostMapping(
      value = "/datasets",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Submit a JSON dataset",
      description = "Stores an array of row objects and returns its quality assessment")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Dataset stored and assessed"),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<DatasetResponse> submitRows(@Valid @RequestBody DatasetPayload payload) {
    log.info(
        "Received JSON dataset {} with {} rows", payload.getName(), payload.getData().size());
    return ResponseEntity.ok(workflowService.ingestRows(payload.getName(), payload.getData()));
  }

  @GetMapping("/datasets")
  @Operation(summary = "List stored datasets")
  public ResponseEntity<List<DatasetSummary>> listDatasets() {
    return ResponseEntity.ok(workflowService.listDatasets());
  }

  @GetMapping("/datasets/{datasetId}")
  @Operation(
      summary = "Get a stored dataset",
      description = "Current state of a dataset: quality, preview and cleaning report if any")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Dataset found"),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<DatasetResponse> getDataset(@PathVariable String datasetId) {
    return ResponseEntity.ok(workflowService.describe(datasetId));
  }

  @PostMapping(value = "/datasets/{datasetId}/clean", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Clean a stored dataset",
      description =
          "Removes duplicate rows, trims text values and imputes missing values. The raw upload"
              + " is kept; export and analysis use the cleaned data from now on.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Dataset cleaned"),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<CleaningResponse> cleanDataset(@PathVariable String datasetId) {
    return ResponseEntity.ok(workflowService.clean(datasetId));
  }

  @GetMapping(value = "/datasets/{datasetId}/export", produces = "text/csv")
  @Operation(
      summary = "Export the current dataset",
      description = "Cleaned data when cleaning has run, otherwise the raw upload")
  public ResponseEntity<byte[]> exportDataset(@PathVariable String datasetId) {
    String content = workflowService.export(datasetId);
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(new MediaType("text", "csv", StandardCharsets.UTF_8));
    headers.setContentDisposition(
        ContentDisposition.attachment().filename(properties.getExport().getFileName()).build());
    return ResponseEntity.ok()
        .headers(headers)
        .body(content.getBytes(StandardCharsets.UTF_8));
  }

  @PostMapping(
      value = "/datasets/{datasetId}/analyze",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Analyze the current dataset",
      description = "Sends the current dataset to the analytics engine and relays its summary")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Analysis produced",
            content = @Content(schema = @Schema(implementation = AnalysisSummary.class))),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Dataset quality too low for analysis",
            content = @Content),
        @ApiResponse(
            responseCode = "502",
            description = "Analytics engine failed",
            content = @Content)
      })
  public ResponseEntity<AnalysisSummary> analyzeDataset(@PathVariable String datasetId) {
    return ResponseEntity.ok(workflowService.analyze(datasetId));
  }

  @DeleteMapping("/datasets/{datasetId}")
  @Operation(summary = "Delete a stored dataset")
  public ResponseEntity<Void> deleteDataset(@PathVariable String datasetId) {
    if (workflowService.delete(datasetId)) {
      log.info("Deleted dataset: {}", datasetId);
      return ResponseEntity.noContent().build();
    }
    log.warn("Dataset not found for deletion: {}", datasetId);
    return ResponseEntity.notFound().build();
  }

  @DeleteMapping("/datasets")
  @Operation(summary = "Delete all stored datasets")
  public ResponseEntity<Void> deleteAllDatasets() {
    workflowService.deleteAll();
    log.info("Deleted all stored datasets");
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/health")
  @Operation(summary = "Health check")
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(
        Map.of(
            "status", "UP",
            "datasets", workflowService.datasetCount(),
            "timestamp", System.currentTimeMillis()));
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    long maxFileSize = properties.getUpload().getMaxFileSize();
    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!properties.getUpload().getAllowedExtensions().contains(extension.toLowerCase())) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: "
              + properties.getUpload().getAllowedExtensions());
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
