package com.datalens.analytics.IntegrationTests;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.datalens.analytics.dto.AnalysisSummary;
import com.datalens.analytics.model.Dataset;
import com.datalens.analytics.service.analysis.AnalysisClient;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Upload, clean, export and analyze through the HTTP API with only the analytics engine mocked. */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {"spring.profiles.active=test"})
@DisplayName("Dataset Workflow Integration Tests")
public class DatasetWorkflowIntegrationTest {

  private static final String MESSY_CSV =
      "id,name,score\n1, Ada ,9.5\n2,Bob,\n2,Bob,\n3,Cy,1e999999999\n";

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private AnalysisClient analysisClient;

  @Test
  @DisplayName("Should clean an uploaded CSV and export the cleaned rows")
  void shouldUploadCleanAndExport() throws Exception {
    String datasetId = upload(MESSY_CSV);

    mockMvc
        .perform(post("/api/datasets/{id}/clean", datasetId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rows_before").value(4))
        .andExpect(jsonPath("$.rows_after").value(3))
        .andExpect(jsonPath("$.duplicates_removed").value(1))
        .andExpect(jsonPath("$.values_normalized").value(0))
        .andExpect(jsonPath("$.values_imputed").value(1));

    mockMvc
        .perform(get("/api/datasets/{id}/export", datasetId))
        .andExpect(status().isOk())
        .andExpect(content().string("id,name,score\n1,Ada,9.5\n2,Bob,0\n3,Cy,1e999999999"));

    // a second clean starts again from the upload and gives the same result
    mockMvc
        .perform(post("/api/datasets/{id}/clean", datasetId))
        .andExpect(jsonPath("$.rows_after").value(3));
  }

  @Test
  @DisplayName("Should send the cleaned dataset to the analytics engine")
  void shouldAnalyzeCleanedDataset() throws Exception {
    AnalysisSummary summary = new AnalysisSummary();
    summary.setDiagnostic(new AnalysisSummary.Diagnostic("Scores track ids", null));
    when(analysisClient.analyze(any(Dataset.class))).thenReturn(summary);
    String datasetId = upload(MESSY_CSV);
    mockMvc.perform(post("/api/datasets/{id}/clean", datasetId)).andExpect(status().isOk());

    mockMvc
        .perform(post("/api/datasets/{id}/analyze", datasetId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.diagnostic.narrative").value("Scores track ids"));
  }

  @Test
  @DisplayName("Should refuse analysis of a mostly empty dataset")
  void shouldBlockRedDataset() throws Exception {
    MvcResult stored =
        mockMvc
            .perform(
                post("/api/datasets")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"name\":\"sparse\",\"data\":[{\"a\":1,\"b\":null},{\"a\":null,\"b\":\"\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.quality.status").value("red"))
            .andReturn();
    String datasetId = readDatasetId(stored);

    mockMvc
        .perform(post("/api/datasets/{id}/analyze", datasetId))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.quality.checks[0].status").value("fail"));
    verify(analysisClient, never()).analyze(any());
  }

  private String upload(String csv) throws Exception {
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "scores.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8));
    MvcResult result =
        mockMvc
            .perform(multipart("/api/datasets/upload").file(file))
            .andExpect(status().isOk())
            .andReturn();
    return readDatasetId(result);
  }

  private String readDatasetId(MvcResult result) throws Exception {
    String datasetId =
        objectMapper
            .readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8))
            .path("dataset_id")
            .asText();
    assertThat(datasetId).isNotBlank();
    return datasetId;
  }
}
