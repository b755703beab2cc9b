package com.datalens.analytics.service.analysis;

import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.datalens.analytics.config.DataLensProperties;
import com.datalens.analytics.dto.AnalysisRequest;
import com.datalens.analytics.dto.AnalysisSummary;
import com.datalens.analytics.exception.AnalysisRequestException;
import com.datalens.analytics.model.Dataset;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Client for the remote analytics engine. Sends the dataset in a single POST and maps any
 * non-success outcome to {@link AnalysisRequestException}. Failed calls are not retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisClient {

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final DataLensProperties properties;

  public AnalysisSummary analyze(Dataset dataset) {
    String url = endpointUrl();
    String body;
    try {
      body = objectMapper.writeValueAsString(new AnalysisRequest(dataset));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize dataset for analysis", e);
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    HttpEntity<String> entity = new HttpEntity<>(body, headers);

    log.info(
        "Requesting analysis from {} for {} rows x {} columns",
        url,
        dataset.size(),
        dataset.columnCount());

    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
    } catch (HttpStatusCodeException e) {
      log.error(
          "Analytics engine returned {}: {}",
          e.getStatusCode().value(),
          abbreviate(e.getResponseBodyAsString()));
      throw new AnalysisRequestException(e.getStatusCode().value(), e.getResponseBodyAsString());
    } catch (ResourceAccessException e) {
      log.error("Analytics engine unreachable at {}: {}", url, e.getMessage());
      throw new AnalysisRequestException(e.getMessage(), e);
    }

    String responseBody = response.getBody();
    if (responseBody == null || responseBody.isBlank()) {
      log.error("Analytics engine returned an empty body with status {}", response.getStatusCode());
      throw new AnalysisRequestException(response.getStatusCode().value(), null);
    }

    try {
      AnalysisSummary summary = objectMapper.readValue(responseBody, AnalysisSummary.class);
      log.info("Analysis received ({} chars)", responseBody.length());
      return summary;
    } catch (JsonProcessingException e) {
      log.error("Invalid response format from analytics engine: {}", abbreviate(responseBody));
      throw new AnalysisRequestException("Invalid response format from analytics engine", e);
    }
  }

  String endpointUrl() {
    DataLensProperties.Analysis analysis = properties.getAnalysis();
    String baseUrl = analysis.getBaseUrl();
    if (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    String path = analysis.getPath().startsWith("/") ? analysis.getPath() : "/" + analysis.getPath();
    return baseUrl + path;
  }

  private String abbreviate(String text) {
    if (text == null) {
      return null;
    }
    return text.length() > 500 ? text.substring(0, 500) + "…" : text;
  }
}
