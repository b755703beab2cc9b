package com.datalens.analytics.service.storage;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.datalens.analytics.model.CleaningResult;
import com.datalens.analytics.model.Dataset;

import lombok.extern.slf4j.Slf4j;

/** In-memory registry of uploaded datasets keyed by a generated id. */
@Slf4j
@Service
public class DatasetSessionStore {

  private final Map<String, DatasetSession> sessions = new ConcurrentHashMap<>();

  public DatasetSession store(String sourceName, Dataset rawData) {
    String datasetId = UUID.randomUUID().toString();
    LocalDateTime now = LocalDateTime.now();

    DatasetSession session =
        DatasetSession.builder()
            .datasetId(datasetId)
            .sourceName(sourceName)
            .rawData(rawData)
            .createdAt(now)
            .updatedAt(now)
            .build();
    sessions.put(datasetId, session);

    log.debug("Stored dataset {} ({} rows) from {}", datasetId, rawData.size(), sourceName);
    return session;
  }

  /** Returns the session or {@code null} when the id is unknown. */
  public DatasetSession getSession(String datasetId) {
    return sessions.get(datasetId);
  }

  /**
   * Attaches a cleaning result, replacing any earlier one.
   *
   * @return the updated session, or {@code null} if the dataset was deleted meanwhile
   */
  public DatasetSession attachCleaning(String datasetId, CleaningResult cleaning) {
    return sessions.computeIfPresent(
        datasetId,
        (id, existing) ->
            existing.toBuilder().cleaning(cleaning).updatedAt(LocalDateTime.now()).build());
  }

  public List<DatasetSession> getAllSessions() {
    List<DatasetSession> all = new ArrayList<>(sessions.values());
    all.sort(Comparator.comparing(DatasetSession::getCreatedAt));
    return all;
  }

  public boolean deleteSession(String datasetId) {
    return sessions.remove(datasetId) != null;
  }

  public void clear() {
    sessions.clear();
  }

  public int size() {
    return sessions.size();
  }
}
