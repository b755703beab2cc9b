package com.datalens.analytics.service.storage;

import static com.datalens.analytics.fixtures.TestFixtures.completeDataset;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datalens.analytics.model.CleaningResult;
import com.datalens.analytics.model.Dataset;

class DatasetSessionStoreTest {

  private DatasetSessionStore store;

  @BeforeEach
  void setUp() {
    store = new DatasetSessionStore();
  }

  @Test
  void shouldStoreRawDataUnderGeneratedId() {
    Dataset raw = completeDataset(3, 2);

    DatasetSession session = store.store("sales.csv", raw);

    assertThat(session.getDatasetId()).isNotBlank();
    assertThat(session.isCleaned()).isFalse();
    assertThat(session.currentDataset()).isSameAs(raw);
    assertThat(store.getSession(session.getDatasetId())).isEqualTo(session);
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void shouldReturnNullForUnknownId() {
    assertThat(store.getSession("missing")).isNull();
    assertThat(store.attachCleaning("missing", cleaningOf(Dataset.empty()))).isNull();
    assertThat(store.deleteSession("missing")).isFalse();
  }

  @Test
  void shouldMakeCleanedDataCurrentAndKeepRawData() {
    Dataset raw = completeDataset(3, 2);
    Dataset cleaned = completeDataset(2, 2);
    DatasetSession session = store.store("sales.csv", raw);

    DatasetSession updated = store.attachCleaning(session.getDatasetId(), cleaningOf(cleaned));

    assertThat(updated.isCleaned()).isTrue();
    assertThat(updated.currentDataset()).isSameAs(cleaned);
    assertThat(updated.getRawData()).isSameAs(raw);
    assertThat(updated.getCreatedAt()).isEqualTo(session.getCreatedAt());
    assertThat(store.getSession(session.getDatasetId())).isEqualTo(updated);
  }

  @Test
  void shouldListSessionsInCreationOrder() {
    DatasetSession first = store.store("a.csv", completeDataset(1, 1));
    DatasetSession second = store.store("b.csv", completeDataset(1, 1));

    List<DatasetSession> all = store.getAllSessions();

    assertThat(all).extracting(DatasetSession::getSourceName).containsExactly("a.csv", "b.csv");
    assertThat(all.get(0).getCreatedAt()).isBeforeOrEqualTo(second.getCreatedAt());
    assertThat(first.getDatasetId()).isNotEqualTo(second.getDatasetId());
  }

  @Test
  void shouldDeleteSessions() {
    DatasetSession session = store.store("a.csv", completeDataset(1, 1));
    store.store("b.csv", completeDataset(1, 1));

    assertThat(store.deleteSession(session.getDatasetId())).isTrue();
    assertThat(store.size()).isEqualTo(1);

    store.clear();
    assertThat(store.size()).isZero();
  }

  private CleaningResult cleaningOf(Dataset cleaned) {
    return CleaningResult.builder()
        .cleanedData(cleaned)
        .reportLine("No significant cleaning required. Dataset structure is healthy.")
        .build();
  }
}
