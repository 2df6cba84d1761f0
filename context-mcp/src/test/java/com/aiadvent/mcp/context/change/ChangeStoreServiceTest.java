package com.aiadvent.mcp.context.change;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.mcp.context.analysis.FileType;
import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeStoreServiceTest {

  private static final String PROJECT = "project-1";

  private InMemoryFileRecordStore store;
  private ChangeStoreService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryFileRecordStore();
    service = new ChangeStoreService(store, new PatternSourceStructureExtractor());
  }

  @Test
  void modificationCounterOnlyGrowsOnHashChange() {
    assertThat(service.recordObservation(PROJECT, "/src/App.tsx", "a"))
        .isEqualTo(ChangeKind.CREATED);
    assertThat(service.recordObservation(PROJECT, "/src/App.tsx", "a"))
        .isEqualTo(ChangeKind.UNCHANGED);
    assertThat(service.recordObservation(PROJECT, "/src/App.tsx", "b"))
        .isEqualTo(ChangeKind.MODIFIED);
    assertThat(service.recordObservation(PROJECT, "/src/App.tsx", "c"))
        .isEqualTo(ChangeKind.MODIFIED);

    FileRecord record = service.records(PROJECT).get("/src/App.tsx");
    assertThat(record.modificationCount()).isEqualTo(3);
    assertThat(record.contentHash()).isEqualTo(ContentHashes.sha256("c"));
  }

  @Test
  void recordCapturesStructureOfContent() {
    service.recordObservation(
        PROJECT,
        "/src/hooks/useScore.ts",
        "import { useState } from 'react';\nexport function useScore() { return 1; }\n");

    FileRecord record = service.records(PROJECT).get("/src/hooks/useScore.ts");
    assertThat(record.fileType()).isEqualTo(FileType.HOOK);
    assertThat(record.exports()).containsExactly("useScore");
    assertThat(record.imports()).containsExactly("react");
  }

  @Test
  void diffPartitionsCurrentFilesWithoutWriting() {
    service.sync(PROJECT, Map.of("/a.ts", "1", "/b.ts", "2", "/gone.ts", "3"), false);

    Map<String, String> current = new LinkedHashMap<>();
    current.put("/a.ts", "1");
    current.put("/b.ts", "changed");
    current.put("/c.ts", "new");

    FileChangeSet diff = service.diff(PROJECT, current);

    assertThat(diff.created()).containsExactly("/c.ts");
    assertThat(diff.modified()).containsExactly("/b.ts");
    assertThat(diff.unchanged()).containsExactly("/a.ts");
    assertThat(diff.deleted()).isEmpty();
    assertThat(service.records(PROJECT)).containsOnlyKeys("/a.ts", "/b.ts", "/gone.ts");
    assertThat(service.records(PROJECT).get("/b.ts").modificationCount()).isEqualTo(1);
  }

  @Test
  void deletionSyncReportsAndRemovesMissingFiles() {
    service.sync(PROJECT, Map.of("/a.ts", "1", "/gone.ts", "3"), false);

    FileChangeSet preview = service.diff(PROJECT, Map.of("/a.ts", "1"), true);
    assertThat(preview.deleted()).containsExactly("/gone.ts");
    assertThat(service.records(PROJECT)).containsKey("/gone.ts");

    FileChangeSet synced = service.sync(PROJECT, Map.of("/a.ts", "1"), true);
    assertThat(synced.deleted()).containsExactly("/gone.ts");
    assertThat(service.records(PROJECT)).containsOnlyKeys("/a.ts");
  }

  @Test
  void syncWithoutDeletionKeepsAbsentRecords() {
    service.sync(PROJECT, Map.of("/a.ts", "1", "/b.ts", "2"), false);

    FileChangeSet result = service.sync(PROJECT, Map.of("/a.ts", "1"), false);

    assertThat(result.deleted()).isEmpty();
    assertThat(service.records(PROJECT)).containsOnlyKeys("/a.ts", "/b.ts");
  }

  @Test
  void resetRestartsCounters() {
    service.recordObservation(PROJECT, "/a.ts", "1");
    service.recordObservation(PROJECT, "/a.ts", "2");

    service.reset(PROJECT);

    assertThat(service.records(PROJECT)).isEmpty();
    assertThat(service.recordObservation(PROJECT, "/a.ts", "2")).isEqualTo(ChangeKind.CREATED);
    assertThat(service.records(PROJECT).get("/a.ts").modificationCount()).isEqualTo(1);
  }

  @Test
  void ordersFilesByModificationCount() {
    service.recordObservation(PROJECT, "/a.ts", "1");
    service.recordObservation(PROJECT, "/b.ts", "1");
    service.recordObservation(PROJECT, "/b.ts", "2");
    service.recordObservation(PROJECT, "/b.ts", "3");
    service.recordObservation(PROJECT, "/c.ts", "1");
    service.recordObservation(PROJECT, "/c.ts", "2");

    assertThat(service.filesByModificationCount(PROJECT))
        .containsExactly("/b.ts", "/c.ts", "/a.ts");
  }

  @Test
  void projectsAreIsolated() {
    service.recordObservation("other", "/a.ts", "1");

    assertThat(service.recordObservation(PROJECT, "/a.ts", "1")).isEqualTo(ChangeKind.CREATED);
  }

  @Test
  void rejectsBlankProjectAndNullFileMap() {
    assertThatThrownBy(() -> service.diff(" ", Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.sync(PROJECT, null, false))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
