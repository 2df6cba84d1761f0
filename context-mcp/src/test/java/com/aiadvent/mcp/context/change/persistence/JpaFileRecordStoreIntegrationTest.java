package com.aiadvent.mcp.context.change.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.mcp.context.PostgresTestContainer;
import com.aiadvent.mcp.context.analysis.FileType;
import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.change.ChangeKind;
import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.change.FileRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaFileRecordStore.class)
class JpaFileRecordStoreIntegrationTest {

  private static final String PROJECT = "persistence";
  private static final String PLAYER = "/src/components/Player.tsx";
  private static final String BOARD = "/src/components/Board.tsx";

  @Autowired private JpaFileRecordStore store;
  @Autowired private ProjectFileStateRepository repository;
  @Autowired private TestEntityManager entityManager;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeAll
  static void requireDocker() {
    PostgresTestContainer.assumeDockerAvailable();
  }

  @DynamicPropertySource
  static void registerDatasourceProperties(DynamicPropertyRegistry registry) {
    PostgresTestContainer.register(registry);
  }

  @Test
  void reobservingChangedContentUpdatesSameRowAndBumpsCounter() {
    ChangeStoreService changeStore =
        new ChangeStoreService(store, new PatternSourceStructureExtractor());

    assertThat(changeStore.recordObservation(PROJECT, PLAYER, "export const Player = 1;"))
        .isEqualTo(ChangeKind.CREATED);
    flushAndClear();
    UUID firstId = repository.findByProjectIdAndFilePath(PROJECT, PLAYER).orElseThrow().getId();

    assertThat(changeStore.recordObservation(PROJECT, PLAYER, "export const Player = 2;"))
        .isEqualTo(ChangeKind.MODIFIED);
    assertThat(changeStore.recordObservation(PROJECT, PLAYER, "export const Player = 2;"))
        .isEqualTo(ChangeKind.UNCHANGED);
    flushAndClear();

    List<ProjectFileStateEntity> rows = repository.findByProjectId(PROJECT);
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getId()).isEqualTo(firstId);
    FileRecord record = store.getFileRecord(PROJECT, PLAYER).orElseThrow();
    assertThat(record.modificationCount()).isEqualTo(2);
    assertThat(record.exports()).containsExactly("Player");
  }

  @Test
  void upsertRoundTripsJsonColumns() {
    store.upsertFileRecords(
        List.of(
            record(PLAYER, Set.of("Player"), List.of("./Board", "react"), 1),
            record(BOARD, Set.of(), List.of(), 1)));
    flushAndClear();

    store.upsertFileRecords(List.of(record(PLAYER, Set.of("Player"), List.of("./Board"), 3)));
    flushAndClear();

    Map<String, FileRecord> records = store.getFileRecords(PROJECT);
    assertThat(records).containsOnlyKeys(PLAYER, BOARD);
    assertThat(records.get(PLAYER).imports()).containsExactly("./Board");
    assertThat(records.get(PLAYER).modificationCount()).isEqualTo(3);
    assertThat(records.get(PLAYER).fileType()).isEqualTo(FileType.COMPONENT);
    assertThat(store.getFileRecords("other")).isEmpty();
  }

  @Test
  void deletesOnlyNamedPathsOfProject() {
    store.upsertFileRecords(
        List.of(
            record(PLAYER, Set.of(), List.of(), 1),
            record(BOARD, Set.of(), List.of(), 1),
            new FileRecord(
                "other", PLAYER, "hash", 10, Instant.now(), FileType.COMPONENT, null, null, 1)));
    flushAndClear();

    assertThat(repository.deleteByProjectIdAndFilePathIn(PROJECT, List.of(PLAYER, "/missing")))
        .isEqualTo(1);
    store.deleteFileRecords(PROJECT, List.of());
    flushAndClear();

    assertThat(store.getFileRecords(PROJECT)).containsOnlyKeys(BOARD);
    assertThat(store.getFileRecord("other", PLAYER)).isPresent();

    store.deleteFileRecords(PROJECT, List.of(BOARD));
    flushAndClear();
    assertThat(store.getFileRecords(PROJECT)).isEmpty();
  }

  @Test
  void nullJsonColumnsReadAsEmptyCollections() {
    jdbcTemplate.update(
        "insert into context_file_state (id, project_id, file_path, content_hash, byte_size,"
            + " file_type, exports, imports, modification_count, last_modified_at, created_at,"
            + " updated_at) values (gen_random_uuid(), ?, ?, 'legacy', 12, 'component', null,"
            + " null, 0, now(), now(), now())",
        PROJECT,
        PLAYER);

    FileRecord record = store.getFileRecord(PROJECT, PLAYER).orElseThrow();

    assertThat(record.exports()).isEmpty();
    assertThat(record.imports()).isEmpty();
    assertThat(record.modificationCount()).isEqualTo(1);
    assertThat(record.fileType()).isEqualTo(FileType.COMPONENT);
  }

  private void flushAndClear() {
    entityManager.flush();
    entityManager.clear();
  }

  private static FileRecord record(
      String path, Set<String> exports, List<String> imports, int modificationCount) {
    return new FileRecord(
        PROJECT,
        path,
        "hash-" + modificationCount,
        42,
        Instant.now(),
        FileType.COMPONENT,
        exports,
        imports,
        modificationCount);
  }
}
