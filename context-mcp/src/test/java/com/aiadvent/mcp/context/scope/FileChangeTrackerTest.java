package com.aiadvent.mcp.context.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.change.ContentHashes;
import com.aiadvent.mcp.context.change.FileChangeSet;
import com.aiadvent.mcp.context.change.FileRecord;
import com.aiadvent.mcp.context.change.InMemoryFileRecordStore;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class FileChangeTrackerTest {

  private static final String PROJECT = "tracked";
  private static final Duration LONG_DEBOUNCE = Duration.ofMinutes(10);

  @Mock private ChangeStoreService mockedStore;

  private ScheduledExecutorService scheduler;
  private AutoCloseable mocks;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void tearDown() throws Exception {
    scheduler.shutdownNow();
    mocks.close();
  }

  @Test
  void laterEditOfSamePathReplacesPendingOne() {
    InMemoryFileRecordStore records = new InMemoryFileRecordStore();
    ChangeStoreService changeStore =
        new ChangeStoreService(records, new PatternSourceStructureExtractor());
    FileChangeTracker tracker = tracker(changeStore, LONG_DEBOUNCE, 10);

    tracker.track("src/App.tsx", "first", ChangeSource.USER_EDIT);
    tracker.track("/src/App.tsx", "second", ChangeSource.AI_EDIT);

    assertThat(tracker.pendingCount()).isEqualTo(1);
    assertThat(tracker.flush()).isEqualTo(1);
    assertThat(tracker.pendingCount()).isZero();
    FileRecord record = changeStore.records(PROJECT).get("/src/App.tsx");
    assertThat(record.contentHash()).isEqualTo(ContentHashes.sha256("second"));
    assertThat(record.modificationCount()).isEqualTo(1);
  }

  @Test
  void flushProcessesInBatches() {
    when(mockedStore.sync(eq(PROJECT), anyMap(), eq(false))).thenReturn(FileChangeSet.empty());
    FileChangeTracker tracker = tracker(mockedStore, LONG_DEBOUNCE, 2);

    Map<String, String> files = new LinkedHashMap<>();
    for (int i = 0; i < 5; i++) {
      files.put("/src/file" + i + ".ts", "content " + i);
    }
    tracker.trackBatch(files, ChangeSource.AI_GENERATION);

    assertThat(tracker.flush()).isEqualTo(5);
    verify(mockedStore, times(3)).sync(eq(PROJECT), anyMap(), eq(false));
  }

  @Test
  void failedBatchIsDropped() {
    when(mockedStore.sync(eq(PROJECT), anyMap(), eq(false)))
        .thenThrow(new IllegalStateException("store offline"));
    FileChangeTracker tracker = tracker(mockedStore, LONG_DEBOUNCE, 10);
    tracker.track("/src/a.ts", "a", ChangeSource.USER_EDIT);

    assertThat(tracker.flush()).isZero();
    assertThat(tracker.pendingCount()).isZero();
  }

  @Test
  void quietPeriodTriggersProcessing() throws InterruptedException {
    CountDownLatch processed = new CountDownLatch(1);
    when(mockedStore.sync(eq(PROJECT), anyMap(), eq(false)))
        .thenAnswer(
            invocation -> {
              processed.countDown();
              return FileChangeSet.empty();
            });
    FileChangeTracker tracker = tracker(mockedStore, Duration.ofMillis(20), 10);

    tracker.track("/src/a.ts", "a", ChangeSource.USER_EDIT);

    assertThat(processed.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void disposedTrackerRejectsChanges() {
    FileChangeTracker tracker = tracker(mockedStore, LONG_DEBOUNCE, 10);
    tracker.track("/src/a.ts", "a", ChangeSource.USER_EDIT);

    tracker.dispose();

    assertThat(tracker.pendingCount()).isZero();
    assertThatThrownBy(() -> tracker.track("/src/b.ts", "b", ChangeSource.USER_EDIT))
        .isInstanceOf(IllegalStateException.class);
    verify(mockedStore, never()).sync(eq(PROJECT), anyMap(), eq(false));
  }

  @Test
  void normalizesPaths() {
    assertThat(FileChangeTracker.normalizePath(" src/a.ts ")).isEqualTo("/src/a.ts");
    assertThat(FileChangeTracker.normalizePath("/src/a.ts")).isEqualTo("/src/a.ts");
    assertThatThrownBy(() -> FileChangeTracker.normalizePath(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private FileChangeTracker tracker(
      ChangeStoreService changeStore, Duration debounce, int maxBatchSize) {
    return new FileChangeTracker(
        PROJECT, changeStore, null, null, scheduler, debounce, maxBatchSize, false);
  }
}
