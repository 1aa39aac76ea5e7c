package com.scholarintel.crawler.service;

import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.fixture.WorkFixtures;
import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainSpec;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.YearRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointTrackerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static final DomainTable TWO_DOMAINS = DomainTable.of(List.of(
            new DomainSpec("Physics", 1.0, 100, 0, List.of("quantum", "optics"),
                    List.of(new YearRange(2015, 2019), new YearRange(2020, 2024))),
            new DomainSpec("Biology", 1.5, 100, 0, List.of("genome"),
                    List.of(new YearRange(2020, 2024)))));

    @TempDir
    Path tempDir;

    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = WorkFixtures.properties(tempDir);
    }

    private CheckpointTracker tracker(DomainTable table) {
        return new CheckpointTracker(WorkFixtures.objectMapper(), table, properties, CLOCK);
    }

    @Test
    void enumeratesAllTasksWhenNoCheckpointExists() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);

        Map<String, CrawlTask> tasks = tracker.load();

        assertThat(tasks.keySet()).containsExactly(
                "Physics|quantum|2015-2019",
                "Physics|quantum|2020-2024",
                "Physics|optics|2015-2019",
                "Physics|optics|2020-2024",
                "Biology|genome|2020-2024");
        assertThat(tasks.values()).allSatisfy(task -> {
            assertThat(task.getCursor()).isEqualTo(CrawlTask.START_CURSOR);
            assertThat(task.getRecordsFetched()).isZero();
            assertThat(task.isCompleted()).isFalse();
        });
        assertThat(tracker.getPath()).exists();
    }

    @Test
    void committedProgressSurvivesRestart() {
        CheckpointTracker first = tracker(TWO_DOMAINS);
        first.load();
        first.update("Biology|genome|2020-2024", "cursor-2", 50, false);
        first.update("Biology|genome|2020-2024", "cursor-3", 20, 50, false);

        CheckpointTracker second = tracker(TWO_DOMAINS);
        CrawlTask task = second.load().get("Biology|genome|2020-2024");

        assertThat(task.getCursor()).isEqualTo("cursor-3");
        assertThat(task.getPageOffset()).isEqualTo(20);
        assertThat(task.getRecordsFetched()).isEqualTo(100);
        assertThat(task.getLastUpdate()).isEqualTo(CLOCK.instant());
        assertThat(second.stats().getLastCheckpointAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void completedNeverReverts() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();
        tracker.update("Physics|optics|2015-2019", "last", 10, true);
        tracker.update("Physics|optics|2015-2019", "later", 0, false);

        CrawlTask task = tracker.find("Physics|optics|2015-2019").orElseThrow();
        assertThat(task.isCompleted()).isTrue();
        assertThat(task.getCursor()).isEqualTo("later");
    }

    @Test
    void rejectsNegativeDelta() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();

        assertThatThrownBy(() -> tracker.update("Physics|optics|2015-2019", "c", -1, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnknownTask() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();

        assertThatThrownBy(() -> tracker.update("Chemistry|x|2020-2024", "c", 1, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown task");
    }

    @Test
    void corruptFileIsFatal() throws IOException {
        Files.writeString(tracker(TWO_DOMAINS).getPath(), "{\"tasks\": {\"Physics|");

        assertThatThrownBy(() -> tracker(TWO_DOMAINS).load())
                .isInstanceOf(CheckpointCorruptedException.class)
                .isInstanceOf(FatalCrawlException.class);
    }

    @Test
    void fileWithoutTaskMapIsFatal() throws IOException {
        Files.writeString(tracker(TWO_DOMAINS).getPath(), "{\"stats\": {}}");

        assertThatThrownBy(() -> tracker(TWO_DOMAINS).load())
                .isInstanceOf(CheckpointCorruptedException.class);
    }

    @Test
    void savesLeaveNoTempFilesBehind() throws IOException {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();
        for (int i = 0; i < 5; i++) {
            tracker.update("Physics|quantum|2015-2019", "c" + i, 1, false);
        }

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("crawl_progress.json");
        }
    }

    @Test
    void tasksOfRemovedDomainsAreIgnored() {
        CheckpointTracker before = tracker(TWO_DOMAINS);
        before.load();
        before.update("Biology|genome|2020-2024", "c2", 5, false);

        DomainTable physicsOnly = DomainTable.of(List.of(TWO_DOMAINS.find("Physics").orElseThrow()));
        Map<String, CrawlTask> tasks = tracker(physicsOnly).load();

        assertThat(tasks).hasSize(4);
        assertThat(tasks.keySet()).allMatch(id -> id.startsWith("Physics|"));
    }

    @Test
    void existingCheckpointIsNotReEnumerated() {
        CheckpointTracker before = tracker(TWO_DOMAINS);
        before.load();

        DomainTable extraKeyword = DomainTable.of(List.of(
                new DomainSpec("Physics", 1.0, 100, 0, List.of("quantum", "optics", "plasma"),
                        List.of(new YearRange(2015, 2019), new YearRange(2020, 2024))),
                TWO_DOMAINS.find("Biology").orElseThrow()));

        assertThat(tracker(extraKeyword).load()).hasSize(5);
    }

    @Test
    void completeDomainFlipsOnlyThatDomain() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();
        tracker.complete("Physics|quantum|2015-2019");

        int flipped = tracker.completeDomain("Physics");

        assertThat(flipped).isEqualTo(3);
        assertThat(tracker.snapshot())
                .filteredOn(CrawlTask::isCompleted)
                .extracting(CrawlTask::getDomain)
                .containsOnly("Physics")
                .hasSize(4);
        assertThat(tracker.completeDomain("Physics")).isZero();
    }

    @Test
    void snapshotIsDetachedFromTrackerState() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();

        tracker.snapshot().get(0).setCursor("tampered");

        assertThat(tracker.snapshot().get(0).getCursor()).isEqualTo(CrawlTask.START_CURSOR);
    }

    @Test
    void resetForgetsProgress() {
        CheckpointTracker tracker = tracker(TWO_DOMAINS);
        tracker.load();
        tracker.update("Physics|quantum|2015-2019", "c9", 99, true);

        tracker.reset();

        CrawlTask task = tracker.find("Physics|quantum|2015-2019").orElseThrow();
        assertThat(task.getCursor()).isEqualTo(CrawlTask.START_CURSOR);
        assertThat(task.getRecordsFetched()).isZero();
        assertThat(task.isCompleted()).isFalse();
    }
}
