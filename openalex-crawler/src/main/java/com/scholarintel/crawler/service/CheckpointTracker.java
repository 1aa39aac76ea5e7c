package com.scholarintel.crawler.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.RunStats;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-task progress: cursor, mid-page offset, records fetched and completion.
 *
 * The file is rewritten after every committed batch by writing a sibling temp file and
 * renaming it over the old one, so a reader sees either the previous or the new
 * checkpoint, never a partial one. The tracker must only be advanced after the matching
 * store batch has committed.
 */
@Service
@Slf4j
public class CheckpointTracker {

    private final ObjectMapper objectMapper;
    private final DomainTable domainTable;
    private final Clock clock;
    private final Path path;

    private Map<String, CrawlTask> tasks;
    private RunStats stats = new RunStats();

    public CheckpointTracker(ObjectMapper objectMapper, DomainTable domainTable,
                             CrawlerProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.domainTable = domainTable;
        this.clock = clock;
        this.path = Paths.get(properties.getCheckpoint().getPath()).toAbsolutePath();
    }

    /**
     * Read the checkpoint file, or enumerate every task from the domain table when
     * there is none yet.
     *
     * @return copies of all known tasks keyed by task id, in enumeration order
     * @throws CheckpointCorruptedException the file exists but cannot be parsed
     */
    public synchronized Map<String, CrawlTask> load() {
        if (!Files.exists(path)) {
            tasks = domainTable.enumerateTasks();
            stats = new RunStats();
            log.info("No checkpoint at {}, enumerated {} tasks", path, tasks.size());
            save();
            return copyOfTasks();
        }

        CheckpointFile file;
        try {
            file = objectMapper.readValue(path.toFile(), CheckpointFile.class);
        } catch (IOException e) {
            log.error("Checkpoint {} is unreadable: {}", path, e.getMessage());
            throw new CheckpointCorruptedException("Checkpoint " + path + " cannot be parsed", e);
        }
        if (file == null || file.getTasks() == null) {
            throw new CheckpointCorruptedException("Checkpoint " + path + " has no task map", null);
        }

        Map<String, CrawlTask> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, CrawlTask> entry : file.getTasks().entrySet()) {
            CrawlTask task = entry.getValue();
            if (task == null || task.getDomain() == null || task.getKeyword() == null) {
                throw new CheckpointCorruptedException("Checkpoint entry " + entry.getKey() + " is incomplete", null);
            }
            if (domainTable.find(task.getDomain()).isEmpty()) {
                log.warn("Ignoring checkpointed task {}: domain {} is no longer configured",
                        entry.getKey(), task.getDomain());
                continue;
            }
            if (task.getCursor() == null) {
                task.setCursor(CrawlTask.START_CURSOR);
            }
            try {
                loaded.put(task.getId(), task);
            } catch (IllegalArgumentException e) {
                throw new CheckpointCorruptedException("Checkpoint entry " + entry.getKey() + " is invalid", e);
            }
        }
        tasks = loaded;
        stats = file.getStats() != null ? file.getStats() : new RunStats();

        long completed = tasks.values().stream().filter(CrawlTask::isCompleted).count();
        log.info("Loaded checkpoint {}: {} tasks, {} completed", path, tasks.size(), completed);
        return copyOfTasks();
    }

    /**
     * Atomically persist the current task map and statistics.
     */
    public synchronized void save() {
        ensureLoaded();
        stats.setLastCheckpointAt(clock.instant());

        CheckpointFile file = new CheckpointFile(new LinkedHashMap<>(tasks), stats);
        Path dir = path.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(file));
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            moveIntoPlace(tmp);
            log.debug("Checkpoint saved ({} tasks)", tasks.size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new FatalCrawlException("Cannot write checkpoint " + path, e);
        }
    }

    /**
     * Replace the in-memory task map and persist it.
     */
    public synchronized void save(Map<String, CrawlTask> replacement) {
        Map<String, CrawlTask> copy = new LinkedHashMap<>();
        replacement.values().forEach(t -> copy.put(t.getId(), t.copy()));
        tasks = copy;
        save();
    }

    /**
     * Advance a task after its batch has committed, leaving it at the start of the page.
     */
    public void update(String taskId, String cursor, long deltaCount, boolean completed) {
        update(taskId, cursor, 0, deltaCount, completed);
    }

    /**
     * Advance a task after its batch has committed.
     *
     * @param cursor     cursor of the page to request next
     * @param pageOffset items of that page already committed
     * @param deltaCount records committed by the batch, never negative
     * @param completed  true marks the task completed; false never clears it
     */
    public synchronized void update(String taskId, String cursor, int pageOffset, long deltaCount, boolean completed) {
        if (deltaCount < 0) {
            throw new IllegalArgumentException("Negative record delta " + deltaCount + " for " + taskId);
        }
        CrawlTask task = require(taskId);
        task.setCursor(cursor != null ? cursor : task.getCursor());
        task.setPageOffset(Math.max(0, pageOffset));
        task.setRecordsFetched(task.getRecordsFetched() + deltaCount);
        task.setCompleted(task.isCompleted() || completed);
        task.setLastUpdate(clock.instant());
        save();
    }

    /**
     * Mark a task completed without moving its cursor.
     */
    public synchronized void complete(String taskId) {
        CrawlTask task = require(taskId);
        if (task.isCompleted()) return;
        task.setCompleted(true);
        task.setLastUpdate(clock.instant());
        save();
    }

    /**
     * Mark every task of a domain completed, e.g. once the domain quota is reached.
     *
     * @return number of tasks that flipped to completed
     */
    public synchronized int completeDomain(String domain) {
        ensureLoaded();
        int flipped = 0;
        for (CrawlTask task : tasks.values()) {
            if (task.getDomain().equals(domain) && !task.isCompleted()) {
                task.setCompleted(true);
                task.setLastUpdate(clock.instant());
                flipped++;
            }
        }
        if (flipped > 0) {
            save();
        }
        return flipped;
    }

    public synchronized Optional<CrawlTask> find(String taskId) {
        ensureLoaded();
        return Optional.ofNullable(tasks.get(taskId)).map(CrawlTask::copy);
    }

    /** Copies of all tasks in enumeration order */
    public synchronized List<CrawlTask> snapshot() {
        ensureLoaded();
        List<CrawlTask> copies = new ArrayList<>(tasks.size());
        tasks.values().forEach(t -> copies.add(t.copy()));
        return copies;
    }

    /**
     * Live statistics written with every save. Only the run loop mutates them.
     */
    public synchronized RunStats stats() {
        ensureLoaded();
        return stats;
    }

    /**
     * Forget all progress: delete the file and re-enumerate tasks from the domain table.
     */
    public synchronized void reset() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new FatalCrawlException("Cannot delete checkpoint " + path, e);
        }
        tasks = null;
        load();
        log.info("Checkpoint reset, {} tasks pending", tasks.size());
    }

    public Path getPath() {
        return path;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void ensureLoaded() {
        if (tasks == null) {
            load();
        }
    }

    private CrawlTask require(String taskId) {
        ensureLoaded();
        CrawlTask task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    private Map<String, CrawlTask> copyOfTasks() {
        Map<String, CrawlTask> copy = new LinkedHashMap<>();
        tasks.forEach((id, task) -> copy.put(id, task.copy()));
        return copy;
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported in {}, falling back to replace", path.getParent());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp checkpoint {}: {}", tmp, e.getMessage());
        }
    }

    /** On-disk layout of the checkpoint */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CheckpointFile {
        private Map<String, CrawlTask> tasks;
        private RunStats stats;

        CheckpointFile(Map<String, CrawlTask> tasks, RunStats stats) {
            this.tasks = tasks;
            this.stats = stats;
        }
    }
}
