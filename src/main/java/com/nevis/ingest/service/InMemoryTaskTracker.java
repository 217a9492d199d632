package com.nevis.ingest.service;

import com.nevis.ingest.exception.TaskNotFoundException;
import com.nevis.ingest.model.BatchResult;
import com.nevis.ingest.model.FileStatus;
import com.nevis.ingest.model.ProcessedFile;
import com.nevis.ingest.model.ProgressEvent;
import com.nevis.ingest.model.Task;
import com.nevis.ingest.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

@Slf4j
@Component
public class InMemoryTaskTracker implements TaskTracker {

    private final Map<String, TaskState> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskTracker() {
        this(Clock.systemUTC());
    }

    InMemoryTaskTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create() {
        String taskId = UUID.randomUUID().toString();
        tasks.put(taskId, new TaskState(taskId, sequence.incrementAndGet(), OffsetDateTime.now(clock)));
        log.info("Created task {}", taskId);
        return taskId;
    }

    @Override
    public void update(String taskId, ProgressEvent event) {
        write(taskId, state -> {
            state.current = event.current();
            state.total = event.total();
            state.currentFile = event.filename();
            state.processedFiles.add(event.toProcessedFile());
            if (event.status() == FileStatus.FAILED) {
                state.errors.add(event.filename() + ": " + event.error());
            }
        });
    }

    @Override
    public void complete(String taskId, BatchResult result) {
        write(taskId, state -> {
            state.status = TaskStatus.COMPLETED;
            state.result = result;
            state.total = result.total();
            state.current = result.total();
            state.completedAt = OffsetDateTime.now(clock);
        });
        log.info("Task {} completed: {} successful, {} failed, {} skipped",
            taskId, result.successful(), result.failed(), result.skipped());
    }

    @Override
    public void fail(String taskId, String errorMessage) {
        write(taskId, state -> {
            state.status = TaskStatus.FAILED;
            state.errorMessage = errorMessage;
            state.completedAt = OffsetDateTime.now(clock);
        });
        log.error("Task {} failed: {}", taskId, errorMessage);
    }

    @Override
    public Task get(String taskId) {
        return find(taskId).snapshot();
    }

    @Override
    public List<Task> list() {
        return tasks.values().stream()
            .sorted(Comparator.comparing((TaskState state) -> state.startedAt)
                .thenComparingLong(state -> state.sequence)
                .reversed())
            .map(TaskState::snapshot)
            .toList();
    }

    private void write(String taskId, Consumer<TaskState> mutation) {
        TaskState state = find(taskId);
        state.lock.writeLock().lock();
        try {
            if (state.status.isTerminal()) {
                log.warn("Ignoring update to task {} in terminal state {}", taskId, state.status);
                return;
            }
            mutation.accept(state);
        } finally {
            state.lock.writeLock().unlock();
        }
    }

    private TaskState find(String taskId) {
        TaskState state = taskId == null ? null : tasks.get(taskId);
        if (state == null) {
            throw new TaskNotFoundException(taskId);
        }
        return state;
    }

    private static final class TaskState {

        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final String id;
        private final long sequence;
        private final OffsetDateTime startedAt;
        private final List<String> errors = new ArrayList<>();
        private final List<ProcessedFile> processedFiles = new ArrayList<>();

        private TaskStatus status = TaskStatus.PROCESSING;
        private int current;
        private int total;
        private String currentFile;
        private OffsetDateTime completedAt;
        private BatchResult result;
        private String errorMessage;

        TaskState(String id, long sequence, OffsetDateTime startedAt) {
            this.id = id;
            this.sequence = sequence;
            this.startedAt = startedAt;
        }

        Task snapshot() {
            lock.readLock().lock();
            try {
                return new Task(
                    id,
                    status,
                    current,
                    total,
                    currentFile,
                    startedAt,
                    completedAt,
                    List.copyOf(errors),
                    List.copyOf(processedFiles),
                    result,
                    errorMessage
                );
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
