package com.nevis.ingest.service;

import com.nevis.ingest.model.BatchResult;
import com.nevis.ingest.model.ProgressEvent;
import com.nevis.ingest.model.Task;

import java.util.List;

public interface TaskTracker {

    String create();

    void update(String taskId, ProgressEvent event);

    void complete(String taskId, BatchResult result);

    void fail(String taskId, String errorMessage);

    /**
     * @throws com.nevis.ingest.exception.TaskNotFoundException if no task has that id
     */
    Task get(String taskId);

    /**
     * All tasks, most recently started first.
     */
    List<Task> list();
}
