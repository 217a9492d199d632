package com.nevis.ingest.exception;

import lombok.Getter;

@Getter
public class TaskNotFoundException extends RuntimeException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }
}
