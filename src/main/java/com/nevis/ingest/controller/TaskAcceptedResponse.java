package com.nevis.ingest.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.ingest.model.TaskStatus;

public record TaskAcceptedResponse(
    @JsonProperty("task_id")
    String taskId,

    TaskStatus status
) {}
