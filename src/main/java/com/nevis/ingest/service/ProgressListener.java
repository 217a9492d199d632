package com.nevis.ingest.service;

import com.nevis.ingest.model.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}
