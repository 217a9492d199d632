package com.nevis.ingest.model;

public record ProgressEvent(
    int current,
    int total,
    String filename,
    FileStatus status,
    String error
) {

    public static ProgressEvent of(int current, int total, String filename, FileStatus status) {
        return new ProgressEvent(current, total, filename, status, null);
    }

    public ProcessedFile toProcessedFile() {
        return new ProcessedFile(filename, status, error);
    }
}
