package com.nevis.ingest.exception;

import lombok.Getter;

@Getter
public class FolderNotFoundException extends RuntimeException {
    private final String folderPath;

    public FolderNotFoundException(String folderPath) {
        super("Folder not found or not a directory: " + folderPath);
        this.folderPath = folderPath;
    }
}
