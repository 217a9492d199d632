package com.nevis.ingest.service;

import java.nio.file.Path;

final class FileNames {

    private FileNames() {
    }

    /**
     * File name without its last extension: {@code 354.pdf -> 354}.
     */
    static String stem(String filename) {
        String name = Path.of(filename).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Last path segment with anything outside {@code [A-Za-z0-9._-]} replaced.
     */
    static String sanitize(String filename) {
        String name = filename == null ? "" : filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        while (name.startsWith(".")) {
            name = name.substring(1);
        }
        return name;
    }

    static boolean hasExtension(Path file, String extension) {
        return file.getFileName().toString().toLowerCase().endsWith(extension.toLowerCase());
    }
}
