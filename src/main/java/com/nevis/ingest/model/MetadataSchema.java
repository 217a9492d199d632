package com.nevis.ingest.model;

import java.util.LinkedHashMap;
import java.util.Map;

public enum MetadataSchema {

    /** {@code {title, ID, file_name}}, ID falls back to N/A. */
    LEGACY {
        @Override
        public Map<String, String> toCustomMetadata(DocumentMetadata metadata) {
            Map<String, String> entries = new LinkedHashMap<>();
            entries.put(TITLE, metadata.title());
            entries.put(ID, metadata.documentId() == null || metadata.documentId().isBlank()
                ? DocumentMetadata.NOT_AVAILABLE
                : metadata.documentId());
            entries.put(FILE_NAME, metadata.fileName());
            entries.put(SCHEMA_VERSION, name());
            return entries;
        }

        @Override
        public DocumentMetadata fromCustomMetadata(Map<String, String> entries) {
            String title = entries.get(TITLE);
            return new DocumentMetadata(this, title, title, entries.get(ID), entries.get(FILE_NAME));
        }
    },

    /** {@code {short_name, abstract_title?, abstract_id?, file_name}} */
    CURRENT {
        @Override
        public Map<String, String> toCustomMetadata(DocumentMetadata metadata) {
            Map<String, String> entries = new LinkedHashMap<>();
            entries.put(SHORT_NAME, metadata.shortName());
            putIfPresent(entries, ABSTRACT_TITLE, metadata.title());
            putIfPresent(entries, ABSTRACT_ID, metadata.documentId());
            entries.put(FILE_NAME, metadata.fileName());
            entries.put(SCHEMA_VERSION, name());
            return entries;
        }

        @Override
        public DocumentMetadata fromCustomMetadata(Map<String, String> entries) {
            return new DocumentMetadata(this, entries.get(SHORT_NAME), entries.get(ABSTRACT_TITLE),
                entries.get(ABSTRACT_ID), entries.get(FILE_NAME));
        }
    };

    public static final String TITLE = "title";
    public static final String ID = "ID";
    public static final String SHORT_NAME = "short_name";
    public static final String ABSTRACT_TITLE = "abstract_title";
    public static final String ABSTRACT_ID = "abstract_id";
    public static final String FILE_NAME = "file_name";
    public static final String SCHEMA_VERSION = "schema_version";

    public abstract Map<String, String> toCustomMetadata(DocumentMetadata metadata);

    public abstract DocumentMetadata fromCustomMetadata(Map<String, String> entries);

    /**
     * Tags a stored record. Records written before the version key existed are
     * recognised by their mandatory dedup key.
     */
    public static MetadataSchema detect(Map<String, String> entries) {
        String tagged = entries.get(SCHEMA_VERSION);
        if (tagged != null) {
            for (MetadataSchema schema : values()) {
                if (schema.name().equalsIgnoreCase(tagged)) {
                    return schema;
                }
            }
        }
        return entries.containsKey(SHORT_NAME) ? CURRENT : LEGACY;
    }

    private static void putIfPresent(Map<String, String> entries, String key, String value) {
        if (value != null && !value.isBlank() && !DocumentMetadata.NOT_AVAILABLE.equals(value)) {
            entries.put(key, value);
        }
    }
}
