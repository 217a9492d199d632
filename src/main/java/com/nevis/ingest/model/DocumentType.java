package com.nevis.ingest.model;

import com.nevis.ingest.exception.InvalidDocumentTypeException;

public enum DocumentType {

    GENERAL(MetadataSchema.LEGACY, false, false),
    ABSTRACTS(MetadataSchema.CURRENT, false, true),
    MANUSCRIPTS(MetadataSchema.CURRENT, true, true);

    private final MetadataSchema schema;
    private final boolean requiresDedup;
    private final boolean bulkCapable;

    DocumentType(MetadataSchema schema, boolean requiresDedup, boolean bulkCapable) {
        this.schema = schema;
        this.requiresDedup = requiresDedup;
        this.bulkCapable = bulkCapable;
    }

    public MetadataSchema schema() {
        return schema;
    }

    public boolean requiresDedup() {
        return requiresDedup;
    }

    public boolean bulkCapable() {
        return bulkCapable;
    }

    public static DocumentType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidDocumentTypeException(value);
        }
        for (DocumentType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new InvalidDocumentTypeException(value);
    }
}
