package com.nevis.ingest.exception;

import lombok.experimental.StandardException;

@StandardException
public class TextExtractionException extends RuntimeException {
}
