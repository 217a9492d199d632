package com.nevis.ingest.exception;

import lombok.experimental.StandardException;

@StandardException
public class TransientFileSearchException extends FileSearchException {
}
