package com.nevis.ingest.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
