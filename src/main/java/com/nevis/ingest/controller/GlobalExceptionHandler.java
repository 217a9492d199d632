package com.nevis.ingest.controller;

import com.nevis.ingest.exception.FolderNotFoundException;
import com.nevis.ingest.exception.InvalidDocumentTypeException;
import com.nevis.ingest.exception.InvalidRequestException;
import com.nevis.ingest.exception.MetadataValidationException;
import com.nevis.ingest.exception.OperationFailedException;
import com.nevis.ingest.exception.OperationTimeoutException;
import com.nevis.ingest.exception.StoreResolutionException;
import com.nevis.ingest.exception.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({
        InvalidRequestException.class,
        InvalidDocumentTypeException.class,
        MetadataValidationException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({FolderNotFoundException.class, TaskNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        return error(String.format("Parameter '%s' is missing", ex.getParameterName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        return error(String.format("Part '%s' is missing", ex.getRequestPartName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .orElse("Invalid request body");
        return error(message, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({
        OperationFailedException.class,
        OperationTimeoutException.class,
        StoreResolutionException.class
    })
    public ResponseEntity<ErrorResponse> handleUpstreamFailure(RuntimeException ex) {
        log.error("Upstream failure: {}", ex.getMessage());
        return error(ex.getMessage(), HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejectedJob(TaskRejectedException ex) {
        return error("Too many bulk ingestion jobs in progress, retry later", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(message, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(error, status);
    }
}
