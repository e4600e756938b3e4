package com.nevis.policy.controller;

import com.nevis.policy.exception.CannotDeleteSoleRevisionException;
import com.nevis.policy.exception.DocumentAlreadyExistsException;
import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.exception.IngestionInProgressException;
import com.nevis.policy.exception.InvalidDateRangeException;
import com.nevis.policy.exception.InvalidSourceException;
import com.nevis.policy.exception.QueryEmbeddingException;
import com.nevis.policy.exception.RevisionOverlapException;
import com.nevis.policy.exception.SectionNotFoundException;
import com.nevis.policy.exception.WrongQueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DocumentAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyExists(DocumentAlreadyExistsException ex) {
        return error(ex.getMessage(), "ALREADY_EXISTS", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        return error("Duplicate entity", "ALREADY_EXISTS", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), "RESOURCE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidSourceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSource(InvalidSourceException ex) {
        return error(ex.getMessage(), "INVALID_IDENTITY", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RevisionOverlapException.class)
    public ResponseEntity<ErrorResponse> handleOverlap(RevisionOverlapException ex) {
        log.warn("Rejected revision for {}: {}", ex.getSource(), ex.getMessage());
        return error(ex.getMessage(), "REVISION_OVERLAP", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(CannotDeleteSoleRevisionException.class)
    public ResponseEntity<ErrorResponse> handleSoleRevision(CannotDeleteSoleRevisionException ex) {
        return error(ex.getMessage(), "CANNOT_DELETE_SOLE_REVISION", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(IngestionInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(IngestionInProgressException ex) {
        return error(ex.getMessage(), "ALREADY_IN_PROGRESS", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(SectionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSectionNotFound(SectionNotFoundException ex) {
        return error(ex.getMessage(), "SECTION_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({WrongQueryException.class, InvalidDateRangeException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return error(ex.getMessage(), "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return error(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return error("Malformed request body", "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        String message = String.format("Part '%s' is missing", ex.getRequestPartName());
        return error(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return error(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(QueryEmbeddingException.class)
    public ResponseEntity<ErrorResponse> handleQueryEmbedding(QueryEmbeddingException ex) {
        return error("Search is temporarily unavailable", "EMBEDDING_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, errorCode, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
