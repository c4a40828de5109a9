package com.vidrecorder.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 * Provides consistent error responses across all endpoints
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RecordingConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(
            RecordingConflictException ex, WebRequest request) {
        log.info("Recording conflict for room {}: active recording {}", ex.getRoomId(), ex.getActiveRecordingId());
        ResponseEntity<Map<String, Object>> response = buildErrorResponse(
                HttpStatus.CONFLICT,
                "Conflict",
                ex.getMessage(),
                request.getDescription(false)
        );
        response.getBody().put("recordingId", ex.getActiveRecordingId());
        return response;
    }

    @ExceptionHandler(InvalidRecordingStateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidState(
            InvalidRecordingStateException ex, WebRequest request) {
        log.info("Rejected transition: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.CONFLICT,
                "Invalid Recording State",
                ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleOptimisticLock(
            ObjectOptimisticLockingFailureException ex, WebRequest request) {
        log.warn("Concurrent modification of recording: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.CONFLICT,
                "Concurrent Modification",
                "The recording was modified concurrently. Please retry.",
                request.getDescription(false)
        );
    }

    @ExceptionHandler({RecordingNotFoundException.class, UploadNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(
            RecordingException ex, WebRequest request) {
        log.info("Not found: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.NOT_FOUND,
                "Not Found",
                ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(RecordingForbiddenException.class)
    public ResponseEntity<Map<String, Object>> handleForbidden(
            RecordingForbiddenException ex, WebRequest request) {
        log.warn("Forbidden: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.FORBIDDEN,
                "Forbidden",
                ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(IncompleteUploadException.class)
    public ResponseEntity<Map<String, Object>> handleIncompleteUpload(
            IncompleteUploadException ex, WebRequest request) {
        log.warn("Incomplete upload {}: {} chunk(s) missing", ex.getUploadId(), ex.getMissingChunks().size());
        ResponseEntity<Map<String, Object>> response = buildErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Incomplete Upload",
                ex.getMessage(),
                request.getDescription(false)
        );
        response.getBody().put("uploadId", ex.getUploadId());
        response.getBody().put("missingChunks", ex.getMissingChunks());
        return response;
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<Map<String, Object>> handleStorageFailure(
            StorageFailureException ex, WebRequest request) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.BAD_GATEWAY,
                "Storage Service Error",
                ex.getMessage() + ". The upload can be retried.",
                request.getDescription(false)
        );
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            Exception ex, WebRequest request) {
        log.warn("Validation error: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Validation Error",
                ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSize(
            MaxUploadSizeExceededException ex, WebRequest request) {
        log.warn("Upload too large: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Payload Too Large",
                "The uploaded file exceeds the maximum allowed size",
                request.getDescription(false)
        );
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
            AccessDeniedException ex, WebRequest request) {
        log.warn("Access denied: {}", ex.getMessage());
        return buildErrorResponse(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                "You don't have permission to access this resource",
                request.getDescription(false)
        );
    }

    @ExceptionHandler(SdkException.class)
    public ResponseEntity<Map<String, Object>> handleSdkException(
            SdkException ex, WebRequest request) {
        log.error("R2 storage error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.BAD_GATEWAY,
                "Storage Service Error",
                "R2 storage error: " + ex.getMessage(),
                request.getDescription(false)
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(
            Exception ex, WebRequest request) {
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please contact support if the problem persists.",
                request.getDescription(false)
        );
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status,
            String error,
            String message,
            String path) {

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", path.replace("uri=", ""));

        return new ResponseEntity<>(errorResponse, status);
    }
}
