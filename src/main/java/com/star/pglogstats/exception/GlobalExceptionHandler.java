package com.star.pglogstats.exception;

import com.star.pglogstats.dto.ApiResponse;
import com.star.pglogstats.dto.ErrorResponse;
import com.star.pglogstats.dto.ValidationError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(FileSizeLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleFileSizeLimitExceeded(
            FileSizeLimitExceededException ex,
            HttpServletRequest request) {

        log.error("File size limit exceeded: {}", ex.getMessage());

        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds the allowed limit",
                new ErrorResponse("FILE_SIZE_LIMIT_EXCEEDED", ex.getMessage(), request.getRequestURI(),
                        HttpStatus.PAYLOAD_TOO_LARGE.value()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSizeExceeded(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request) {

        log.error("Max upload size exceeded: {}", ex.getMessage());

        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "File too large",
                new ErrorResponse("MAX_UPLOAD_SIZE_EXCEEDED",
                        "File size exceeds the maximum allowed size for upload",
                        request.getRequestURI(), HttpStatus.PAYLOAD_TOO_LARGE.value()));
    }

    @ExceptionHandler(InvalidFileTypeException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidFileType(
            InvalidFileTypeException ex,
            HttpServletRequest request) {

        log.error("Invalid file type: {}", ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid file type",
                new ErrorResponse("INVALID_FILE_TYPE", ex.getMessage(), request.getRequestURI(),
                        HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(FileUploadException.class)
    public ResponseEntity<ApiResponse<Void>> handleFileUpload(
            FileUploadException ex,
            HttpServletRequest request) {

        log.error("File upload error: {}", ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid upload",
                new ErrorResponse("FILE_UPLOAD_ERROR", ex.getMessage(), request.getRequestURI(),
                        HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(LogParseException.class)
    public ResponseEntity<ApiResponse<Void>> handleLogParse(
            LogParseException ex,
            HttpServletRequest request) {

        log.error("Log parsing failed on {} lines: {}", ex.getFailures().size(), ex.getFirstFailure());

        ErrorResponse errorResponse = new ErrorResponse(
                "LOG_PARSE_ERROR",
                String.format("%d lines could not be parsed", ex.getFailures().size()),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );
        errorResponse.setParseFailures(ex.getFailures().stream()
                .map(ParseFailure::toString)
                .collect(Collectors.toList()));

        return respond(HttpStatus.BAD_REQUEST, "Failed to parse log file", errorResponse);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfiguration(
            ConfigurationException ex,
            HttpServletRequest request) {

        log.error("Invalid analysis configuration: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "INVALID_CONFIGURATION",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value(),
                ex.getField() != null ? List.of(new ValidationError(ex.getField(), ex.getMessage())) : null
        );

        return respond(HttpStatus.BAD_REQUEST, "Invalid analysis options", errorResponse);
    }

    @ExceptionHandler(LogProcessingException.class)
    public ResponseEntity<ApiResponse<Void>> handleLogProcessing(
            LogProcessingException ex,
            HttpServletRequest request) {

        log.error("Log processing error: {}", ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process log file",
                new ErrorResponse("LOG_PROCESSING_ERROR", ex.getMessage(), request.getRequestURI(),
                        HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationErrors(
            BindException ex,
            HttpServletRequest request) {

        List<ValidationError> validationErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new ValidationError(error.getField(), error.getDefaultMessage()))
                .collect(Collectors.toList());

        log.error("Validation failed: {}", validationErrors);

        return respond(HttpStatus.BAD_REQUEST, "Validation failed",
                new ErrorResponse("VALIDATION_ERROR", "Validation failed for one or more fields",
                        request.getRequestURI(), HttpStatus.BAD_REQUEST.value(), validationErrors));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            Exception ex,
            HttpServletRequest request) {

        log.error("Missing request parameter: {}", ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Missing required parameter",
                new ErrorResponse("MISSING_PARAMETER", ex.getMessage(), request.getRequestURI(),
                        HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                new ErrorResponse("INTERNAL_SERVER_ERROR", "An unexpected error occurred. Please try again later.",
                        request.getRequestURI(), HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message,
                                                             ErrorResponse errorResponse) {
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiResponse.error(message, errorResponse));
    }
}
