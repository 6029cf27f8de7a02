package com.cgi.medscrub.api.handler;

import com.cgi.medscrub.api.dto.ApiResponse;
import com.cgi.medscrub.exception.InputTooLargeException;
import com.cgi.medscrub.exception.InvalidControlCharactersException;
import com.cgi.medscrub.exception.ReportExportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for the application.
 * Messages written here come from the exceptions themselves and never carry document text.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InputTooLargeException.class)
    public ResponseEntity<ApiResponse<String>> handleInputTooLarge(InputTooLargeException e) {
        logger.warn("Rejected input: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    @ExceptionHandler(InvalidControlCharactersException.class)
    public ResponseEntity<ApiResponse<String>> handleInvalidControlCharacters(InvalidControlCharactersException e) {
        logger.warn("Rejected input: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    /**
     * Handles ReportExportException.
     *
     * @param e ReportExportException
     * @return API response with error message
     */
    @ExceptionHandler(ReportExportException.class)
    public ResponseEntity<ApiResponse<String>> handleReportExport(ReportExportException e) {
        logger.error("Export error: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    /**
     * Handles IllegalArgumentException.
     *
     * @param e IllegalArgumentException
     * @return API response with error message
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<String>> handleIllegalArgumentException(IllegalArgumentException e) {
        logger.warn("Invalid argument: {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid argument: " + e.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     *
     * @param e Exception
     * @return API response with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<String>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getClass().getSimpleName(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "GENERAL_ERROR"));
    }
}
