package com.kirimba.userapi.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum UserErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    VALIDATION_FAILED("U001", "Validation failed", HttpStatus.BAD_REQUEST),
    INVALID_REQUEST_BODY("U002", "Invalid request body", HttpStatus.BAD_REQUEST),
    INVALID_USER_ID("U003", "Invalid user ID", HttpStatus.BAD_REQUEST),
    INVALID_PAGINATION("U004", "Invalid pagination parameters", HttpStatus.BAD_REQUEST),
    INVALID_DATE("U005", "Invalid date format. Expected YYYY-MM-DD", HttpStatus.BAD_REQUEST),
    USER_NOT_FOUND("U006", "User not found", HttpStatus.NOT_FOUND),

    // === Server Errors (5xx) ===
    STORAGE_FAILURE("S001", "Failed to %s", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_SERVER_ERROR("S002", "Internal Server Error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
