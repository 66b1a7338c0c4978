package com.kirimba.userapi.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kirimba.userapi.error.ErrorCode;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;

import java.util.List;

/**
 * Единый конверт ошибки для всех не-2xx ответов.
 */
@Schema(description = "Ответ с описанием ошибки")
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        @Schema(description = "Короткое описание ошибки", example = "User not found")
        String error,
        @Schema(description = "Correlation id запроса", example = "0b6f6c1e-6a39-4c38-9d0e-1f0f3b7d1c2a")
        @JsonProperty("request_id")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        String requestId,
        @Schema(description = "Ошибки валидации по полям")
        List<String> details) {

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String requestId) {
        return toResponseEntity(errorCode.getStatus(), errorCode.getMessage(), requestId, List.of());
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String requestId,
                                                                 List<String> details) {
        return toResponseEntity(errorCode.getStatus(), errorCode.getMessage(), requestId, details);
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(HttpStatusCode status, String message,
                                                                 String requestId, List<String> details) {
        return ResponseEntity
                .status(status)
                .body(new ErrorResponse(message, requestId, details));
    }
}
