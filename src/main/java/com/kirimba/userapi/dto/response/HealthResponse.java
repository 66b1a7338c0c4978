package com.kirimba.userapi.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;

@Schema(description = "Состояние сервиса")
public record HealthResponse(
        @Schema(example = "ok") String status,
        @Schema(example = "2024-05-10T12:00:00+03:00") OffsetDateTime time) {
}
