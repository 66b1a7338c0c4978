package com.kirimba.userapi.controller;

import com.kirimba.userapi.dto.response.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final Clock clock;

    @Operation(summary = "Проверка доступности сервиса")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", OffsetDateTime.now(clock)));
    }
}
