package com.kirimba.userapi.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Тело запроса на создание и на обновление пользователя.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Данные пользователя")
public class UserRequest {

    @NotNull
    @Size(min = 2, max = 100)
    @Schema(description = "Имя пользователя", example = "Alice")
    private String name;

    @NotNull
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}")
    @Schema(description = "Дата рождения в формате YYYY-MM-DD", example = "1990-05-10")
    private String dob;
}
