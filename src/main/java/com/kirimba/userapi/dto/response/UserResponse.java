package com.kirimba.userapi.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * DTO пользователя для API responses.
 * Возраст заполняется только при чтении (GET), в ответах на создание и обновление его нет.
 */
@Data
@Schema(description = "Ответ с данными пользователя")
public class UserResponse {

    @Schema(description = "Уникальный идентификатор пользователя", example = "1")
    private Integer id;

    @Schema(description = "Имя пользователя", example = "Alice")
    private String name;

    @Schema(description = "Дата рождения", example = "1990-05-10")
    private String dob;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "Полных лет на текущую дату", example = "34")
    private Integer age;
}
