package com.kirimba.userapi.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Страница пользователей")
public class UserListResponse {

    @Schema(description = "Пользователи страницы по возрастанию id")
    private List<UserResponse> users;

    @Schema(description = "Всего пользователей", example = "15")
    private long total;

    @Schema(description = "Номер страницы", example = "2")
    private int page;

    @JsonProperty("page_size")
    @Schema(description = "Размер страницы", example = "10")
    private int pageSize;

    @JsonProperty("total_pages")
    @Schema(description = "Всего страниц", example = "2")
    private int totalPages;
}
