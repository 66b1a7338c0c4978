package com.kirimba.userapi.controller;

import com.kirimba.userapi.dto.request.UserRequest;
import com.kirimba.userapi.dto.response.UserListResponse;
import com.kirimba.userapi.dto.response.UserResponse;
import com.kirimba.userapi.service.Pagination;
import com.kirimba.userapi.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @Operation(summary = "Создать нового пользователя")
    @PostMapping
    public ResponseEntity<UserResponse> createUser(
            @Parameter(description = "Имя и дата рождения")
            @Valid @RequestBody UserRequest request
    ) {
        UserResponse userResponse = userService.createUser(request.getName(), request.getDob());
        return ResponseEntity.status(HttpStatus.CREATED).body(userResponse);
    }

    /**
     * Возвращает пользователя вместе с возрастом на сегодня.
     *
     * @param id идентификатор пользователя
     * @return пользователь или 404 если не найден
     */
    @Operation(summary = "Получить пользователя по ID")
    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUser(
            @Parameter(description = "ID пользователя")
            @PathVariable("id") Integer id
    ) {
        return ResponseEntity.ok(userService.getUser(id));
    }

    /**
     * Страница пользователей по возрастанию id.
     * 0 или отсутствие параметра означает значение по умолчанию (1 и 10).
     */
    @Operation(summary = "Список пользователей с пагинацией")
    @GetMapping
    public ResponseEntity<UserListResponse> listUsers(
            @Parameter(description = "Номер страницы, начиная с 1")
            @RequestParam(name = "page", required = false) @Min(0) Integer page,
            @Parameter(description = "Размер страницы, от 1 до 100")
            @RequestParam(name = "page_size", required = false) @Min(0) @Max(Pagination.MAX_PAGE_SIZE) Integer pageSize
    ) {
        return ResponseEntity.ok(userService.listUsers(page, pageSize));
    }

    @Operation(summary = "Обновить имя и дату рождения пользователя")
    @PutMapping("/{id}")
    public ResponseEntity<UserResponse> updateUser(
            @Parameter(description = "ID пользователя")
            @PathVariable("id") Integer id,
            @Parameter(description = "Новые имя и дата рождения")
            @Valid @RequestBody UserRequest request
    ) {
        return ResponseEntity.ok(userService.updateUser(id, request.getName(), request.getDob()));
    }

    @Operation(summary = "Удалить пользователя по ID")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteUser(
            @Parameter(description = "ID пользователя")
            @PathVariable("id") Integer id
    ) {
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
