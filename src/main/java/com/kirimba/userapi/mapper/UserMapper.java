package com.kirimba.userapi.mapper;

import com.kirimba.userapi.dto.response.UserResponse;
import com.kirimba.userapi.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * Маппер User entity → UserResponse.
 * MapStruct генерирует реализацию во время компиляции.
 */
@Mapper(componentModel = "spring")
public interface UserMapper {

    // uuuu: пролептический год, 0000-01-01 не превращается в 0001
    String DATE_FORMAT = "uuuu-MM-dd";

    /**
     * Ответ без возраста (создание и обновление).
     */
    @Mapping(target = "dob", source = "dateOfBirth", dateFormat = DATE_FORMAT)
    @Mapping(target = "age", ignore = true)
    UserResponse toResponse(User user);

    /**
     * Ответ с вычисленным возрастом (чтение).
     */
    @Mapping(target = "id", source = "user.id")
    @Mapping(target = "name", source = "user.name")
    @Mapping(target = "dob", source = "user.dateOfBirth", dateFormat = DATE_FORMAT)
    @Mapping(target = "age", source = "age")
    UserResponse toResponseWithAge(User user, Integer age);
}
