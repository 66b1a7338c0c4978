package com.kirimba.userapi.service;

import com.kirimba.userapi.dto.response.UserListResponse;
import com.kirimba.userapi.dto.response.UserResponse;

/**
 * Бизнес-операции над пользователями между HTTP слоем и {@link com.kirimba.userapi.repository.UserStore}.
 */
public interface UserService {

    /**
     * @throws com.kirimba.userapi.error.exception.InvalidDateException если dob не в формате YYYY-MM-DD
     */
    UserResponse createUser(String name, String dob);

    /**
     * @throws com.kirimba.userapi.error.exception.UserNotFoundException если пользователя нет
     */
    UserResponse getUser(Integer id);

    UserListResponse listUsers(Integer page, Integer pageSize);

    UserResponse updateUser(Integer id, String name, String dob);

    void deleteUser(Integer id);
}
