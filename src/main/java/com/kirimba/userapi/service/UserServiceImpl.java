package com.kirimba.userapi.service;

import com.kirimba.userapi.dto.response.UserListResponse;
import com.kirimba.userapi.dto.response.UserResponse;
import com.kirimba.userapi.error.exception.InvalidDateException;
import com.kirimba.userapi.error.exception.UserNotFoundException;
import com.kirimba.userapi.mapper.UserMapper;
import com.kirimba.userapi.model.User;
import com.kirimba.userapi.repository.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private static final DateTimeFormatter DOB_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final UserStore userStore;
    private final UserMapper userMapper;
    private final AgeCalculator ageCalculator;

    @Override
    public UserResponse createUser(String name, String dob) {
        LocalDate dateOfBirth = parseDateOfBirth(dob);
        User user = userStore.create(name, dateOfBirth);
        return userMapper.toResponse(user);
    }

    @Override
    public UserResponse getUser(Integer id) {
        User user = userStore.getById(id)
                .orElseThrow(() -> new UserNotFoundException(id));
        return withAge(user);
    }

    /**
     * Список и общее количество читаются двумя независимыми запросами,
     * при параллельной записи total может не совпасть со страницей.
     */
    @Override
    public UserListResponse listUsers(Integer page, Integer pageSize) {
        Pagination pagination = Pagination.normalize(page, pageSize);

        List<User> users = userStore.list(pagination.limit(), pagination.offset());
        long total = userStore.count();

        List<UserResponse> responses = users.stream()
                .map(this::withAge)
                .toList();

        return new UserListResponse(
                responses,
                total,
                pagination.page(),
                pagination.pageSize(),
                pagination.totalPages(total));
    }

    @Override
    public UserResponse updateUser(Integer id, String name, String dob) {
        LocalDate dateOfBirth = parseDateOfBirth(dob);
        User user = userStore.update(id, name, dateOfBirth)
                .orElseThrow(() -> new UserNotFoundException(id));
        return userMapper.toResponse(user);
    }

    @Override
    public void deleteUser(Integer id) {
        if (!userStore.delete(id)) {
            throw new UserNotFoundException(id);
        }
    }

    private UserResponse withAge(User user) {
        return userMapper.toResponseWithAge(user, ageCalculator.ageOf(user.getDateOfBirth()));
    }

    // только формат: будущие и слишком старые даты принимаются
    private LocalDate parseDateOfBirth(String dob) {
        if (dob == null) {
            throw new InvalidDateException(null);
        }
        try {
            return LocalDate.parse(dob, DOB_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Invalid DOB format: {}", dob);
            throw new InvalidDateException(dob);
        }
    }
}
