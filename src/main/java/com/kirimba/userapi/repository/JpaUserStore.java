package com.kirimba.userapi.repository;

import com.kirimba.userapi.error.exception.StorageException;
import com.kirimba.userapi.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Реализация {@link UserStore} поверх Spring Data JPA.
 * Транзакции открывает сам репозиторий, поэтому и ошибки доступа к данным,
 * и ошибки транзакции (нет соединения, таймаут) оборачиваются здесь в {@link StorageException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;
    private final Clock clock;

    @Override
    public User create(String name, LocalDate dateOfBirth) {
        try {
            User saved = userRepository.saveAndFlush(new User(name, dateOfBirth, LocalDateTime.now(clock)));
            log.info("User created | id={}", saved.getId());
            return saved;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to create user", e);
            throw new StorageException("create user", e);
        }
    }

    @Override
    public Optional<User> getById(Integer id) {
        try {
            return userRepository.findById(id);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to get user | id={}", id, e);
            throw new StorageException("get user", e);
        }
    }

    @Override
    public List<User> list(int limit, long offset) {
        try {
            return userRepository.findPage(limit, offset);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to list users | limit={} offset={}", limit, offset, e);
            throw new StorageException("list users", e);
        }
    }

    @Override
    public long count() {
        try {
            return userRepository.count();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to count users", e);
            throw new StorageException("count users", e);
        }
    }

    @Override
    public Optional<User> update(Integer id, String name, LocalDate dateOfBirth) {
        try {
            int updated = userRepository.updateNameAndDateOfBirth(id, name, dateOfBirth, LocalDateTime.now(clock));
            if (updated == 0) {
                return Optional.empty();
            }
            log.info("User updated | id={}", id);
            return userRepository.findById(id);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to update user | id={}", id, e);
            throw new StorageException("update user", e);
        }
    }

    @Override
    public boolean delete(Integer id) {
        try {
            int deleted = userRepository.deleteUserById(id);
            if (deleted == 0) {
                return false;
            }
            log.info("User deleted | id={}", id);
            return true;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to delete user | id={}", id, e);
            throw new StorageException("delete user", e);
        }
    }
}
