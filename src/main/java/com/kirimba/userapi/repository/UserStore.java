package com.kirimba.userapi.repository;

import com.kirimba.userapi.model.User;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Единственная точка доступа к сохранённым пользователям.
 * <p>
 * "Не найдено" возвращается значением ({@link Optional#empty()} или {@code false}),
 * любой сбой хранилища выбрасывается как
 * {@link com.kirimba.userapi.error.exception.StorageException}.
 */
public interface UserStore {

    /**
     * Создаёт пользователя; id и временные метки назначает хранилище.
     *
     * @return сохранённая строка целиком
     */
    User create(String name, LocalDate dateOfBirth);

    Optional<User> getById(Integer id);

    /**
     * Страница пользователей по возрастанию id. Смещение за пределами таблицы даёт пустой список.
     */
    List<User> list(int limit, long offset);

    long count();

    /**
     * Полностью заменяет имя и дату рождения, обновляет updated_at.
     *
     * @return обновлённая строка или empty, если такого id нет
     */
    Optional<User> update(Integer id, String name, LocalDate dateOfBirth);

    /**
     * Физически удаляет строку.
     *
     * @return {@code false}, если такого id нет
     */
    boolean delete(Integer id);
}
