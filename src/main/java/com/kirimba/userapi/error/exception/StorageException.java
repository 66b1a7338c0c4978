package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.UserErrorCode;

/**
 * Сбой хранилища: недоступная БД, нарушение ограничения, ошибка драйвера.
 *
 * @see com.kirimba.userapi.repository.UserStore
 */
public class StorageException extends ServerBaseException {

    /**
     * @param operation что не удалось сделать, например "create user"
     * @param cause     исходное исключение драйвера / Spring
     */
    public StorageException(String operation, Throwable cause) {
        super(UserErrorCode.STORAGE_FAILURE, cause, operation);
    }
}
