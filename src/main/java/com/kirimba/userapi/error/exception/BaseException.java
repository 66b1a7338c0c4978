package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.ErrorCode;
import lombok.Getter;

/**
 * Базовое исключение приложения: несёт {@link ErrorCode}, по которому
 * обработчик выбирает HTTP статус и текст ответа.
 */
@Getter
public abstract class BaseException extends RuntimeException {
    private final ErrorCode errorCode;

    protected BaseException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(String.format(errorCode.getMessage(), args), cause);
        this.errorCode = errorCode;
    }
}
