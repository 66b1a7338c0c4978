package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.ErrorCode;

/**
 * Внутренняя ошибка сервера (5xx). Причина логируется целиком,
 * клиенту уходит только обобщённое сообщение из {@link ErrorCode}.
 */
public abstract class ServerBaseException extends BaseException {

    protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode, cause, args);
    }
}
