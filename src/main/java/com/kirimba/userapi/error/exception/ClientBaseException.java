package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.ErrorCode;

/**
 * Ошибка клиента (4xx): неверный ввод или отсутствующий ресурс.
 * Логируется как warn, не как сбой сервера.
 */
public abstract class ClientBaseException extends BaseException {

    protected ClientBaseException(ErrorCode errorCode) {
        super(errorCode);
    }
}
