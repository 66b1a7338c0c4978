package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.UserErrorCode;
import lombok.Getter;

@Getter
public class InvalidDateException extends ClientBaseException {

    private final String rawValue;

    public InvalidDateException(String rawValue) {
        super(UserErrorCode.INVALID_DATE);
        this.rawValue = rawValue;
    }
}
