package com.kirimba.userapi.error.exception;

import com.kirimba.userapi.error.UserErrorCode;
import lombok.Getter;

@Getter
public class UserNotFoundException extends ClientBaseException {

    private final Integer userId;

    public UserNotFoundException(Integer userId) {
        super(UserErrorCode.USER_NOT_FOUND);
        this.userId = userId;
    }
}
