package com.kirimba.userapi.error;

import com.kirimba.userapi.error.dto.ErrorResponse;
import com.kirimba.userapi.error.exception.BaseException;
import com.kirimba.userapi.filter.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.List;

/**
 * Переводит исключения в HTTP статусы и единый конверт {@link ErrorResponse}.
 * Тексты 5xx ошибок обобщённые: детали остаются только в логе.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String USER_ID_PARAMETER = "id";

    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e, HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Server Exception: {} | Message: {}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("Business Exception: {} | Message: {}", errorCode.getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(errorCode.getStatus(), e.getMessage(),
                RequestIdFilter.currentRequestId(request), List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    protected ResponseEntity<ErrorResponse> handleBodyValidation(MethodArgumentNotValidException e,
                                                                 HttpServletRequest request) {
        List<String> details = new ArrayList<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            details.add(fieldError.getField() + " validation failed on " + fieldError.getCode());
        }
        log.warn("Validation failed: {}", details);
        return ErrorResponse.toResponseEntity(UserErrorCode.VALIDATION_FAILED,
                RequestIdFilter.currentRequestId(request), details);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    protected ResponseEntity<ErrorResponse> handleParameterValidation(HandlerMethodValidationException e,
                                                                      HttpServletRequest request) {
        List<String> details = new ArrayList<>();
        e.getParameterValidationResults().forEach(result -> {
            RequestParam requestParam = result.getMethodParameter().getParameterAnnotation(RequestParam.class);
            String name = requestParam != null && !requestParam.name().isEmpty()
                    ? requestParam.name()
                    : result.getMethodParameter().getParameterName();
            for (MessageSourceResolvable error : result.getResolvableErrors()) {
                details.add(name + " validation failed on " + constraintName(error));
            }
        });
        log.warn("Invalid pagination parameters: {}", details);
        return ErrorResponse.toResponseEntity(UserErrorCode.INVALID_PAGINATION,
                RequestIdFilter.currentRequestId(request), details);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    protected ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                               HttpServletRequest request) {
        UserErrorCode errorCode = USER_ID_PARAMETER.equals(e.getName())
                ? UserErrorCode.INVALID_USER_ID
                : UserErrorCode.INVALID_PAGINATION;
        log.warn("Type mismatch for parameter '{}': {}", e.getName(), e.getValue());
        return ErrorResponse.toResponseEntity(errorCode, RequestIdFilter.currentRequestId(request));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    protected ResponseEntity<ErrorResponse> handleUnreadableBody(Exception e, HttpServletRequest request) {
        log.warn("Failed to parse request body: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(UserErrorCode.INVALID_REQUEST_BODY,
                RequestIdFilter.currentRequestId(request));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    protected ResponseEntity<ErrorResponse> handleRouting(Exception e, HttpServletRequest request) {
        org.springframework.web.ErrorResponse routingError = (org.springframework.web.ErrorResponse) e;
        String title = routingError.getBody().getTitle();
        return ErrorResponse.toResponseEntity(routingError.getStatusCode(), title != null ? title : "Request failed",
                RequestIdFilter.currentRequestId(request), List.of());
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e, HttpServletRequest request) {
        log.error("Unexpected System Failure: ", e);
        return ErrorResponse.toResponseEntity(UserErrorCode.INTERNAL_SERVER_ERROR,
                RequestIdFilter.currentRequestId(request));
    }

    private static String constraintName(MessageSourceResolvable error) {
        String[] codes = error.getCodes();
        if (codes == null || codes.length == 0) {
            return "constraint";
        }
        return codes[codes.length - 1];
    }
}
