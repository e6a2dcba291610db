package com.example.musicrecommend.common.exception;

import com.example.musicrecommend.api.response.ApiResponse;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ApiResponse<Void> handleBusinessException(BusinessException e) {
        return ApiResponse.fail(e.getCode(), e.getMessage(), e.getUserAction());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class,
            ConstraintViolationException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ApiResponse<Void> handleValidationException(Exception e) {
        return ApiResponse.fail("400", "Invalid request parameters");
    }

    @ExceptionHandler(ListeningDataException.class)
    public ApiResponse<Void> handleListeningDataException(ListeningDataException e) {
        log.warn("Listening data unavailable, source={}", e.getSource(), e);
        return ApiResponse.fail("503", "Listening data temporarily unavailable", "Retry in a moment");
    }

    @ExceptionHandler(Exception.class)
    public ApiResponse<Void> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return ApiResponse.fail("500", "Internal server error");
    }
}
