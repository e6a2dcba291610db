package com.example.musicrecommend.common.exception;

/**
 * Request-level failure reported to API clients as {@code ApiResponse.fail(code, message)}.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException badRequest(String message) {
        return new BusinessException("400", message, "Check the request parameters and retry");
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
