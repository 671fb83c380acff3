package com.modelgate.api.exception;

/**
 * 参数校验异常
 * 例如非法的主体类型、缺失的必要标识。
 *
 * @author ModelGate
 */
public class ValidationException extends ModelGateException {

    public static final String INVALID_PRINCIPAL_TYPE = "INVALID_PRINCIPAL_TYPE";
    public static final String ACCESS_TOKEN_REQUIRED = "ACCESS_TOKEN_REQUIRED";
    public static final String MODEL_NOT_FOUND = "MODEL_NOT_FOUND";
    public static final String SCOPE_NOT_FOUND = "SCOPE_NOT_FOUND";

    public ValidationException(String code, String message) {
        super(code, 400, message);
    }

    public ValidationException(String code, int statusCode, String message) {
        super(code, statusCode, message);
    }
}
