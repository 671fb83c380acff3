package com.modelgate.api.exception;

import lombok.Getter;

/**
 * ModelGate 基础异常
 * <p>
 * 携带稳定的 code 与 HTTP 风格的 statusCode，供外部调用方原样透出。
 * </p>
 *
 * @author ModelGate
 */
@Getter
public class ModelGateException extends RuntimeException {

    private final String code;
    private final int statusCode;

    public ModelGateException(String message) {
        this(null, 500, message);
    }

    public ModelGateException(String message, Throwable cause) {
        this(null, 500, message, cause);
    }

    public ModelGateException(String code, int statusCode, String message) {
        super(message);
        this.code = code;
        this.statusCode = statusCode;
    }

    public ModelGateException(String code, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
    }
}
