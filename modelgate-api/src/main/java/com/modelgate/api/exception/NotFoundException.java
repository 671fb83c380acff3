package com.modelgate.api.exception;

/**
 * 记录不存在
 */
public class NotFoundException extends ModelGateException {

    public static final String NOT_FOUND = "NOT_FOUND";

    public NotFoundException(String message) {
        super(NOT_FOUND, 404, message);
    }
}
