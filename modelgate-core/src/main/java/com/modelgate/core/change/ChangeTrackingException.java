package com.modelgate.core.change;

import com.modelgate.api.exception.ModelGateException;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 批量 rectify 失败，聚合了每条记录的异常
 */
@Getter
public class ChangeTrackingException extends ModelGateException {

    public static final String CHANGE_TRACKING_FAILED = "CHANGE_TRACKING_FAILED";

    /**
     * modelId -> 异常
     */
    private final transient Map<Object, Throwable> errors;

    public ChangeTrackingException(String message, Map<Object, Throwable> errors) {
        super(CHANGE_TRACKING_FAILED, 500, message);
        this.errors = errors;
        errors.values().forEach(this::addSuppressed);
    }

    public List<Object> getFailedIds() {
        return List.copyOf(errors.keySet());
    }
}
