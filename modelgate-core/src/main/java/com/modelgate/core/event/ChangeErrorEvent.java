package com.modelgate.core.event;

import com.modelgate.api.event.AbstractModelGateEvent;
import lombok.Getter;

/**
 * rectify 失败
 */
@Getter
public class ChangeErrorEvent extends AbstractModelGateEvent {

    private final Object modelId;
    private final transient Throwable error;

    public ChangeErrorEvent(String modelName, Object modelId, Throwable error) {
        super(modelName);
        this.modelId = modelId;
        this.error = error;
    }
}
