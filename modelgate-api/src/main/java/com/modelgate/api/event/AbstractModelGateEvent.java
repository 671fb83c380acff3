package com.modelgate.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 框架事件基类
 */
@Getter
public abstract class AbstractModelGateEvent implements ModelGateEvent, Serializable {
    private final long timestamp;
    private final String modelName;

    protected AbstractModelGateEvent(String modelName) {
        this.timestamp = System.currentTimeMillis();
        this.modelName = modelName;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[model=" + modelName + ", timestamp=" + timestamp + "]";
    }
}
