package com.modelgate.api.event;

/**
 * 框架事件标记接口
 */
public interface ModelGateEvent {
}
