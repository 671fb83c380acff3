package com.modelgate.api.event;

/**
 * 事件监听器接口
 *
 * @param <E> 监听的事件类型
 * @author ModelGate
 */
@FunctionalInterface
public interface ModelGateEventListener<E extends ModelGateEvent> {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(E event);
}
