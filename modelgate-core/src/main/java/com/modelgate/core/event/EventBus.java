package com.modelgate.core.event;

import com.modelgate.api.event.ModelGateEvent;
import com.modelgate.api.event.ModelGateEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 同步事件总线
 * <p>
 * 承载变更追踪与复制过程中的通知：{@link ChangeErrorEvent} (rectify 失败)、
 * {@link ConflictsDetectedEvent} (一次复制发现冲突)。
 * 事件投递给按事件类型及其父类型订阅的监听器，订阅 {@link ModelGateEvent} 即可收到全部事件。
 * 监听器在发布线程上执行，抛出的异常直接传播给发布方。
 * </p>
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends ModelGateEvent>, List<ModelGateEventListener<? extends ModelGateEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends ModelGateEvent> void subscribe(Class<E> eventType, ModelGateEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(listener);
        log.debug("Subscribed listener to {}", eventType.getSimpleName());
    }

    public <E extends ModelGateEvent> void unsubscribe(Class<E> eventType, ModelGateEventListener<E> listener) {
        List<ModelGateEventListener<? extends ModelGateEvent>> registered = listeners.get(eventType);
        if (registered != null && registered.remove(listener)) {
            log.debug("Unsubscribed listener from {}", eventType.getSimpleName());
        }
    }

    public <E extends ModelGateEvent> void publish(E event) {
        List<ModelGateEventListener<? extends ModelGateEvent>> targets = listenersFor(event.getClass());
        if (targets.isEmpty()) {
            log.trace("No listener for {}", event);
            return;
        }
        log.debug("Publishing {} to {} listener(s)", event, targets.size());
        for (ModelGateEventListener<? extends ModelGateEvent> listener : targets) {
            try {
                @SuppressWarnings("unchecked")
                ModelGateEventListener<E> castListener = (ModelGateEventListener<E>) listener;
                castListener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed, propagating: {}", event, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * 按 具体类型 -> 父类 -> {@link ModelGateEvent} 的顺序收集监听器
     */
    private List<ModelGateEventListener<? extends ModelGateEvent>> listenersFor(Class<?> eventClass) {
        List<ModelGateEventListener<? extends ModelGateEvent>> result = new ArrayList<>();
        for (Class<?> type = eventClass; type != null && ModelGateEvent.class.isAssignableFrom(type);
             type = type.getSuperclass()) {
            List<ModelGateEventListener<? extends ModelGateEvent>> registered = listeners.get(type);
            if (registered != null) {
                result.addAll(registered);
            }
        }
        List<ModelGateEventListener<? extends ModelGateEvent>> all = listeners.get(ModelGateEvent.class);
        if (all != null) {
            result.addAll(all);
        }
        return result;
    }
}
