package com.modelgate.core.event;

import com.modelgate.api.event.AbstractModelGateEvent;
import com.modelgate.api.event.ModelGateEvent;
import com.modelgate.api.event.ModelGateEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventBus 单元测试")
public class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("订阅和发布")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("订阅后应能收到事件")
        void subscriberShouldReceiveEvent() {
            AtomicReference<ChangeErrorEvent> received = new AtomicReference<>();

            eventBus.subscribe(ChangeErrorEvent.class, received::set);
            eventBus.publish(new ChangeErrorEvent("Note", 1, new IllegalStateException("boom")));

            assertNotNull(received.get());
            assertEquals("Note", received.get().getModelName());
            assertEquals("boom", received.get().getError().getMessage());
        }

        @Test
        @DisplayName("不匹配的事件类型不应触发")
        void nonMatchingEventShouldNotTrigger() {
            AtomicInteger count = new AtomicInteger(0);

            eventBus.subscribe(ChangeErrorEvent.class, e -> count.incrementAndGet());
            eventBus.publish(new ConflictsDetectedEvent("Note", "RemoteNote", List.of()));

            assertEquals(0, count.get());
        }

        @Test
        @DisplayName("多个订阅者都应收到事件")
        void multipleSubscribersShouldAllReceive() {
            AtomicInteger count = new AtomicInteger(0);

            eventBus.subscribe(ConflictsDetectedEvent.class, e -> count.incrementAndGet());
            eventBus.subscribe(ConflictsDetectedEvent.class, e -> count.incrementAndGet());

            eventBus.publish(new ConflictsDetectedEvent("Note", "RemoteNote", List.of()));

            assertEquals(2, count.get());
        }

        @Test
        @DisplayName("按父类型订阅可收到变更与冲突事件")
        void supertypeSubscriberShouldReceiveAllEvents() {
            List<String> received = new ArrayList<>();

            eventBus.subscribe(ModelGateEvent.class, e -> received.add("any:" + e.getClass().getSimpleName()));
            eventBus.subscribe(AbstractModelGateEvent.class, e -> received.add("model:" + e.getModelName()));
            eventBus.subscribe(ChangeErrorEvent.class, e -> received.add("change"));

            eventBus.publish(new ChangeErrorEvent("Note", 1, new IllegalStateException()));
            eventBus.publish(new ConflictsDetectedEvent("Note", "RemoteNote", List.of()));

            assertEquals(List.of("change", "model:Note", "any:ChangeErrorEvent",
                    "model:Note", "any:ConflictsDetectedEvent"), received);
        }
    }

    @Test
    @DisplayName("取消订阅后不应收到事件")
    void unsubscribedShouldNotReceive() {
        AtomicInteger count = new AtomicInteger(0);
        ModelGateEventListener<ChangeErrorEvent> listener = e -> count.incrementAndGet();

        eventBus.subscribe(ChangeErrorEvent.class, listener);
        eventBus.publish(new ChangeErrorEvent("Note", 1, new IllegalStateException()));
        eventBus.unsubscribe(ChangeErrorEvent.class, listener);
        eventBus.publish(new ChangeErrorEvent("Note", 1, new IllegalStateException()));

        assertEquals(1, count.get());
    }

    @Test
    @DisplayName("监听器抛出的异常向发布方传播")
    void listenerExceptionShouldPropagate() {
        eventBus.subscribe(ChangeErrorEvent.class, e -> {
            throw new IllegalStateException("veto");
        });

        assertThrows(IllegalStateException.class,
                () -> eventBus.publish(new ChangeErrorEvent("Note", 1, new IllegalStateException())));
    }
}
