package me.golemcore.chorus.adapter.outbound.broadcast;

import me.golemcore.chorus.domain.model.RuntimeEvent;
import me.golemcore.chorus.domain.model.RuntimeEventType;
import me.golemcore.chorus.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringEventBroadcastAdapterTest {

    private ApplicationEventPublisher publisher;
    private SpringEventBroadcastAdapter adapter;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        adapter = new SpringEventBroadcastAdapter(new SpringEventBus(publisher));
    }

    @Test
    void shouldPublishRuntimeEventOnBus() {
        RuntimeEvent event = event();

        adapter.broadcast(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void shouldSwallowDeliveryFailure() {
        doThrow(new IllegalStateException("listener failed")).when(publisher).publishEvent(any(Object.class));

        assertDoesNotThrow(() -> adapter.broadcast(event()));
    }

    private static RuntimeEvent event() {
        return new RuntimeEvent(RuntimeEventType.STREAM_CONTENT, Instant.parse("2026-03-02T10:00:00Z"), "chat-1",
                7L, "ada", Map.of("content", "Hel"));
    }
}
