package me.golemcore.chorus.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Live-update event broadcast on a chat channel.
 */
@Builder
public record RuntimeEvent(RuntimeEventType type, Instant timestamp, String chatId, Long messageId,
        String agentId, Map<String, Object> payload) {
}
