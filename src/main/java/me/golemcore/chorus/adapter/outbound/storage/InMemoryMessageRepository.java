package me.golemcore.chorus.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local message store with increasing numeric ids.
 *
 * <p>
 * A human message is a user-role message without an authoring agent.
 */
@Component
@RequiredArgsConstructor
public class InMemoryMessageRepository implements MessageRepositoryPort {

    private static final Comparator<Message> CHRONOLOGICAL = Comparator
            .comparing(Message::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Message::getId);

    private final ChatRepositoryPort chatRepository;

    private final Map<Long, Message> messages = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Message create(Message message) {
        message.setId(sequence.incrementAndGet());
        messages.put(message.getId(), message);
        return message;
    }

    @Override
    public Message update(Message message) {
        if (message.getId() == null || !messages.containsKey(message.getId())) {
            throw new IllegalArgumentException("Message not found: " + message.getId());
        }
        messages.put(message.getId(), message);
        return message;
    }

    @Override
    public Optional<Message> findById(Long messageId) {
        return messageId != null ? Optional.ofNullable(messages.get(messageId)) : Optional.empty();
    }

    @Override
    public void delete(Long messageId) {
        if (messageId != null) {
            messages.remove(messageId);
        }
    }

    @Override
    public List<Message> findAfter(String chatId, Long afterId) {
        return messages.values().stream()
                .filter(message -> Objects.equals(message.getChatId(), chatId))
                .filter(message -> afterId == null || message.getId() > afterId)
                .sorted(CHRONOLOGICAL)
                .toList();
    }

    @Override
    public Optional<Message> findLatest(String chatId) {
        return messages.values().stream()
                .filter(message -> Objects.equals(message.getChatId(), chatId))
                .max(CHRONOLOGICAL);
    }

    @Override
    public boolean hasHumanMessageSince(String chatId, Instant since) {
        return messages.values().stream()
                .filter(message -> Objects.equals(message.getChatId(), chatId))
                .anyMatch(message -> isHuman(message) && isAtOrAfter(message, since));
    }

    @Override
    public boolean existsHumanMessageForAccountSince(String accountId, Instant since) {
        return chatRepository.findByAccount(accountId).stream()
                .map(Chat::getId)
                .anyMatch(chatId -> hasHumanMessageSince(chatId, since));
    }

    private static boolean isHuman(Message message) {
        return message.isUserMessage() && message.getAgentId() == null;
    }

    private static boolean isAtOrAfter(Message message, Instant since) {
        return since == null || message.getCreatedAt() != null && !message.getCreatedAt().isBefore(since);
    }
}
