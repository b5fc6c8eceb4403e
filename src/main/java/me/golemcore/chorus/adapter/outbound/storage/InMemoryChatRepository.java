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
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local chat store.
 */
@Component
public class InMemoryChatRepository implements ChatRepositoryPort {

    private final Map<String, Chat> chats = new ConcurrentHashMap<>();

    @Override
    public Optional<Chat> findById(String chatId) {
        return chatId != null ? Optional.ofNullable(chats.get(chatId)) : Optional.empty();
    }

    @Override
    public Chat save(Chat chat) {
        if (chat.getId() == null) {
            chat.setId(UUID.randomUUID().toString());
        }
        chats.put(chat.getId(), chat);
        return chat;
    }

    @Override
    public List<Chat> findGroupChats() {
        return sorted(chats.values().stream().filter(Chat::isGroupChat).toList());
    }

    @Override
    public List<Chat> findByAccount(String accountId) {
        return sorted(chats.values().stream()
                .filter(chat -> Objects.equals(chat.getAccountId(), accountId))
                .toList());
    }

    @Override
    public List<Chat> findInitiatedBy(String agentId) {
        return sorted(chats.values().stream()
                .filter(chat -> chat.isInitiatedBy(agentId))
                .toList());
    }

    private static List<Chat> sorted(List<Chat> values) {
        return values.stream()
                .sorted(Comparator.comparing(Chat::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }
}
