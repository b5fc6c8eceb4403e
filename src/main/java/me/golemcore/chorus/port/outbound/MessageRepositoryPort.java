package me.golemcore.chorus.port.outbound;

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

import me.golemcore.chorus.domain.model.Message;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for chat messages. Ids grow monotonically per store, so "after id"
 * is arrival order.
 */
public interface MessageRepositoryPort {

    Message create(Message message);

    Message update(Message message);

    Optional<Message> findById(Long messageId);

    void delete(Long messageId);

    /**
     * Messages of a chat with id greater than {@code afterId} (all when null),
     * ordered by creation time then id.
     */
    List<Message> findAfter(String chatId, Long afterId);

    Optional<Message> findLatest(String chatId);

    boolean hasHumanMessageSince(String chatId, Instant since);

    boolean existsHumanMessageForAccountSince(String accountId, Instant since);
}
