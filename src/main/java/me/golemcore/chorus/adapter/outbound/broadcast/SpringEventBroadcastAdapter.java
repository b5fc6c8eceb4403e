package me.golemcore.chorus.adapter.outbound.broadcast;

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

import me.golemcore.chorus.domain.model.RuntimeEvent;
import me.golemcore.chorus.infrastructure.event.SpringEventBus;
import me.golemcore.chorus.port.outbound.BroadcastPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes live chat updates on the in-process event bus. Any transport (web
 * socket, SSE) subscribes with an {@code @EventListener} for
 * {@link RuntimeEvent}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBroadcastAdapter implements BroadcastPort {

    private final SpringEventBus eventBus;

    @Override
    public void broadcast(RuntimeEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) { // NOSONAR - live updates are best effort
            log.warn("[Broadcast] {} for chat {} not delivered: {}", event.type(), event.chatId(), e.getMessage());
        }
    }
}
