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

import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.LlmRequest;

/**
 * Builds the prompt for an agent turn: system prompt, memory context and
 * transcript.
 */
public interface ContextBuilderPort {

    /**
     * @param initiationReason
     *            why the agent is speaking unprompted, or {@code null}
     */
    LlmRequest.LlmRequestBuilder buildContext(Chat chat, Agent agent, String initiationReason);
}
