package me.golemcore.chorus.domain.model;

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

/**
 * Ordered events emitted by a streamed model call. One turn produces a sequence
 * like {@code NewMessage, deltas..., ToolCallRequested..., EndMessage}, repeated
 * for every model round of the tool loop.
 */
public interface LlmEvent {

    /**
     * The model started producing a new assistant message.
     */
    record NewMessage() implements LlmEvent {
    }

    record ContentDelta(String text) implements LlmEvent {
    }

    record ReasoningDelta(String text) implements LlmEvent {
    }

    /**
     * The model asked for a tool; execution is handled by the provider
     * integration.
     */
    record ToolCallRequested(Message.ToolCall call) implements LlmEvent {
    }

    /**
     * A message finished. {@code toolResult} marks the intermediate tool-result
     * message that the provider integration appends to the transcript.
     */
    record EndMessage(LlmResponse response, boolean toolResult) implements LlmEvent {

        public static EndMessage reply(LlmResponse response) {
            return new EndMessage(response, false);
        }

        public static EndMessage ofToolResult(LlmResponse response) {
            return new EndMessage(response, true);
        }
    }
}
