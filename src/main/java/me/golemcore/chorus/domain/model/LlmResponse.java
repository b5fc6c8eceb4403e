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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Terminal payload of one model completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmResponse {

    public static final String FINISH_STOP = "STOP";

    private String content;
    private String reasoning;
    private String model;
    private LlmUsage usage;
    private String finishReason;
    private List<Message.ToolCall> toolCalls;
    private Map<String, Object> raw;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public int outputTokens() {
        return usage != null ? usage.getOutputTokens() : 0;
    }

    public int inputTokens() {
        return usage != null ? usage.getInputTokens() : 0;
    }

    public String normalizedFinishReason() {
        return finishReason != null ? finishReason.toUpperCase(Locale.ROOT) : null;
    }
}
