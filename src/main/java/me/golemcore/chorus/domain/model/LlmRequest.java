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

import me.golemcore.chorus.domain.component.ToolComponent;
import me.golemcore.chorus.domain.component.ToolContext;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-agnostic model call. Tools are passed as executable components: the
 * provider integration runs them and feeds the results back to the model.
 */
@Data
@Builder(toBuilder = true)
public class LlmRequest {

    private ProviderSelection provider;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolComponent> tools = new ArrayList<>();

    private ToolContext toolContext;
    private ThinkingConfig thinking;
    private Double temperature;
    private Integer maxTokens;

    public String modelId() {
        return provider != null ? provider.modelId() : null;
    }
}
