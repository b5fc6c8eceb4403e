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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A configured AI participant. Only {@link #lastRefinementAt} is written by the
 * runtime; everything else is managed externally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    private String id;
    private String accountId;
    private String name;
    private String systemPrompt;
    private String modelId;

    private Integer thinkingBudget;

    @Builder.Default
    private List<String> enabledTools = new ArrayList<>();

    private Integer initiationCap;

    @Builder.Default
    private boolean active = true;

    private Instant lastRefinementAt;

    public boolean isThinkingEnabled() {
        return thinkingBudget != null && thinkingBudget > 0;
    }

    public boolean hasTool(String toolName) {
        return enabledTools != null && enabledTools.contains(toolName);
    }
}
