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

import lombok.Builder;

/**
 * Extended reasoning parameters attached to a model call. A structured config
 * carries only the budget; raw fallbacks carry provider-specific knobs.
 */
@Builder
public record ThinkingConfig(Mode mode, Integer budgetTokens, String effort, Integer maxTokens,
        Integer maxCompletionTokens) {

    public enum Mode {
        STRUCTURED_BUDGET, RAW_BUDGET, RAW_EFFORT
    }

    public static ThinkingConfig structured(int budgetTokens) {
        return ThinkingConfig.builder()
                .mode(Mode.STRUCTURED_BUDGET)
                .budgetTokens(budgetTokens)
                .build();
    }
}
