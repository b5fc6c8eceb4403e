package me.golemcore.chorus.domain.component;

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

import me.golemcore.chorus.domain.model.ToolDefinition;
import me.golemcore.chorus.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool an agent can call during a model round.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool on behalf of the calling agent.
     *
     * @param context
     *            agent and chat the call belongs to
     * @param parameters
     *            the arguments produced by the model
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
