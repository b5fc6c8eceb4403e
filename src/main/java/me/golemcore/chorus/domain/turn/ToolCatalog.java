package me.golemcore.chorus.domain.turn;

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
import me.golemcore.chorus.domain.model.Agent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of chat tools, filtered per agent by its enabled tool set.
 */
@Component
public class ToolCatalog {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolCatalog(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
    }

    public List<ToolComponent> toolsFor(Agent agent) {
        return tools.values().stream()
                .filter(tool -> agent.hasTool(tool.getToolName()))
                .toList();
    }
}
