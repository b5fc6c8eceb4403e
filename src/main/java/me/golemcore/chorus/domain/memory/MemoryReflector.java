package me.golemcore.chorus.domain.memory;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.service.AgentPromptService;
import me.golemcore.chorus.domain.service.StructuredOutputParser;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Lets agents promote journal entries to core memories.
 *
 * <p>
 * The agent sees its core memories and its live journal numbered from 1 and
 * answers {@code {"promote": [..]}}. Out-of-range indices are ignored;
 * promoting nothing is the normal outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryReflector {

    private static final String SYSTEM_PROMPT = "You are reflecting on your own memories.";

    private static final String REFLECTION_PROMPT = """
            Below are your permanent core memories followed by your recent journal entries. Journal \
            entries fade after a week unless you keep them.

            Decide which journal entries, if any, deserve to become permanent core memories. Keep an \
            entry only if it is a lasting insight about yourself, the people you talk to or your role, \
            a pattern that will stay relevant, or something you would be worse off forgetting.

            Most entries should fade. Promoting nothing is the usual answer.

            ## Your Core Memories (permanent)
            %s

            ## Recent Journal Entries (fading)
            %s

            ---

            Respond ONLY with valid JSON listing the numbers of the journal entries to promote:
            {"promote": [1, 3]}

            If nothing should be promoted:
            {"promote": []}""";

    private final AgentRepositoryPort agentRepository;
    private final MemoryRepositoryPort memoryRepository;
    private final MemoryContextService memoryContextService;
    private final AgentPromptService promptService;
    private final StructuredOutputParser outputParser;

    /**
     * Reflects every active agent with live journal entries. One agent failing
     * does not stop the sweep.
     *
     * @return total number of promoted entries
     */
    public int sweep() {
        int promoted = 0;
        for (Agent agent : agentRepository.findActive()) {
            try {
                promoted += reflect(agent);
            } catch (RuntimeException e) {
                log.warn("[Reflection] Agent {} failed: {}", agent.getId(), e.getMessage());
            }
        }
        return promoted;
    }

    public int reflect(Agent agent) {
        List<AgentMemory> journal = memoryContextService.liveJournal(agent.getId());
        if (journal.isEmpty()) {
            return 0;
        }
        List<AgentMemory> core = memoryContextService.coreMemories(agent.getId());

        String prompt = String.format(REFLECTION_PROMPT, formatCore(core), formatJournal(journal));
        String reply = promptService.ask(agent, SYSTEM_PROMPT, prompt);

        int promoted = 0;
        for (int index : parseIndices(reply)) {
            if (index < 1 || index > journal.size()) {
                continue;
            }
            AgentMemory memory = journal.get(index - 1);
            if (!memory.isJournal()) {
                continue;
            }
            memory.promoteToCore();
            memoryRepository.update(memory);
            promoted++;
        }
        if (promoted > 0) {
            log.info("[Reflection] Agent {} promoted {} journal entr{} to core", agent.getId(), promoted,
                    promoted == 1 ? "y" : "ies");
        }
        return promoted;
    }

    private Set<Integer> parseIndices(String reply) {
        Optional<JsonNode> json = outputParser.parseLenient(reply);
        if (json.isEmpty()) {
            log.warn("[Reflection] Unparseable reflection reply, promoting nothing");
            return Set.of();
        }
        return new LinkedHashSet<>(outputParser.intArray(json.get(), "promote"));
    }

    private static String formatCore(List<AgentMemory> core) {
        if (core.isEmpty()) {
            return "None yet - you're still forming your identity.";
        }
        return IntStream.range(0, core.size())
                .mapToObj(i -> (i + 1) + ". " + core.get(i).getContent())
                .collect(Collectors.joining("\n"));
    }

    private static String formatJournal(List<AgentMemory> journal) {
        return IntStream.range(0, journal.size())
                .mapToObj(i -> (i + 1) + ". [" + MemoryContextService.DAY_FORMAT.format(journal.get(i).getCreatedAt())
                        + "] " + journal.get(i).getContent())
                .collect(Collectors.joining("\n"));
    }
}
