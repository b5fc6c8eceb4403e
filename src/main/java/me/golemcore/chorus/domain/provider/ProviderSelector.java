package me.golemcore.chorus.domain.provider;

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
import me.golemcore.chorus.domain.model.Provider;
import me.golemcore.chorus.domain.model.ProviderSelection;
import me.golemcore.chorus.domain.model.ThinkingConfig;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.infrastructure.config.ModelRegistryService;
import me.golemcore.chorus.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Maps logical model ids to concrete providers and configures extended
 * reasoning.
 *
 * <p>
 * Models under a direct namespace ({@code anthropic/}, {@code openai/}, ...) go
 * to that provider's own API when it has a credential and the registry knows
 * the provider-side id. Everything else goes through OpenRouter with the
 * logical id unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderSelector {

    static final int LOW_EFFORT_MAX_BUDGET = 2000;
    static final int MEDIUM_EFFORT_MAX_BUDGET = 15000;

    private final ChorusProperties properties;
    private final ModelRegistryService modelRegistry;
    private final LlmPort llmPort;

    public ProviderSelection select(String modelId) {
        Optional<Provider> direct = directProviderFor(modelId);
        if (direct.isPresent() && llmPort.isProviderConfigured(direct.get())) {
            Optional<String> providerModelId = modelRegistry.findProviderModelId(modelId);
            if (providerModelId.isPresent()) {
                return new ProviderSelection(direct.get(), providerModelId.get(), modelId);
            }
            log.debug("[Provider] No direct mapping for {}, using aggregation provider", modelId);
        }
        return new ProviderSelection(Provider.OPENROUTER, modelId, modelId);
    }

    /**
     * Selection for an agent turn. Extended reasoning needs the direct
     * integration of the model's family.
     *
     * @throws MissingCapabilityException
     *             if the agent wants thinking but the direct provider has no
     *             credential
     */
    public ProviderSelection selectForAgent(Agent agent) {
        ProviderSelection selection = select(agent.getModelId());
        if (agent.isThinkingEnabled() && !selection.isDirect()) {
            Optional<Provider> direct = directProviderFor(agent.getModelId());
            if (direct.isPresent() && !llmPort.isProviderConfigured(direct.get())) {
                throw new MissingCapabilityException("Extended thinking for " + agent.getModelId()
                        + " requires a " + direct.get().key() + " API key");
            }
        }
        return selection;
    }

    /**
     * Tries the structured budget API first, then provider-specific raw
     * parameters.
     *
     * @throws UnsupportedThinkingException
     *             for providers without a raw fallback
     */
    public ThinkingConfig configureThinking(ProviderSelection selection, int budgetTokens) {
        try {
            return llmPort.structuredThinking(selection, budgetTokens);
        } catch (UnsupportedThinkingException e) {
            int headroom = properties.getLlm().getThinkingResponseHeadroom();
            return switch (selection.provider()) {
            case ANTHROPIC -> ThinkingConfig.builder()
                    .mode(ThinkingConfig.Mode.RAW_BUDGET)
                    .budgetTokens(budgetTokens)
                    .maxTokens(budgetTokens + headroom)
                    .build();
            case OPENAI, OPENROUTER -> ThinkingConfig.builder()
                    .mode(ThinkingConfig.Mode.RAW_EFFORT)
                    .effort(effortFor(budgetTokens))
                    .maxCompletionTokens(budgetTokens + headroom)
                    .build();
            default -> throw e;
            };
        }
    }

    static String effortFor(int budgetTokens) {
        if (budgetTokens <= LOW_EFFORT_MAX_BUDGET) {
            return "low";
        }
        if (budgetTokens <= MEDIUM_EFFORT_MAX_BUDGET) {
            return "medium";
        }
        return "high";
    }

    private Optional<Provider> directProviderFor(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : properties.getLlm().getDirectNamespaces().entrySet()) {
            if (modelId.startsWith(entry.getKey())) {
                return Optional.of(Provider.fromKey(entry.getValue()));
            }
        }
        return Optional.empty();
    }
}
