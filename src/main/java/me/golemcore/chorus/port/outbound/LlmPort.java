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

import me.golemcore.chorus.domain.model.LlmEvent;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.Provider;
import me.golemcore.chorus.domain.model.ProviderSelection;
import me.golemcore.chorus.domain.model.ThinkingConfig;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for language model calls. Implementations own the network protocol and
 * the tool loop; callers only consume the ordered event stream.
 */
public interface LlmPort {

    /**
     * Streams one agent turn. Errors are signalled through the flux.
     */
    Flux<LlmEvent> stream(LlmRequest request);

    /**
     * Runs a request to completion and returns the final reply.
     */
    default CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return stream(request)
                .filter(LlmEvent.EndMessage.class::isInstance)
                .map(LlmEvent.EndMessage.class::cast)
                .filter(end -> !end.toolResult())
                .map(LlmEvent.EndMessage::response)
                .last(LlmResponse.builder().content("").build())
                .toFuture();
    }

    /**
     * Structured thinking budget for the selected model.
     *
     * @throws me.golemcore.chorus.domain.provider.UnsupportedThinkingException
     *             if the provider has no structured budget API for this model
     */
    ThinkingConfig structuredThinking(ProviderSelection selection, int budgetTokens);

    boolean isProviderConfigured(Provider provider);

    /**
     * Reloads the model registry after a model-not-found failure.
     */
    void refreshModelRegistry();
}
