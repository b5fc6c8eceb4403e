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

import me.golemcore.chorus.domain.model.ProviderErrorKind;
import me.golemcore.chorus.domain.model.RetryPolicy;
import me.golemcore.chorus.domain.provider.MissingCapabilityException;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Retry rules for agent turns, one per provider error class.
 */
@Component
@RequiredArgsConstructor
public class TurnRetryPolicy {

    private final ChorusProperties properties;

    public RetryPolicy policy() {
        ChorusProperties.RetryProperties retry = properties.getTurn().getRetry();
        return RetryPolicy.perError(error -> {
            if (error instanceof MissingCapabilityException) {
                return RetryPolicy.Rule.NO_RETRY;
            }
            ProviderErrorKind kind = ProviderErrorClassifier.classify(error);
            return switch (kind) {
            case MODEL_NOT_FOUND -> RetryPolicy.Rule.fixed(retry.getModelNotFoundAttempts(),
                    retry.getModelNotFoundDelay());
            case BAD_REQUEST -> exponential(retry.getBadRequestAttempts(), retry);
            case SERVER_ERROR -> exponential(retry.getServerErrorAttempts(), retry);
            case RATE_LIMIT -> exponential(retry.getRateLimitAttempts(), retry);
            case NETWORK -> exponential(retry.getNetworkAttempts(), retry);
            case UNKNOWN -> RetryPolicy.Rule.NO_RETRY;
            };
        });
    }

    private static RetryPolicy.Rule exponential(int attempts, ChorusProperties.RetryProperties retry) {
        return RetryPolicy.Rule.exponential(attempts, retry.getInitialDelay(), retry.getMultiplier());
    }
}
