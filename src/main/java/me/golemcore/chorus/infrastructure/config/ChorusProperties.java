package me.golemcore.chorus.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties
 * under the {@code chorus.*} prefix.
 *
 * <ul>
 * <li>{@link StreamProperties} - debounce intervals of the reply buffers</li>
 * <li>{@link TurnProperties} - tool loop, quiet tools, retry rules</li>
 * <li>{@link LlmProperties} - provider credentials and routing</li>
 * <li>{@link MemoryProperties} - consolidation, reflection, refinement</li>
 * <li>{@link InitiationProperties} - autonomous initiation sweeps</li>
 * <li>{@link QueueProperties} - background task workers</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chorus")
@Data
public class ChorusProperties {

    private StreamProperties stream = new StreamProperties();
    private TurnProperties turn = new TurnProperties();
    private LlmProperties llm = new LlmProperties();
    private MemoryProperties memory = new MemoryProperties();
    private InitiationProperties initiation = new InitiationProperties();
    private QueueProperties queue = new QueueProperties();

    @Data
    public static class StreamProperties {
        private Duration contentFlushInterval = Duration.ofMillis(200);
        private Duration reasoningFlushInterval = Duration.ofMillis(100);
    }

    @Data
    public static class TurnProperties {
        private List<String> quietTools = new ArrayList<>(List.of("view_system_prompt", "update_system_prompt"));
        private int maxToolRounds = 10;
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class RetryProperties {
        private Duration initialDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private Duration modelNotFoundDelay = Duration.ofSeconds(5);
        private int modelNotFoundAttempts = 2;
        private int badRequestAttempts = 3;
        private int serverErrorAttempts = 3;
        private int rateLimitAttempts = 5;
        private int networkAttempts = 3;
    }

    @Data
    public static class LlmProperties {
        private Duration requestTimeout = Duration.ofSeconds(300);
        private int defaultMaxTokens = 4096;
        private int thinkingResponseHeadroom = 8000;
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
        private Map<String, String> directNamespaces = new LinkedHashMap<>(Map.of(
                "anthropic/", "anthropic",
                "openai/", "openai",
                "google/", "gemini",
                "x-ai/", "xai"));
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class MemoryProperties {
        private Duration idleThreshold = Duration.ofHours(6);
        private int chunkTargetTokens = 100_000;
        private Duration journalWindow = Duration.ofDays(7);
        private int coreTokenBudget = 5000;
        private Duration refinementInterval = Duration.ofDays(7);
        private int refinementMaxOperations = 20;
        private boolean schedulerEnabled = true;
        private Duration consolidationSweepInterval = Duration.ofHours(1);
        private Duration reflectionSweepInterval = Duration.ofHours(24);
        private Duration refinementSweepInterval = Duration.ofHours(24);
    }

    @Data
    public static class InitiationProperties {
        private boolean enabled = true;
        private int cap = 2;
        private int agentOnlyCap = 2;
        private Duration activityWindow = Duration.ofDays(7);
        private int daytimeStartHour = 9;
        private int daytimeEndHour = 20;
        private String timezone = "GMT";
        private Duration maxJitter = Duration.ofMinutes(30);
        private Duration recentlyInitiatedWindow = Duration.ofHours(48);
        private int continuableLimit = 10;
        private int rawResponseLimit = 1000;
        private Duration daytimeSweepInterval = Duration.ofHours(1);
        private Duration backgroundSweepInterval = Duration.ofHours(2);
    }

    @Data
    public static class QueueProperties {
        private int workers = 4;
    }
}
