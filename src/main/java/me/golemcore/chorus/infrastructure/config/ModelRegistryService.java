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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of known models loaded from {@code classpath:models.json}.
 *
 * <p>
 * Maps logical model ids (e.g. {@code anthropic/claude-sonnet-4}) to the id the
 * direct provider expects and records per-model capabilities. Reloaded when a
 * provider reports an unknown model.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelRegistryService {

    private static final String CONFIG_FILE = "models.json";

    private final ObjectMapper objectMapper;
    private volatile ModelsConfig config = new ModelsConfig();

    public ModelRegistryService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Reload the registry from the classpath. Keeps the previous registry when
     * the file is missing or unreadable.
     */
    public void reload() {
        ClassPathResource resource = new ClassPathResource(CONFIG_FILE);
        if (!resource.exists()) {
            log.warn("[ModelRegistry] No {} found, keeping {} models", CONFIG_FILE, config.getModels().size());
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            config = objectMapper.readValue(is, ModelsConfig.class);
            log.info("[ModelRegistry] Loaded {} models", config.getModels().size());
        } catch (IOException e) {
            log.warn("[ModelRegistry] Failed to load {}: {}", CONFIG_FILE, e.getMessage());
        }
    }

    public Optional<ModelSettings> find(String logicalModelId) {
        if (logicalModelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(config.getModels().get(logicalModelId));
    }

    /**
     * Id understood by the direct provider, when the model has a direct mapping.
     */
    public Optional<String> findProviderModelId(String logicalModelId) {
        return find(logicalModelId)
                .map(ModelSettings::getProviderModelId)
                .filter(id -> !id.isBlank());
    }

    public boolean supportsStructuredThinking(String logicalModelId) {
        return find(logicalModelId).map(ModelSettings::isStructuredThinking).orElse(false);
    }

    public boolean supportsTemperature(String logicalModelId) {
        return find(logicalModelId).map(ModelSettings::isSupportsTemperature).orElse(true);
    }

    public Map<String, ModelSettings> getAllModels() {
        return config.getModels();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private Map<String, ModelSettings> models = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSettings {
        private String providerModelId;
        private String displayName;
        private boolean supportsTemperature = true;
        private boolean structuredThinking;
        private int maxOutputTokens = 8192;
    }
}
