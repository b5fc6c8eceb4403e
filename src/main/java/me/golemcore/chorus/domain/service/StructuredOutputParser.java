package me.golemcore.chorus.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lenient reader for JSON objects embedded in model replies. Never throws:
 * callers get {@link Optional#empty()} and fall back to a neutral result.
 */
@Component
@RequiredArgsConstructor
public class StructuredOutputParser {

    private final ObjectMapper objectMapper;

    /**
     * The whole text parsed as one JSON object.
     */
    public Optional<JsonNode> parseStrict(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(text.trim());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Strict parse first, then the first balanced-brace object in the text.
     */
    public Optional<JsonNode> parseLenient(String text) {
        Optional<JsonNode> strict = parseStrict(text);
        if (strict.isPresent()) {
            return strict;
        }
        return extractFirstObject(text).flatMap(this::parseStrict);
    }

    /**
     * First {@code {...}} span with balanced braces, ignoring braces inside JSON
     * strings.
     */
    public Optional<String> extractFirstObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end > start) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    /**
     * Non-blank string elements of an array field; anything else yields an
     * empty list.
     */
    public List<String> stringArray(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node != null ? node.get(field) : null;
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }

    /**
     * Integer elements of an array field, including numeric strings. Values outside
     * the {@code int} range are dropped.
     */
    public List<Integer> intArray(JsonNode node, String field) {
        List<Integer> values = new ArrayList<>();
        JsonNode array = node != null ? node.get(field) : null;
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            if (element.isIntegralNumber()) {
                if (element.canConvertToInt()) {
                    values.add(element.intValue());
                }
            } else if (element.isTextual()) {
                parseInt(element.asText().trim()).ifPresent(values::add);
            }
        }
        return values;
    }

    private static Optional<Integer> parseInt(String text) {
        try {
            return Optional.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
