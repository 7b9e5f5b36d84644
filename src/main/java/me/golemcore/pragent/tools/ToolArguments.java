package me.golemcore.pragent.tools;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient readers for model-supplied tool arguments. Models regularly
 * stringify nested arrays, or the whole argument object, so string values
 * that look like JSON are parsed again.
 */
public final class ToolArguments {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private ToolArguments() {
    }

    /**
     * Parse raw argument text into an object, unwrapping one level of string
     * encoding.
     *
     * @return the arguments, or empty when the text is not a JSON object
     */
    public static Optional<Map<String, Object>> parseObject(String raw, ObjectMapper objectMapper) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(Map.of());
        }
        try {
            String text = raw.trim();
            if (text.startsWith("\"")) {
                text = objectMapper.readValue(text, String.class).trim();
            }
            if (!text.startsWith("{")) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(text, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static String string(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        return value instanceof String s ? s : String.valueOf(value);
    }

    public static String stringOrDefault(Map<String, Object> arguments, String key, String defaultValue) {
        String value = string(arguments, key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    /**
     * A list argument, re-parsed when it arrived as a JSON string.
     *
     * @return the list, or {@code null} when absent or unparseable
     */
    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, Object> arguments, String key, ObjectMapper objectMapper) {
        Object value = arguments.get(key);
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        if (value instanceof String text && text.trim().startsWith("[")) {
            try {
                return objectMapper.readValue(text.trim(), LIST_TYPE);
            } catch (JsonProcessingException e) {
                return null;
            }
        }
        return null;
    }
}
