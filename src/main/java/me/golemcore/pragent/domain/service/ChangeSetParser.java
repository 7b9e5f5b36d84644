package me.golemcore.pragent.domain.service;

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

import java.util.regex.Pattern;

/**
 * Pulls the JSON array out of a model response that may wrap it in markdown
 * fences or surrounding prose.
 */
public class ChangeSetParser {

    private static final Pattern FENCE_OPEN = Pattern.compile("```[a-zA-Z]*\\n?");

    private final ObjectMapper objectMapper;

    public ChangeSetParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ChangeSetRejectedException
     *             when no array can be located or parsed
     */
    public JsonNode parse(String response) {
        String text = stripFences(response != null ? response : "");
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end < start) {
            throw new ChangeSetRejectedException("No JSON array found in model response");
        }
        try {
            return objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ChangeSetRejectedException("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    static String stripFences(String text) {
        return FENCE_OPEN.matcher(text).replaceAll("").trim();
    }
}
