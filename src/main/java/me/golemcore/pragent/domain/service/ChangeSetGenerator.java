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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import me.golemcore.pragent.domain.model.Message;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.system.ModelFallbackRunner;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Asks the model for a complete change set and keeps asking, with the
 * rejection reason attached, until the answer passes validation or the attempt
 * budget is spent.
 */
@Service
@Slf4j
public class ChangeSetGenerator {

    static final String REJECTION_HEADER = "PREVIOUS ATTEMPT WAS REJECTED: ";

    private final ModelFallbackRunner modelRunner;
    private final AgentProperties properties;
    private final ChangeSetParser parser;
    private final ChangeSetValidator validator;
    private final Clock clock;

    public ChangeSetGenerator(ModelFallbackRunner modelRunner, AgentProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.modelRunner = modelRunner;
        this.properties = properties;
        this.parser = new ChangeSetParser(objectMapper);
        this.validator = new ChangeSetValidator();
        this.clock = clock;
    }

    /**
     * @throws ChangeSetGenerationException
     *             when every attempt was rejected
     * @throws RuntimeException
     *             when the model itself could not be reached
     */
    public List<FileChange> generate(TaskRequest request, String repoContext) {
        int maxAttempts = Math.max(1, properties.getGeneration().getMaxAttempts());
        String basePrompt = buildPrompt(request, repoContext);
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String prompt = lastError == null
                    ? basePrompt
                    : basePrompt + "\n\n" + REJECTION_HEADER + lastError
                            + "\nFix the problem and output ONLY the corrected JSON array.";
            LlmResponse response = modelRunner.run(LlmRequest.builder()
                    .messages(List.of(Message.builder()
                            .id(UUID.randomUUID().toString())
                            .role(Message.ROLE_USER)
                            .content(prompt)
                            .timestamp(clock.instant())
                            .build()))
                    .maxTokens(properties.getLlm().getMaxTokens())
                    .temperature(properties.getLlm().getTemperature())
                    .build());

            String content = response != null ? response.getContent() : null;
            try {
                List<FileChange> changes = validator.validate(parser.parse(content));
                log.info("[ChangeSet] Accepted {} change(s) on attempt {}/{}", changes.size(), attempt, maxAttempts);
                return changes;
            } catch (ChangeSetRejectedException e) {
                lastError = e.getMessage();
                log.warn("[ChangeSet] Attempt {}/{} rejected: {}", attempt, maxAttempts, lastError);
            }
        }
        throw new ChangeSetGenerationException(maxAttempts, lastError);
    }

    String buildPrompt(TaskRequest request, String repoContext) {
        AgentProperties.GenerationProperties generation = properties.getGeneration();
        String context = truncate(repoContext != null ? repoContext : "", generation.getMaxContextChars());
        String description = request.descriptionOrEmpty();
        String shortDescription = description.length() > generation.getMaxDescriptionChars()
                ? description.substring(0, generation.getMaxDescriptionChars()) + "..."
                : description;

        return "You are a code generation assistant. Output ONLY valid JSON.\n\n"
                + context + "\n\n"
                + "User request: " + shortDescription + "\n\n"
                + "RULES:\n"
                + "1. Use exact file paths from the structure above\n"
                + "2. For HTML files at root, use \"index.html\" not \"assets/index.html\"\n"
                + "3. Keep changes minimal and focused\n"
                + "4. For adding content to existing files, include the full updated file\n\n"
                + "Output JSON array:\n"
                + "[{\"path\":\"filename\",\"content\":\"file content\",\"action\":\"create|update\"}]\n\n"
                + "Output ONLY the JSON array. Start with [ end with ]";
    }

    private static String truncate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) + "\n..." : text;
    }
}
