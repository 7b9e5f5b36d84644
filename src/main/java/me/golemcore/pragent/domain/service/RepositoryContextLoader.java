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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.component.ProgressSink;
import me.golemcore.pragent.domain.model.RepositoryEntry;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Builds the repository summary handed to the change-set generator: the root
 * listing expanded one level deep, plus the beginning of {@code index.html}
 * and {@code README.md} when they exist. Every read is best-effort.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RepositoryContextLoader {

    private static final String DIR = "dir";

    private final AgentProperties properties;

    public String load(RepositoryOperations operations, ProgressSink progress) {
        progress.appendProgress("Fetching repository contents...");
        StringBuilder context = new StringBuilder();
        try {
            List<RepositoryEntry> root = operations.listDirectory("");
            context.append("Repository structure:\n");
            for (RepositoryEntry entry : root) {
                context.append("- ").append(entry.path()).append(" (").append(entry.type()).append(")\n");
                if (DIR.equals(entry.type())) {
                    appendChildren(operations, entry.path(), context);
                }
            }
        } catch (RuntimeException e) { // NOSONAR - an empty context is acceptable
            log.warn("[PlanExec] Could not list {}: {}", operations.getLocator().fullName(), e.getMessage());
            progress.appendProgress("Note: Could not fetch repo contents: " + e.getMessage());
            return context.toString();
        }

        AgentProperties.GenerationProperties generation = properties.getGeneration();
        readHead(operations, "index.html", generation.getMaxIndexHtmlChars()).ifPresent(text -> context
                .append("\nindex.html exists at root (first ").append(generation.getMaxIndexHtmlChars())
                .append(" chars):\n").append(text).append("...\n"));
        readHead(operations, "README.md", generation.getMaxReadmeChars()).ifPresent(text -> context
                .append("\nREADME.md:\n").append(text).append('\n'));

        progress.appendProgress("Repository contents fetched");
        return context.toString();
    }

    private void appendChildren(RepositoryOperations operations, String path, StringBuilder context) {
        try {
            for (RepositoryEntry child : operations.listDirectory(path)) {
                context.append("  - ").append(child.path()).append(" (").append(child.type()).append(")\n");
            }
        } catch (RuntimeException e) { // NOSONAR - skip unreadable directories
            log.debug("[PlanExec] Skipping directory {}: {}", path, e.getMessage());
        }
    }

    private Optional<String> readHead(RepositoryOperations operations, String path, int maxChars) {
        try {
            String text = operations.readFile(path, null);
            if (text == null || text.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(text.length() > maxChars ? text.substring(0, maxChars) : text);
        } catch (RuntimeException e) { // NOSONAR - optional context file
            log.debug("[PlanExec] {} not available: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
