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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.component.ToolComponent;
import me.golemcore.pragent.domain.model.ToolDefinition;
import me.golemcore.pragent.domain.model.ToolResult;
import me.golemcore.pragent.port.outbound.GitHubApiException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the full decoded text of a repository file.
 *
 * <p>
 * A missing file produces an instruction to list the repository instead of
 * guessing another path.
 */
@Slf4j
public class ReadFileTool implements ToolComponent {

    public static final String NAME = "read_file";

    private static final String PARAM_PATH = "path";
    private static final String PARAM_REF = "ref";
    private static final int LARGE_FILE_CHARS = 10_000;

    private final RepositoryToolContext context;

    public ReadFileTool(RepositoryToolContext context) {
        this.context = context;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Read the contents of a file from the repository. IMPORTANT: You MUST only use paths "
                        + "that were returned by get_repo_structure. NEVER guess or invent paths. Always read a "
                        + "file BEFORE modifying it to preserve existing code.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "Full path to the file (e.g. 'index.html' or 'src/main.ts')"),
                                PARAM_REF, Map.of(
                                        "type", "string",
                                        "description", "Optional branch or ref to read from")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Params params = Params.from(parameters);
            if (params.path() == null) {
                return ToolResult.failure("Parameter \"path\" is required");
            }
            context.progress().appendProgress("Reading " + params.path()
                    + (params.ref() != null ? " from " + params.ref() : "") + "...");
            try {
                String content = context.operations().readFile(params.path(), params.ref());
                if (content.length() > LARGE_FILE_CHARS) {
                    context.progress().appendProgress("File " + params.path() + " is very large ("
                            + content.length() + " chars)");
                }
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("path", params.path());
                data.put("content", content);
                data.put("truncated", false);
                data.put("length", content.length());
                return ToolResult.success(content, data);
            } catch (RuntimeException e) { // NOSONAR - reported back to the model
                if (GitHubApiException.isNotFound(e)) {
                    return ToolResult.failure(notFoundMessage(params.path()));
                }
                log.debug("[Tools] {} failed for {}: {}", NAME, params.path(), e.getMessage());
                return ToolResult.failure("Failed to read " + params.path() + ": " + e.getMessage());
            }
        });
    }

    static String notFoundMessage(String path) {
        return "File \"" + path + "\" does not exist in the repository. Do NOT guess another path. "
                + "Call get_repo_structure to see the actual files, then read one that exists.";
    }

    record Params(String path, String ref) {
        static Params from(Map<String, Object> arguments) {
            return new Params(
                    ToolArguments.stringOrDefault(arguments, PARAM_PATH, null),
                    ToolArguments.stringOrDefault(arguments, PARAM_REF, null));
        }
    }
}
