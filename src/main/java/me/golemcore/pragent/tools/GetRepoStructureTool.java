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
import me.golemcore.pragent.domain.model.RepositoryEntry;
import me.golemcore.pragent.domain.model.ToolDefinition;
import me.golemcore.pragent.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the immediate children of a repository directory.
 */
@Slf4j
public class GetRepoStructureTool implements ToolComponent {

    public static final String NAME = "get_repo_structure";

    private static final String PARAM_PATH = "path";

    private final RepositoryToolContext context;

    public GetRepoStructureTool(RepositoryToolContext context) {
        this.context = context;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the file and directory structure of the repository. Returns a list of paths "
                        + "with their types (file or dir). Use this first to understand the project layout.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "Subpath to list (e.g. 'src' or '' for root)")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Params params = Params.from(parameters);
            context.progress().appendProgress("Listing repository structure at "
                    + (params.path().isEmpty() ? "root" : params.path()) + "...");
            try {
                List<Map<String, String>> structure = context.operations().listDirectory(params.path()).stream()
                        .map(GetRepoStructureTool::toItem)
                        .toList();
                context.progress().appendProgress("Found " + structure.size() + " items");
                return ToolResult.success(structure.size() + " items", Map.of("structure", structure));
            } catch (RuntimeException e) { // NOSONAR - reported back to the model
                log.debug("[Tools] {} failed: {}", NAME, e.getMessage());
                return ToolResult.failure("Failed to list " + (params.path().isEmpty() ? "root" : params.path())
                        + ": " + e.getMessage());
            }
        });
    }

    private static Map<String, String> toItem(RepositoryEntry entry) {
        return Map.of(
                "path", entry.path() != null ? entry.path() : "",
                "type", entry.type() != null ? entry.type() : "");
    }

    record Params(String path) {
        static Params from(Map<String, Object> arguments) {
            return new Params(ToolArguments.stringOrDefault(arguments, PARAM_PATH, ""));
        }
    }
}
