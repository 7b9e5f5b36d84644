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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.component.ToolComponent;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.ToolDefinition;
import me.golemcore.pragent.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Commits a batch of complete-file changes to a branch, one commit per file.
 *
 * <p>
 * Malformed entries are dropped with a progress note, the batch is capped,
 * and each file succeeds or fails on its own; the per-file outcome is returned
 * to the model.
 */
@Slf4j
public class CommitFilesTool implements ToolComponent {

    public static final String NAME = "commit_files";

    private static final String PARAM_BRANCH_NAME = "branchName";
    private static final String PARAM_CHANGES = "changes";
    private static final String FIELD_PATH = "path";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_ACTION = "action";
    private static final String STATUS_OK = "ok";
    private static final String STATUS_ERROR = "error";
    private static final String STATUS_SKIPPED = "skipped";

    private final RepositoryToolContext context;
    private final ObjectMapper objectMapper;

    public CommitFilesTool(RepositoryToolContext context, ObjectMapper objectMapper) {
        this.context = context;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Commit one or more file changes to a branch. IMPORTANT: For 'update' actions, you "
                        + "MUST include the COMPLETE file content with your modifications added to the existing "
                        + "code. Never delete existing code unless explicitly requested. Read the file first, "
                        + "then modify it, then commit the full modified version.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_BRANCH_NAME, Map.of(
                                        "type", "string",
                                        "description", "Branch to commit to"),
                                PARAM_CHANGES, Map.of(
                                        "type", "array",
                                        "description", "List of file changes to apply",
                                        "items", Map.of(
                                                "type", "object",
                                                "properties", Map.of(
                                                        FIELD_PATH, Map.of(
                                                                "type", "string",
                                                                "description", "File path to create or update"),
                                                        FIELD_CONTENT, Map.of(
                                                                "type", "string",
                                                                "description", "Complete file content (for "
                                                                        + "updates: existing code + modifications)"),
                                                        FIELD_ACTION, Map.of(
                                                                "type", "string",
                                                                "enum", List.of("create", "update"),
                                                                "description", "Whether to create a new file or "
                                                                        + "update an existing one")),
                                                "required", List.of(FIELD_PATH, FIELD_CONTENT, FIELD_ACTION)))),
                        "required", List.of(PARAM_BRANCH_NAME, PARAM_CHANGES)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String branch = ToolArguments.stringOrDefault(parameters, PARAM_BRANCH_NAME, context.featureBranch());
            List<Object> rawChanges = ToolArguments.list(parameters, PARAM_CHANGES, objectMapper);
            if (rawChanges == null || rawChanges.isEmpty()) {
                return ToolResult.failure("No changes provided or the 'changes' value could not be parsed. "
                        + "Ensure 'changes' is a JSON array (not a string) with entries like: "
                        + "[{\"path\":\"file.css\",\"content\":\"body{background:black}\",\"action\":\"update\"}]");
            }

            List<FileChange> valid = filterValid(rawChanges);
            if (valid.isEmpty()) {
                return ToolResult.failure("All change entries were invalid (missing path or content). "
                        + "Each entry must have: path (string), content (string), action ('create' | 'update').");
            }

            int cap = context.maxChangesPerCommit();
            if (valid.size() > cap) {
                context.progress().appendProgress("Warning: " + valid.size() + " changes requested, limiting to "
                        + "first " + cap + ". Commit in smaller batches if you need more.");
                valid = valid.subList(0, cap);
            }

            return commitAll(branch, valid);
        });
    }

    private List<FileChange> filterValid(List<Object> rawChanges) {
        List<FileChange> valid = new ArrayList<>();
        for (Object raw : rawChanges) {
            if (!(raw instanceof Map<?, ?> entry)) {
                context.progress().appendProgress("Skipping invalid change entry (not an object)");
                continue;
            }
            Object path = entry.get(FIELD_PATH);
            if (!(path instanceof String pathText) || pathText.isBlank()) {
                context.progress().appendProgress("Skipping invalid change entry (missing path)");
                continue;
            }
            Object content = entry.get(FIELD_CONTENT);
            if (!(content instanceof String contentText)) {
                context.progress().appendProgress("Skipping " + pathText + ": missing content");
                continue;
            }
            Object actionValue = entry.get(FIELD_ACTION);
            FileChange.Action action = actionValue instanceof String a ? FileChange.Action.fromValue(a) : null;
            valid.add(new FileChange(pathText.trim(), contentText,
                    action != null ? action : FileChange.Action.UPDATE));
        }
        return valid;
    }

    private ToolResult commitAll(String branch, List<FileChange> changes) {
        List<Map<String, Object>> results = new ArrayList<>();
        int successCount = 0;
        int errorCount = 0;
        for (FileChange change : changes) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(FIELD_PATH, change.getPath());
            if (change.getAction() == FileChange.Action.DELETE) {
                context.progress().appendProgress("Skipping " + change.getPath() + ": deleting files is not "
                        + "supported");
                result.put("status", STATUS_SKIPPED);
                result.put(STATUS_ERROR, "Deleting files is not supported");
                results.add(result);
                continue;
            }
            context.progress().appendProgress((change.getAction() == FileChange.Action.CREATE ? "Creating "
                    : "Updating ") + change.getPath() + "...");
            try {
                context.operations().commitFile(change, branch, context.description());
                result.put("status", STATUS_OK);
                successCount++;
                context.progress().appendProgress(change.getPath() + " committed successfully");
            } catch (RuntimeException e) { // NOSONAR - one failed file must not abort the batch
                result.put("status", STATUS_ERROR);
                result.put(STATUS_ERROR, e.getMessage());
                errorCount++;
                log.debug("[Tools] {} failed for {}: {}", NAME, change.getPath(), e.getMessage());
                context.progress().appendProgress("Error: " + change.getPath() + " failed - " + e.getMessage());
            }
            results.add(result);
        }
        context.progress().appendProgress("Committed " + successCount + " file(s), " + errorCount + " error(s)");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("results", results);
        data.put("successCount", successCount);
        data.put("errorCount", errorCount);
        return ToolResult.success("Committed " + successCount + " file(s), " + errorCount + " error(s)", data);
    }
}
