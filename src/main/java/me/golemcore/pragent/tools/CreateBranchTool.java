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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Creates a branch at the tip of another branch. An existing branch is
 * reported as success so the model can carry on.
 */
@Slf4j
public class CreateBranchTool implements ToolComponent {

    public static final String NAME = "create_branch";

    private static final String PARAM_BRANCH_NAME = "branchName";
    private static final String PARAM_FROM_BRANCH = "fromBranch";

    private final RepositoryToolContext context;

    public CreateBranchTool(RepositoryToolContext context) {
        this.context = context;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Create a new branch from the target branch. Must be called before committing any "
                        + "changes.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_BRANCH_NAME, Map.of(
                                        "type", "string",
                                        "description", "Name for the new branch (e.g. 'feature/dark-mode')"),
                                PARAM_FROM_BRANCH, Map.of(
                                        "type", "string",
                                        "description", "Branch to create from (default: "
                                                + context.targetBranch() + ")")),
                        "required", List.of(PARAM_BRANCH_NAME)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Params params = Params.from(parameters, context.targetBranch());
            if (params.branchName() == null) {
                return ToolResult.failure("Parameter \"branchName\" is required");
            }
            context.progress().appendProgress("Creating branch " + params.branchName() + " from "
                    + params.fromBranch() + "...");
            try {
                boolean alreadyExists = context.operations().createBranch(params.branchName(), params.fromBranch());
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("success", true);
                data.put("branchName", params.branchName());
                if (alreadyExists) {
                    data.put("alreadyExists", true);
                    context.progress().appendProgress("Branch " + params.branchName()
                            + " already exists, continuing...");
                } else {
                    context.progress().appendProgress("Branch " + params.branchName() + " created successfully");
                }
                return ToolResult.success("Branch " + params.branchName() + " is ready", data);
            } catch (RuntimeException e) { // NOSONAR - reported back to the model
                log.debug("[Tools] {} failed for {}: {}", NAME, params.branchName(), e.getMessage());
                return ToolResult.failure("Failed to create branch: " + e.getMessage());
            }
        });
    }

    record Params(String branchName, String fromBranch) {
        static Params from(Map<String, Object> arguments, String defaultFrom) {
            return new Params(
                    ToolArguments.stringOrDefault(arguments, PARAM_BRANCH_NAME, null),
                    ToolArguments.stringOrDefault(arguments, PARAM_FROM_BRANCH, defaultFrom));
        }
    }
}
