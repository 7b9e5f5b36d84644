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
import me.golemcore.pragent.domain.service.PreflightCheckException;
import me.golemcore.pragent.domain.service.RepositoryOperations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens the pull request once the feature branch has commits ahead of the
 * base branch.
 */
@Slf4j
public class CreatePullRequestTool implements ToolComponent {

    public static final String NAME = "create_pull_request";

    private static final String PARAM_BRANCH_NAME = "branchName";
    private static final String PARAM_TARGET_BRANCH = "targetBranch";
    private static final String PARAM_TITLE = "title";
    private static final int TITLE_CHARS = 100;

    private final RepositoryToolContext context;

    public CreatePullRequestTool(RepositoryToolContext context) {
        this.context = context;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Create a pull request from a branch to the target branch. Call this after all files "
                        + "are committed.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_BRANCH_NAME, Map.of(
                                        "type", "string",
                                        "description", "Source branch for the PR"),
                                PARAM_TARGET_BRANCH, Map.of(
                                        "type", "string",
                                        "description", "Target branch (default: " + context.targetBranch() + ")"),
                                PARAM_TITLE, Map.of(
                                        "type", "string",
                                        "description", "PR title (defaults to description)")),
                        "required", List.of(PARAM_BRANCH_NAME)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Params params = Params.from(parameters, context);
            context.progress().appendProgress("Checking for commits between " + params.targetBranch() + " and "
                    + params.branchName() + "...");
            try {
                RepositoryOperations.PullRequestOutcome outcome = context.operations().openPullRequest(
                        params.branchName(), params.targetBranch(), params.title(), body(context.description()));

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("success", true);
                data.put("prUrl", outcome.prUrl());
                data.put("branchName", params.branchName());
                if (outcome.alreadyExists()) {
                    data.put("alreadyExists", true);
                    context.progress().appendProgress("A pull request already exists for this branch, treating "
                            + "as success.");
                } else {
                    data.put("prNumber", outcome.number());
                    context.progress().appendProgress("Pull request created successfully!");
                }
                return ToolResult.success(outcome.prUrl(), data);
            } catch (PreflightCheckException e) {
                return ToolResult.failure(e.getMessage());
            } catch (RuntimeException e) { // NOSONAR - reported back to the model
                log.debug("[Tools] {} failed for {}: {}", NAME, params.branchName(), e.getMessage());
                return ToolResult.failure("Failed to create pull request: " + e.getMessage());
            }
        });
    }

    static String body(String description) {
        return "## Summary\n\n" + description + "\n\n---\n*Created by GolemCore PR Agent*";
    }

    static String defaultTitle(String description) {
        return description.length() > TITLE_CHARS ? description.substring(0, TITLE_CHARS) : description;
    }

    record Params(String branchName, String targetBranch, String title) {
        static Params from(Map<String, Object> arguments, RepositoryToolContext context) {
            return new Params(
                    ToolArguments.stringOrDefault(arguments, PARAM_BRANCH_NAME, context.featureBranch()),
                    ToolArguments.stringOrDefault(arguments, PARAM_TARGET_BRANCH, context.targetBranch()),
                    ToolArguments.stringOrDefault(arguments, PARAM_TITLE, defaultTitle(context.description())));
        }
    }
}
