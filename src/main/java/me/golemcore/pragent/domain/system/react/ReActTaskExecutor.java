package me.golemcore.pragent.domain.system.react;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.component.ToolComponent;
import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import me.golemcore.pragent.domain.model.Message;
import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.model.TaskStatus;
import me.golemcore.pragent.domain.model.ToolCallRecord;
import me.golemcore.pragent.domain.model.ToolResult;
import me.golemcore.pragent.domain.service.AgentInstance;
import me.golemcore.pragent.domain.service.BranchNames;
import me.golemcore.pragent.domain.service.GitHubConnectionService;
import me.golemcore.pragent.domain.service.GitHubNotConnectedException;
import me.golemcore.pragent.domain.service.RepositoryOperations;
import me.golemcore.pragent.domain.service.TaskStateTracker;
import me.golemcore.pragent.domain.system.LlmErrorClassifier;
import me.golemcore.pragent.domain.system.ModelFallbackRunner;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.GitHubPort;
import me.golemcore.pragent.tools.CommitFilesTool;
import me.golemcore.pragent.tools.CreatePullRequestTool;
import me.golemcore.pragent.tools.RepositoryToolContext;
import me.golemcore.pragent.tools.RepositoryToolRegistry;
import me.golemcore.pragent.tools.ToolArguments;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Autonomous executor: lets the model drive the repository tools until it
 * opens a pull request.
 *
 * <p>
 * Each iteration makes exactly one model call with the full history and the
 * tool catalog, then executes the requested tools in order and feeds their
 * results back as tool messages. The run ends when {@code create_pull_request}
 * succeeds, when the model answers without tool calls, when the step budget is
 * spent, or on an infrastructure failure. Repeating the same tool-call batch
 * is answered with a corrective user message instead of execution.
 */
@Service
@Slf4j
public class ReActTaskExecutor {

    private static final int PROGRESS_ARGS_CHARS = 80;

    private final ModelFallbackRunner modelRunner;
    private final GitHubConnectionService connectionService;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final ObjectMapper signatureMapper;
    private final Clock clock;

    public ReActTaskExecutor(ModelFallbackRunner modelRunner, GitHubConnectionService connectionService,
            AgentProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.modelRunner = modelRunner;
        this.connectionService = connectionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.signatureMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    public TaskResult execute(AgentInstance instance, TaskRequest request) {
        return run(instance, request).result();
    }

    ReActRun run(AgentInstance instance, TaskRequest request) {
        TaskStateTracker tracker = instance.getTracker();
        TaskRequest resolved = new TaskRequest(request.repoUrl(), request.descriptionOrEmpty(),
                BranchNames.resolve(request.branchName(), request.description(), clock),
                request.resolveTargetBranch());
        tracker.startTask(resolved, false);
        log.info("[ReAct] Starting autonomous task for {} on branch {}", resolved.repoUrl(), resolved.branchName());

        ReActRun run = new ReActRun(resolved.branchName());
        try {
            if (resolved.descriptionOrEmpty().isBlank()) {
                throw new IllegalArgumentException("Task description is required");
            }
            RepoLocator locator = RepoLocator.require(resolved.repoUrl());
            GitHubPort github = connectionService.ensureConnected(instance)
                    .orElseThrow(() -> new GitHubNotConnectedException(
                            "GitHub is not connected. Provide a GitHub token first."));

            tracker.setStatus(TaskStatus.ANALYZING);
            RepositoryOperations operations = new RepositoryOperations(github, locator,
                    properties.getGithub().getWebUrl());
            ensureFeatureBranch(tracker, operations, resolved);

            RepositoryToolContext toolContext = new RepositoryToolContext(operations, resolved, tracker,
                    properties.getReact().getMaxChangesPerCommit());
            loop(tracker, RepositoryToolRegistry.create(toolContext, objectMapper), locator, resolved, run);
        } catch (RuntimeException e) { // NOSONAR - executors report failures as results
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("[ReAct] Task failed: {}",
                    LlmErrorClassifier.withCode(LlmErrorClassifier.classifyFromThrowable(e), message));
            tracker.appendProgress("ReAct error: " + message);
            run.result = TaskResult.failure(message, resolved.branchName());
        }

        tracker.complete(run.result);
        return run;
    }

    private void ensureFeatureBranch(TaskStateTracker tracker, RepositoryOperations operations, TaskRequest request) {
        tracker.appendProgress("Ensuring working branch " + request.branchName() + " exists (source: "
                + request.resolveTargetBranch() + ")...");
        if (operations.ensureBranchExists(request.branchName(), request.resolveTargetBranch())) {
            tracker.appendProgress("Branch " + request.branchName() + " already exists.");
        } else {
            tracker.appendProgress("Branch " + request.branchName() + " created from "
                    + request.resolveTargetBranch() + ".");
        }
    }

    private void loop(TaskStateTracker tracker, RepositoryToolRegistry registry, RepoLocator locator,
            TaskRequest request, ReActRun run) {
        int maxSteps = properties.getReact().getMaxSteps();
        LoopDetector loopDetector = new LoopDetector(properties.getReact().getMaxRepeatedCalls());
        ConversationHistory history = new ConversationHistory(clock);
        history.appendUser(ReActPrompts.userPrompt(locator, request));

        for (int step = 0; step < maxSteps; step++) {
            LlmResponse response = modelRunner.run(LlmRequest.builder()
                    .systemPrompt(ReActPrompts.SYSTEM_PROMPT)
                    .messages(history.snapshot())
                    .tools(registry.getDefinitions())
                    .maxTokens(properties.getLlm().getMaxTokens())
                    .temperature(properties.getLlm().getTemperature())
                    .build());
            run.modelCalls++;

            if (response == null || !response.hasToolCalls()) {
                history.appendAssistantText(response != null ? response.getContent() : null);
                log.info("[ReAct] Model stopped calling tools after {} step(s)", step + 1);
                run.result = TaskResult.failure("Agent finished without creating a pull request",
                        request.branchName());
                return;
            }

            List<ResolvedCall> calls = resolveCalls(tracker, response.getToolCalls());
            LoopDetector.Verdict verdict = loopDetector.observe(signature(calls));
            if (verdict.loop()) {
                String toolName = calls.get(0).call().getName();
                tracker.appendProgress("Loop detected: \"" + toolName + "\" called " + verdict.occurrences()
                        + " times with same args. Injecting guidance.");
                history.appendAssistantText(response.getContent());
                history.appendUser(ReActPrompts.loopNudge(toolName));
                continue;
            }

            history.appendAssistantToolCalls(response.getContent(), response.getToolCalls());
            for (ResolvedCall call : calls) {
                ToolExecutionOutcome outcome = executeCall(tracker, registry, call);
                history.appendToolResult(outcome);
                run.toolCalls.add(new ToolCallRecord(call.call().getName(), call.recordedArguments(),
                        outcome.messageContent()));

                if (CreatePullRequestTool.NAME.equals(outcome.toolName()) && outcome.isSuccess()) {
                    Object data = outcome.toolResult().getData();
                    String prUrl = data instanceof Map<?, ?> map && map.get("prUrl") != null
                            ? map.get("prUrl").toString()
                            : outcome.toolResult().getOutput();
                    tracker.appendProgress("PR created, finishing agent loop.");
                    run.result = TaskResult.success(prUrl, request.branchName());
                    return;
                }
            }
        }

        log.info("[ReAct] Step budget of {} exhausted", maxSteps);
        run.result = TaskResult.failure("Agent did not create a pull request within " + maxSteps + " steps",
                request.branchName());
    }

    private List<ResolvedCall> resolveCalls(TaskStateTracker tracker, List<Message.ToolCall> toolCalls) {
        List<ResolvedCall> resolved = new ArrayList<>();
        for (Message.ToolCall call : toolCalls) {
            if (call.getArguments() != null) {
                resolved.add(new ResolvedCall(call, call.getArguments(), call.getArguments()));
                continue;
            }
            Optional<Map<String, Object>> parsed = ToolArguments.parseObject(call.getRawArguments(), objectMapper);
            if (parsed.isPresent()) {
                resolved.add(new ResolvedCall(call, parsed.get(), parsed.get()));
            } else {
                tracker.appendProgress("Warning: Could not parse stringified arguments for " + call.getName());
                resolved.add(new ResolvedCall(call, Map.of(), call.getRawArguments()));
            }
        }
        return resolved;
    }

    String signature(List<ResolvedCall> calls) {
        return calls.stream()
                .map(call -> call.call().getName() + ":" + toJson(signatureMapper, call.recordedArguments()))
                .collect(Collectors.joining("|"));
    }

    private ToolExecutionOutcome executeCall(TaskStateTracker tracker, RepositoryToolRegistry registry,
            ResolvedCall call) {
        String toolName = call.call().getName();
        Optional<ToolComponent> tool = registry.find(toolName);
        if (tool.isEmpty()) {
            String message = "Unknown tool requested by model: " + toolName;
            tracker.appendProgress(message);
            return failure(call, message);
        }

        if (CommitFilesTool.NAME.equals(toolName) || CreatePullRequestTool.NAME.equals(toolName)) {
            tracker.setStatus(TaskStatus.CREATING_PR);
        }
        String argsJson = toJson(objectMapper, call.arguments());
        tracker.appendProgress("Tool: " + toolName + "("
                + argsJson.substring(0, Math.min(PROGRESS_ARGS_CHARS, argsJson.length())) + "...)");

        ToolResult result;
        try {
            result = tool.get().execute(call.arguments()).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            result = ToolResult.failure(cause.getMessage());
        } catch (RuntimeException e) { // NOSONAR - tool failures go back to the model
            result = ToolResult.failure(e.getMessage());
        }

        if (result == null || !result.isSuccess()) {
            String error = result != null && result.getError() != null ? result.getError() : "Tool failed";
            tracker.appendProgress("Tool error in " + toolName + ": " + error);
            return failure(call, error);
        }
        Object payload = result.getData() != null ? result.getData() : result.getOutput();
        return new ToolExecutionOutcome(call.call().getId(), toolName, result, toJson(objectMapper, payload));
    }

    private ToolExecutionOutcome failure(ResolvedCall call, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error);
        return new ToolExecutionOutcome(call.call().getId(), call.call().getName(), ToolResult.failure(error),
                toJson(objectMapper, payload));
    }

    private static String toJson(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * @param arguments
     *            arguments handed to the tool
     * @param recordedArguments
     *            parsed map, or the raw text when parsing failed
     */
    record ResolvedCall(Message.ToolCall call, Map<String, Object> arguments, Object recordedArguments) {
    }

    /**
     * What an autonomous run produced.
     */
    static final class ReActRun {
        private final List<ToolCallRecord> toolCalls = new ArrayList<>();
        private TaskResult result;
        private int modelCalls;

        private ReActRun(String branchName) {
            this.result = TaskResult.failure("Agent did not run", branchName);
        }

        TaskResult result() {
            return result;
        }

        List<ToolCallRecord> toolCalls() {
            return toolCalls;
        }

        int modelCalls() {
            return modelCalls;
        }
    }
}
