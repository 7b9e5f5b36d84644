package me.golemcore.pragent.adapter.inbound.web.controller;

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
import me.golemcore.pragent.adapter.inbound.web.dto.GitHubTokenRequest;
import me.golemcore.pragent.adapter.inbound.web.dto.TaskRequestDto;
import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.GitHubConnectionStatus;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.service.PrAgentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Agent instance endpoints: GitHub connection, task runs and state polling.
 */
@RestController
@RequestMapping("/api/agents/{instanceId}")
@RequiredArgsConstructor
public class AgentController {

    private final PrAgentService prAgentService;

    @PostMapping("/github/token")
    public Mono<ResponseEntity<GitHubConnectionStatus>> setGitHubToken(@PathVariable String instanceId,
            @RequestBody(required = false) GitHubTokenRequest request) {
        if (request == null || request.token() == null || request.token().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "token is required");
        }
        return Mono.just(ResponseEntity.ok(prAgentService.setGitHubToken(instanceId, request.token())));
    }

    @GetMapping("/github/status")
    public Mono<ResponseEntity<GitHubConnectionStatus>> getGitHubStatus(@PathVariable String instanceId) {
        return Mono.just(ResponseEntity.ok(prAgentService.checkGitHubStatus(instanceId)));
    }

    @DeleteMapping("/github")
    public Mono<ResponseEntity<GitHubConnectionStatus>> disconnect(@PathVariable String instanceId) {
        prAgentService.disconnect(instanceId);
        return Mono.just(ResponseEntity.ok(GitHubConnectionStatus.disconnected()));
    }

    @PostMapping("/tasks/autonomous")
    public Mono<ResponseEntity<TaskResult>> runAutonomous(@PathVariable String instanceId,
            @RequestBody(required = false) TaskRequestDto request) {
        requireRequest(request);
        return Mono.fromFuture(prAgentService.runAutonomous(instanceId, request.toTaskRequest()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/tasks/planned")
    public Mono<ResponseEntity<TaskResult>> runPlanned(@PathVariable String instanceId,
            @RequestBody(required = false) TaskRequestDto request) {
        requireRequest(request);
        return Mono.fromFuture(prAgentService.runPlanned(instanceId, request.toTaskRequest()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/state")
    public Mono<ResponseEntity<AgentTaskState>> getState(@PathVariable String instanceId) {
        return Mono.just(ResponseEntity.ok(prAgentService.getState(instanceId)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<AgentTaskState>> reset(@PathVariable String instanceId) {
        return Mono.just(ResponseEntity.ok(prAgentService.reset(instanceId)));
    }

    private static void requireRequest(TaskRequestDto request) {
        if (request == null || request.repoUrl() == null || request.repoUrl().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "repoUrl is required");
        }
    }
}
