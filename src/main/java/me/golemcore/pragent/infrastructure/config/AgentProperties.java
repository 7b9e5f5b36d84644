package me.golemcore.pragent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the PR agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model ids, providers, retry budget</li>
 * <li>{@link GitHubProperties} - GitHub API endpoint and default token</li>
 * <li>{@link ReactProperties} - autonomous loop limits</li>
 * <li>{@link GenerationProperties} - change-set generation limits</li>
 * <li>{@link StorageProperties} - checkpoint storage location</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private GitHubProperties github = new GitHubProperties();
    private ReactProperties react = new ReactProperties();
    private GenerationProperties generation = new GenerationProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private TasksProperties tasks = new TasksProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * Model ids use the {@code <provider>/<model>} form.
         */
        private String primaryModel = "workers-ai/@cf/meta/llama-3.3-70b-instruct-fp8-fast";
        private String fallbackModel = "workers-ai/@cf/meta/llama-3.1-8b-instruct";
        private int maxTokens = 4096;
        private double temperature = 0.2;
        private long timeoutMs = 120000;
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== GITHUB ====================

    @Data
    public static class GitHubProperties {
        private String apiUrl = "https://api.github.com";
        private String webUrl = "https://github.com";
        /**
         * Token used when an instance has no stored credential.
         */
        private String token;
        private String userAgent = "golemcore-pr-agent";
    }

    // ==================== EXECUTORS ====================

    @Data
    public static class ReactProperties {
        private int maxSteps = 15;
        private int maxRepeatedCalls = 2;
        private int maxChangesPerCommit = 10;
    }

    @Data
    public static class GenerationProperties {
        private int maxAttempts = 3;
        private int maxDescriptionChars = 500;
        private int maxContextChars = 6000;
        private int maxIndexHtmlChars = 1000;
        private int maxReadmeChars = 2000;
    }

    @Data
    public static class TasksProperties {
        private int workerThreads = 4;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String tasksDirectory = "tasks";
        private String credentialsDirectory = "credentials";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/pr-agent";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
