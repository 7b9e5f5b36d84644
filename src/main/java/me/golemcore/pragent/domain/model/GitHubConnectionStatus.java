package me.golemcore.pragent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of connecting or inspecting the GitHub connection of an agent
 * instance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitHubConnectionStatus(boolean connected, String username, String error) {

    public static GitHubConnectionStatus connected(String username) {
        return new GitHubConnectionStatus(true, username, null);
    }

    public static GitHubConnectionStatus disconnected() {
        return new GitHubConnectionStatus(false, null, null);
    }

    public static GitHubConnectionStatus failed(String error) {
        return new GitHubConnectionStatus(false, null, error);
    }
}
