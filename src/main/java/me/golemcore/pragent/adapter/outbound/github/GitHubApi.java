package me.golemcore.pragent.adapter.outbound.github;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

import java.util.List;

/**
 * Feign binding of the GitHub REST endpoints the agent needs.
 */
@Headers({
        "Accept: application/vnd.github+json",
        "X-GitHub-Api-Version: 2022-11-28"
})
interface GitHubApi {

    @RequestLine("GET /repos/{owner}/{repo}/contents/{path}")
    List<ContentItem> listContents(
            @Param("owner") String owner,
            @Param("repo") String repo,
            @Param("path") String path);

    @RequestLine("GET /repos/{owner}/{repo}/contents/{path}?ref={ref}")
    ContentItem getContent(
            @Param("owner") String owner,
            @Param("repo") String repo,
            @Param("path") String path,
            @Param("ref") String ref);

    @RequestLine("GET /repos/{owner}/{repo}/git/ref/heads/{branch}")
    RefResponse getRef(
            @Param("owner") String owner,
            @Param("repo") String repo,
            @Param("branch") String branch);

    @RequestLine("POST /repos/{owner}/{repo}/git/refs")
    @Headers("Content-Type: application/json")
    RefResponse createRef(
            @Param("owner") String owner,
            @Param("repo") String repo,
            CreateRefRequest request);

    @RequestLine("PUT /repos/{owner}/{repo}/contents/{path}")
    @Headers("Content-Type: application/json")
    void putContent(
            @Param("owner") String owner,
            @Param("repo") String repo,
            @Param("path") String path,
            PutContentRequest request);

    @RequestLine("POST /repos/{owner}/{repo}/pulls")
    @Headers("Content-Type: application/json")
    PullResponse createPull(
            @Param("owner") String owner,
            @Param("repo") String repo,
            CreatePullRequest request);

    @RequestLine("GET /repos/{owner}/{repo}/compare/{basehead}")
    CompareResponse compare(
            @Param("owner") String owner,
            @Param("repo") String repo,
            @Param("basehead") String basehead);

    @RequestLine("GET /user")
    UserResponse getUser();

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateRefRequest(String ref, String sha) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PutContentRequest(String message, String content, String branch, String sha) {
    }

    record CreatePullRequest(String title, String body, String head, String base) {
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ContentItem {
        private String name;
        private String path;
        private String type;
        private String sha;
        private String content;
        private String encoding;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class RefResponse {
        private String ref;
        private RefObject object;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class RefObject {
        private String sha;
        private String type;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class PullResponse {
        private int number;
        @JsonProperty("html_url")
        private String htmlUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CompareResponse {
        private String status;
        @JsonProperty("ahead_by")
        private int aheadBy;
        @JsonProperty("behind_by")
        private int behindBy;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class UserResponse {
        private String login;
    }
}
