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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a task. Executors always return one instead of throwing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String prUrl;
    private String branchName;
    private String error;

    public static TaskResult success(String prUrl, String branchName) {
        return TaskResult.builder()
                .success(true)
                .prUrl(prUrl)
                .branchName(branchName)
                .build();
    }

    public static TaskResult failure(String error) {
        return TaskResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    public static TaskResult failure(String error, String branchName) {
        return TaskResult.builder()
                .success(false)
                .error(error)
                .branchName(branchName)
                .build();
    }
}
