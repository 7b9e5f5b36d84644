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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * One step of the deterministic pipeline with its lifecycle.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    private StepId id;
    private String label;
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String error;

    public enum StepId {
        VALIDATE_INPUT("validate_input", "Validate request"),
        ENSURE_GITHUB("ensure_github", "Connect to GitHub"),
        FETCH_REPO("fetch_repo", "Analyze repository"),
        GENERATE_CHANGES("generate_changes", "Generate code changes"),
        CREATE_BRANCH("create_branch", "Create feature branch"),
        APPLY_CHANGES("apply_changes", "Commit changes"),
        CREATE_PR("create_pr", "Open pull request");

        private final String value;
        private final String label;

        StepId(String value, String label) {
            this.value = value;
            this.label = label;
        }

        @JsonValue
        public String value() {
            return value;
        }

        public String label() {
            return label;
        }

        @JsonCreator
        public static StepId fromValue(String value) {
            for (StepId id : values()) {
                if (id.value.equals(value)) {
                    return id;
                }
            }
            throw new IllegalArgumentException("Unknown plan step: " + value);
        }
    }

    public enum StepStatus {
        PENDING, RUNNING, COMPLETED, SKIPPED, ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static StepStatus fromValue(String value) {
            return StepStatus.valueOf(value.toUpperCase(Locale.ROOT));
        }

        public boolean isDone() {
            return this == COMPLETED || this == SKIPPED;
        }
    }
}
