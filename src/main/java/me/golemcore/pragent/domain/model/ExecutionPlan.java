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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of the seven pipeline steps plus the index of the step that is
 * currently (or was last) running.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPlan {

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();
    private int currentStepIndex;
    private Instant createdAt;

    /**
     * Creates a plan with every step pending.
     */
    public static ExecutionPlan create(Instant createdAt) {
        List<PlanStep> steps = new ArrayList<>();
        for (PlanStep.StepId id : PlanStep.StepId.values()) {
            steps.add(PlanStep.builder()
                    .id(id)
                    .label(id.label())
                    .build());
        }
        return ExecutionPlan.builder()
                .steps(steps)
                .currentStepIndex(0)
                .createdAt(createdAt)
                .build();
    }

    public ExecutionPlan copy() {
        List<PlanStep> copies = new ArrayList<>();
        for (PlanStep step : steps) {
            copies.add(step.toBuilder().build());
        }
        return ExecutionPlan.builder()
                .steps(copies)
                .currentStepIndex(currentStepIndex)
                .createdAt(createdAt)
                .build();
    }

    @JsonIgnore
    public long getCompletedCount() {
        return steps.stream().filter(s -> s.getStatus() == PlanStep.StepStatus.COMPLETED).count();
    }

    @JsonIgnore
    public boolean isFinished() {
        return steps.stream().allMatch(s -> s.getStatus().isDone());
    }
}
