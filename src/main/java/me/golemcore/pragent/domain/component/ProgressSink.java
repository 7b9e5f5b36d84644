package me.golemcore.pragent.domain.component;

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

import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.PlanStep;

/**
 * Write side of the observable task state. Executors narrate what they do
 * through {@link #appendProgress(String)}; the deterministic executor also
 * advances plan steps. Observers only read {@link #getSnapshot()}.
 */
public interface ProgressSink {

    /**
     * Append a human-readable line to the progress log.
     */
    void appendProgress(String message);

    /**
     * Move a plan step to a new status.
     *
     * @param error
     *            failure message, only meaningful for
     *            {@link PlanStep.StepStatus#ERROR}
     * @throws IllegalStateException
     *             when the transition would break step ordering
     */
    void setPlanStep(int index, PlanStep.StepStatus status, String error);

    /**
     * A detached copy of the current state.
     */
    AgentTaskState getSnapshot();
}
