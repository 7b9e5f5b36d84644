package me.golemcore.pragent.domain.system;

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

import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a request against the primary model and, when that still fails after
 * retries, once more against the smaller fallback model.
 */
@Slf4j
public class ModelFallbackRunner {

    private final RetryingLlmPort llm;
    private final String primaryModel;
    private final String fallbackModel;

    public ModelFallbackRunner(RetryingLlmPort llm, String primaryModel, String fallbackModel) {
        this.llm = llm;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
    }

    /**
     * @throws RuntimeException
     *             the fallback model's failure when both models failed
     */
    public LlmResponse run(LlmRequest request) {
        try {
            return llm.call(request.toBuilder().model(primaryModel).build());
        } catch (RuntimeException primaryError) {
            if (fallbackModel == null || fallbackModel.isBlank() || fallbackModel.equals(primaryModel)) {
                throw primaryError;
            }
            log.warn("[LLM] Primary model {} failed ({}), trying fallback {}", primaryModel,
                    primaryError.getMessage(), fallbackModel);
            try {
                return llm.call(request.toBuilder().model(fallbackModel).build());
            } catch (RuntimeException fallbackError) {
                fallbackError.addSuppressed(primaryError);
                throw fallbackError;
            }
        }
    }

    public String getPrimaryModel() {
        return primaryModel;
    }
}
