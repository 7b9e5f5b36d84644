package me.golemcore.pragent.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for LLM provider interactions. {@link LlmRequest#getModel()} selects the
 * model; tool definitions in the request enable function calling.
 */
public interface LlmPort {

    /**
     * Get the provider identifier.
     */
    String getProviderId();

    /**
     * Send a chat request and receive a complete response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Check if this provider is currently available.
     */
    boolean isAvailable();
}
