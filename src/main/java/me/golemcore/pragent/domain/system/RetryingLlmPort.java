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
import me.golemcore.pragent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * LlmPort decorator that absorbs transient model-runner failures.
 *
 * <p>
 * A failure classified as transient by {@link LlmErrorClassifier} is retried
 * after {@code initialBackoffMs * (attempt + 1)} milliseconds, up to
 * {@code maxRetries} additional attempts. Anything else, or the last transient
 * failure once the budget is spent, is rethrown unchanged.
 */
public class RetryingLlmPort implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(RetryingLlmPort.class);

    private final LlmPort delegate;
    private final int maxRetries;
    private final long initialBackoffMs;
    private final Sleeper sleeper;

    public RetryingLlmPort(LlmPort delegate, int maxRetries, long initialBackoffMs) {
        this(delegate, maxRetries, initialBackoffMs, Thread::sleep);
    }

    // Visible for testing
    public RetryingLlmPort(LlmPort delegate, int maxRetries, long initialBackoffMs, Sleeper sleeper) {
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
        this.sleeper = sleeper;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        try {
            return CompletableFuture.completedFuture(call(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Blocking call with retries.
     *
     * @throws RuntimeException
     *             the last failure, unwrapped from future wrappers
     */
    public LlmResponse call(LlmRequest request) {
        RuntimeException lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return delegate.chat(request).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("LLM call interrupted", e);
            } catch (ExecutionException | CompletionException e) {
                lastError = unwrap(e);
            } catch (RuntimeException e) { // NOSONAR - delegate may throw before returning a future
                lastError = e;
            }

            if (!LlmErrorClassifier.isTransient(lastError)) {
                throw lastError;
            }
            if (attempt < maxRetries) {
                long backoffMs = initialBackoffMs * (attempt + 1);
                log.warn("[LLM] Transient failure on {} (attempt {}/{}), retrying in {}ms: {}",
                        request.getModel(), attempt + 1, maxRetries + 1, backoffMs, lastError.getMessage());
                sleep(backoffMs);
            }
        }
        log.error("[LLM] Giving up on {} after {} attempts", request.getModel(), maxRetries + 1);
        throw lastError;
    }

    private void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM retry sleep interrupted", e);
        }
    }

    private static RuntimeException unwrap(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    /**
     * Pause between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
