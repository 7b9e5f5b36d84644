package me.golemcore.pragent.domain.service;

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

/**
 * Every generation attempt produced an unusable change set. The message
 * carries the reason the last attempt was rejected.
 */
public class ChangeSetGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final String lastError;

    public ChangeSetGenerationException(int attempts, String lastError) {
        super("Failed to generate valid changes after " + attempts + " attempt(s): " + lastError);
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }
}
