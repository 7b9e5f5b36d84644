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

import java.util.Locale;

/**
 * Failure of a GitHub API call. The message has the form
 * {@code GitHub API error: <status> - <details>}.
 */
public class GitHubApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_UNPROCESSABLE = 422;

    private static final String ALREADY_EXISTS = "already exists";

    private final int status;

    public GitHubApiException(int status, String details) {
        super("GitHub API error: " + status + " - " + details);
        this.status = status;
    }

    public GitHubApiException(int status, String details, Throwable cause) {
        super("GitHub API error: " + status + " - " + details, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return status == HTTP_NOT_FOUND;
    }

    /**
     * GitHub reports duplicate refs and duplicate pull requests as 422 with an
     * "already exists" message. A 422 such as "Object does not exist" is a
     * real failure.
     */
    public boolean isAlreadyExists() {
        String message = getMessage() != null ? getMessage().toLowerCase(Locale.ROOT) : "";
        return status == HTTP_UNPROCESSABLE && message.contains(ALREADY_EXISTS);
    }

    public static boolean isNotFound(Throwable error) {
        if (error instanceof GitHubApiException apiError) {
            return apiError.isNotFound();
        }
        return error != null && error.getMessage() != null && error.getMessage().contains("404");
    }

    public static boolean isAlreadyExists(Throwable error) {
        if (error instanceof GitHubApiException apiError) {
            return apiError.isAlreadyExists();
        }
        return error != null && error.getMessage() != null
                && error.getMessage().toLowerCase(Locale.ROOT).contains(ALREADY_EXISTS);
    }
}
