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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owner and name of a GitHub repository.
 */
public record RepoLocator(String owner, String repo) {

    private static final Pattern URL_PATTERN = Pattern.compile("github\\.com/([^/]+)/([^/\\s]+)");
    private static final Pattern SHORTHAND_PATTERN = Pattern.compile("^([^/\\s]+)/([^/\\s]+)$");
    private static final String GIT_SUFFIX = ".git";

    /**
     * Parses a repository URL or {@code owner/repo} shorthand. Surrounding
     * whitespace and trailing slashes are ignored.
     *
     * @return the locator, or empty when the input is not recognized
     */
    public static Optional<RepoLocator> parse(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String trimmed = stripTrailingSlashes(input.trim());

        Matcher urlMatcher = URL_PATTERN.matcher(trimmed);
        if (urlMatcher.find()) {
            return build(urlMatcher.group(1), urlMatcher.group(2));
        }

        Matcher shorthandMatcher = SHORTHAND_PATTERN.matcher(trimmed);
        if (shorthandMatcher.matches()) {
            return build(shorthandMatcher.group(1), shorthandMatcher.group(2));
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException
     *             when the input is not a recognized repository reference
     */
    public static RepoLocator require(String input) {
        return parse(input).orElseThrow(() -> new IllegalArgumentException("Invalid GitHub URL: " + input
                + ". Expected https://github.com/<owner>/<repo> or <owner>/<repo>"));
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static Optional<RepoLocator> build(String owner, String repo) {
        String name = repo.endsWith(GIT_SUFFIX) ? repo.substring(0, repo.length() - GIT_SUFFIX.length()) : repo;
        if (owner.isBlank() || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new RepoLocator(owner, name));
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
