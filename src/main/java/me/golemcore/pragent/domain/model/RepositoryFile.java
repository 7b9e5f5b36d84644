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

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * File contents as returned by the repository client. {@code content} is
 * base64 encoded and may contain line breaks.
 */
public record RepositoryFile(String path, String content, String sha) {

    public String decodedContent() {
        if (content == null || content.isEmpty()) {
            return "";
        }
        byte[] bytes = Base64.getMimeDecoder().decode(content);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
