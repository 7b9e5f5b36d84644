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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.pragent.domain.model.FileChange;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on a parsed change set. Only the first violation is
 * reported, naming the element index and the offending field.
 */
public class ChangeSetValidator {

    /**
     * @throws ChangeSetRejectedException
     *             describing the first violation
     */
    public List<FileChange> validate(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new ChangeSetRejectedException("Expected a JSON array of changes");
        }
        if (root.isEmpty()) {
            throw new ChangeSetRejectedException("Change array is empty");
        }

        List<FileChange> changes = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode item = root.get(i);
            if (!item.isObject()) {
                throw new ChangeSetRejectedException("Item " + i + ": expected an object");
            }
            JsonNode path = item.get("path");
            if (path == null || !path.isTextual() || path.asText().isBlank()) {
                throw new ChangeSetRejectedException("Item " + i + ": missing or empty \"path\"");
            }
            JsonNode content = item.get("content");
            if (content == null || !content.isTextual()) {
                throw new ChangeSetRejectedException("Item " + i + ": missing or non-string \"content\"");
            }
            JsonNode actionNode = item.get("action");
            FileChange.Action action = actionNode != null && actionNode.isTextual()
                    ? FileChange.Action.fromValue(actionNode.asText())
                    : null;
            if (action == null) {
                throw new ChangeSetRejectedException("Item " + i
                        + ": \"action\" must be one of create, update, delete");
            }
            changes.add(new FileChange(path.asText().trim(), content.asText(), action));
        }
        return changes;
    }
}
