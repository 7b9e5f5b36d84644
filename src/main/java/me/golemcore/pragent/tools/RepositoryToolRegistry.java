package me.golemcore.pragent.tools;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pragent.domain.component.ToolComponent;
import me.golemcore.pragent.domain.model.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed tool catalog of one task, in the order it is presented to the
 * model.
 */
public final class RepositoryToolRegistry {

    private final Map<String, ToolComponent> tools;

    private RepositoryToolRegistry(List<ToolComponent> tools) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        for (ToolComponent tool : tools) {
            byName.put(tool.getToolName(), tool);
        }
        this.tools = byName;
    }

    public static RepositoryToolRegistry create(RepositoryToolContext context, ObjectMapper objectMapper) {
        return new RepositoryToolRegistry(List.of(
                new GetRepoStructureTool(context),
                new ReadFileTool(context),
                new CreateBranchTool(context),
                new CommitFilesTool(context, objectMapper),
                new CreatePullRequestTool(context)));
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    public Optional<ToolComponent> find(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }
}
