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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Agent instances by id. An instance is created on first use and picks up its
 * last checkpoint, if any.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentInstanceRegistry {

    private static final Pattern INSTANCE_ID_PATTERN = Pattern.compile("[a-zA-Z0-9._-]{1,128}");

    private final TaskStateRepository taskStateRepository;
    private final Clock clock;

    private final Map<String, AgentInstance> instances = new ConcurrentHashMap<>();

    public AgentInstance getOrCreate(String instanceId) {
        if (instanceId == null || !INSTANCE_ID_PATTERN.matcher(instanceId).matches()) {
            throw new IllegalArgumentException("Invalid agent instance id: " + instanceId);
        }
        return instances.computeIfAbsent(instanceId, this::createInstance);
    }

    private AgentInstance createInstance(String instanceId) {
        TaskStateTracker tracker = new TaskStateTracker(instanceId, taskStateRepository, clock);
        taskStateRepository.load(instanceId).ifPresent(restored -> {
            tracker.restore(restored);
            log.info("[TaskState] Restored state for {} (status: {})", instanceId, restored.getStatus().value());
        });
        return new AgentInstance(instanceId, tracker);
    }
}
