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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores the GitHub token of each agent instance outside the task state
 * snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;
    private final Clock clock;

    public void saveToken(String instanceId, String token) {
        StoredCredential credential = new StoredCredential(token, Instant.now(clock));
        try {
            storagePort.putTextAtomic(directory(), TaskStateRepository.fileName(instanceId),
                    objectMapper.writeValueAsString(credential)).join();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to store GitHub credential", e);
        }
    }

    public Optional<String> loadToken(String instanceId) {
        try {
            String json = storagePort.getText(directory(), TaskStateRepository.fileName(instanceId)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            StoredCredential credential = objectMapper.readValue(json, StoredCredential.class);
            return Optional.ofNullable(credential.getToken()).filter(token -> !token.isBlank());
        } catch (IOException | RuntimeException e) { // NOSONAR - a broken credential file means disconnected
            log.warn("[GitHub] Failed to read stored credential for {}: {}", instanceId, e.getMessage());
            return Optional.empty();
        }
    }

    public void deleteToken(String instanceId) {
        storagePort.deleteObject(directory(), TaskStateRepository.fileName(instanceId)).join();
    }

    private String directory() {
        return properties.getStorage().getCredentialsDirectory();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredCredential {
        private String token;
        private Instant storedAt;
    }
}
