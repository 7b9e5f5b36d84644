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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * A single file edit. {@code content} always holds the complete file text,
 * never a patch, because the GitHub contents API replaces files wholesale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileChange {

    private String path;
    private String content;
    private Action action;

    public enum Action {
        CREATE, UPDATE, DELETE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Case-insensitive lookup.
         *
         * @return the action, or {@code null} for unknown values
         */
        @JsonCreator
        public static Action fromValue(String value) {
            if (value == null) {
                return null;
            }
            for (Action action : values()) {
                if (action.value().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
            return null;
        }
    }
}
