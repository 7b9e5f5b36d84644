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

/**
 * A tool call made during an autonomous run and what came back.
 *
 * @param name
 *            tool name requested by the model
 * @param arguments
 *            parsed argument map, or the raw string when it could not be parsed
 * @param resultOrError
 *            tool message content sent back to the model
 */
public record ToolCallRecord(String name, Object arguments, String resultOrError) {
}
