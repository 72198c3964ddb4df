/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.pipeline.coordination;

import java.util.List;

/**
 * What a tool needs and provides. Registering a capability adds the tool to the dependency graph.
 *
 * @param toolName tool name
 * @param description human readable description
 * @param dependencies tools that must run first
 * @param inputTypes accepted inputs
 * @param outputTypes produced outputs
 */
public record ToolCapability(
        String toolName,
        String description,
        List<String> dependencies,
        List<String> inputTypes,
        List<String> outputTypes
) {

    public ToolCapability {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        inputTypes = inputTypes != null ? List.copyOf(inputTypes) : List.of();
        outputTypes = outputTypes != null ? List.copyOf(outputTypes) : List.of();
    }

    public static ToolCapability of(String toolName, String... dependencies) {
        return new ToolCapability(toolName, null, List.of(dependencies), List.of(), List.of());
    }
}
