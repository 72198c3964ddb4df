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

package org.fireflyframework.pipeline.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stage of a workflow specification.
 *
 * @param name stage name
 * @param tool tool invoked by the stage
 * @param dependsOn stages that must complete first
 * @param parameters static tool parameters
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageDefinition(
        String name,
        String tool,
        List<String> dependsOn,
        Map<String, Object> parameters
) {

    public StageDefinition {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static StageDefinition of(String name, String tool, String... dependsOn) {
        return new StageDefinition(name, tool, List.of(dependsOn), Map.of());
    }
}
