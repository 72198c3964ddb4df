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

package org.fireflyframework.pipeline.exception;

import org.fireflyframework.pipeline.error.WorkflowError;

/**
 * Exception thrown when a pipeline stage fails. Carries the structured error
 * used for classification, retry and escalation.
 */
public class StageExecutionException extends PipelineException {

    private final WorkflowError error;

    public StageExecutionException(WorkflowError error) {
        super(describe(error));
        this.error = error;
    }

    public StageExecutionException(WorkflowError error, Throwable cause) {
        super(describe(error), cause);
        this.error = error;
    }

    public WorkflowError getError() {
        return error;
    }

    public String getStageName() {
        return error.stageName();
    }

    public String getToolName() {
        return error.toolName();
    }

    private static String describe(WorkflowError error) {
        return "Stage '" + error.stageName() + "' (tool '" + error.toolName() + "') failed: " + error.message();
    }
}
