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

package org.fireflyframework.pipeline.error;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a {@link WorkflowError} is fatal or recoverable.
 * <p>
 * An error is fatal when its severity is {@link ErrorSeverity#CRITICAL} or when its
 * error type contains, case-insensitively, one of the fatal keywords. Matching is by
 * substring, so {@code oauth_authentication_failure_retry} is fatal.
 */
public class ErrorClassifier {

    static final List<String> FATAL_KEYWORDS = List.of(
            "authentication_failure",
            "permission_denied",
            "system_error",
            "configuration_invalid",
            "quota_exceeded"
    );

    public boolean isFatal(WorkflowError error) {
        if (error == null) {
            return false;
        }
        if (error.severity() == ErrorSeverity.CRITICAL) {
            return true;
        }
        if (error.errorType() == null) {
            return false;
        }
        String errorType = error.errorType().toLowerCase(Locale.ROOT);
        return FATAL_KEYWORDS.stream().anyMatch(errorType::contains);
    }

    public ErrorCategory classify(WorkflowError error) {
        return isFatal(error) ? ErrorCategory.FATAL : ErrorCategory.RECOVERABLE;
    }
}
