/*
 * Copyright 2025 Firefly Software Solutions Inc
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

package org.stepline.workflow.exception;

/**
 * Exception thrown when a value is rejected by a {@link org.stepline.workflow.schema.Schema}.
 * <p>
 * The {@code context} identifies what was being validated, for example
 * {@code "step fetch input"} or {@code "workflow orders output"}.
 */
public class SchemaValidationException extends WorkflowException {

    private final String context;

    public SchemaValidationException(String context, Throwable cause) {
        super(buildMessage(context, cause), cause);
        this.context = context;
    }

    public String getContext() {
        return context;
    }

    private static String buildMessage(String context, Throwable cause) {
        String message = "Schema validation failed for " + context;
        if (cause != null && cause.getMessage() != null) {
            message += ": " + cause.getMessage();
        }
        return message;
    }
}
