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

package org.stepline.workflow.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of run events, with their wire names.
 */
public enum WorkflowEventType {
    WORKFLOW_START("workflow:start"),
    WORKFLOW_SUCCESS("workflow:success"),
    WORKFLOW_ERROR("workflow:error"),
    WORKFLOW_CANCELLED("workflow:cancelled"),
    STEP_START("step:start"),
    STEP_SUCCESS("step:success"),
    STEP_ERROR("step:error"),
    STEP_EVENT("step:event"),
    STEP_BRANCH("step:branch"),
    STEP_HUMAN_REQUESTED("step:human:requested"),
    STEP_HUMAN_COMPLETED("step:human:completed");

    private final String value;

    WorkflowEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isWorkflowLevel() {
        return value.startsWith("workflow:");
    }
}
