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

import com.fasterxml.jackson.annotation.JsonInclude;
import org.stepline.workflow.model.Metadata;

import java.time.Instant;
import java.util.Map;

/**
 * Represents a run lifecycle event.
 * <p>
 * Events are delivered to the run's watchers and to its event stream, in emission order.
 *
 * @param type the type of event
 * @param workflowId the workflow ID
 * @param runId the run ID
 * @param stepId the step ID (for step events)
 * @param timestamp when the event occurred
 * @param metadata copy of the run metadata at emission time
 * @param payload the event payload
 * @param parallelGroupId the concurrent group, for steps of a sub-graph branch
 * @param parallelBranchId the concurrent branch, for steps of a sub-graph branch
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowEvent(
        WorkflowEventType type,
        String workflowId,
        String runId,
        String stepId,
        Instant timestamp,
        Map<String, Object> metadata,
        Object payload,
        String parallelGroupId,
        String parallelBranchId
) {

    public WorkflowEvent {
        metadata = metadata != null ? metadata : Map.of();
    }

    /**
     * Creates a run-level event.
     */
    public static WorkflowEvent workflow(WorkflowEventType type, String workflowId, String runId,
                                         Map<String, Object> metadata, Object payload) {
        return new WorkflowEvent(type, workflowId, runId, null, Instant.now(),
                Metadata.deepCopy(metadata), payload, null, null);
    }

    /**
     * Creates a step-level event.
     */
    public static WorkflowEvent step(WorkflowEventType type, String workflowId, String runId, String stepId,
                                     Map<String, Object> metadata, Object payload,
                                     String parallelGroupId, String parallelBranchId) {
        return new WorkflowEvent(type, workflowId, runId, stepId, Instant.now(),
                Metadata.deepCopy(metadata), payload, parallelGroupId, parallelBranchId);
    }

    /**
     * Gets the wire name of the event type.
     */
    public String getEventTypeString() {
        return type.value();
    }

    /**
     * Error information.
     */
    public record ErrorInfo(String type, String message) {

        public static ErrorInfo of(Throwable error) {
            if (error == null) {
                return null;
            }
            return new ErrorInfo(error.getClass().getSimpleName(), error.getMessage());
        }
    }
}
