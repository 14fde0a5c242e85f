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

package org.stepline.workflow.model;

import org.stepline.workflow.human.PendingHumanTask;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of starting or resuming a workflow run.
 *
 * @param runId the run id
 * @param status the outcome
 * @param result the finalized and validated output on success
 * @param error the cause on failure or cancellation
 * @param steps recorded attempts per step id
 * @param metadata the run metadata at the time of the result
 * @param ctx the run context at the time of the result
 * @param startedAt when the run started
 * @param finishedAt when this result was produced
 * @param pendingHuman the task to answer when {@code status} is waiting_human
 * @param <O> the workflow output type
 */
public record WorkflowRunResult<O>(
        String runId,
        RunStatus status,
        O result,
        Throwable error,
        Map<String, List<StepSnapshot>> steps,
        Map<String, Object> metadata,
        Map<String, Object> ctx,
        Instant startedAt,
        Instant finishedAt,
        PendingHumanTask pendingHuman
) {

    public WorkflowRunResult {
        Objects.requireNonNull(status, "status cannot be null");
        steps = steps != null ? steps : Map.of();
        metadata = metadata != null ? metadata : Map.of();
        ctx = ctx != null ? ctx : Map.of();
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public boolean isWaitingHuman() {
        return status == RunStatus.WAITING_HUMAN;
    }

    /**
     * Gets the snapshots recorded for a step id.
     *
     * @return the snapshots, empty if the step was never entered
     */
    public List<StepSnapshot> stepSnapshots(String stepId) {
        return steps.getOrDefault(stepId, List.of());
    }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
