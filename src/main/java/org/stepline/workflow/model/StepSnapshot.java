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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One recorded attempt of a step within a run.
 * <p>
 * Loops, dynamic {@code next} resolvers and resumption may enter the same step id
 * more than once; every entry appends a snapshot with an increasing 1-based
 * {@code occurrence}.
 *
 * @param status the attempt status
 * @param input the value that entered the step
 * @param output the validated output, when successful
 * @param error the failure cause, when failed
 * @param startedAt when the step was entered
 * @param finishedAt when the attempt ended (or when the human request was issued)
 * @param occurrence 1-based visit number of this step id
 * @param branchId the branch resolved by this step, if any
 * @param nextStepId the step that follows, if any
 * @param parallelGroupId the concurrent group this step ran under, if any
 * @param parallelBranchId the concurrent branch this step ran under, if any
 */
public record StepSnapshot(
        StepStatus status,
        Object input,
        Object output,
        Throwable error,
        Instant startedAt,
        Instant finishedAt,
        int occurrence,
        String branchId,
        String nextStepId,
        String parallelGroupId,
        String parallelBranchId
) {

    public StepSnapshot {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(startedAt, "startedAt cannot be null");
    }

    public static StepSnapshot success(Object input, Object output, Instant startedAt, Instant finishedAt,
                                       int occurrence, String branchId, String nextStepId) {
        return new StepSnapshot(StepStatus.SUCCESS, input, output, null, startedAt, finishedAt,
                occurrence, branchId, nextStepId, null, null);
    }

    public static StepSnapshot failed(Object input, Throwable error, Instant startedAt, Instant finishedAt,
                                      int occurrence) {
        return new StepSnapshot(StepStatus.FAILED, input, null, error, startedAt, finishedAt,
                occurrence, null, null, null, null);
    }

    public static StepSnapshot waitingHuman(Object input, Instant startedAt, Instant requestedAt, int occurrence) {
        return new StepSnapshot(StepStatus.WAITING_HUMAN, input, null, null, startedAt, requestedAt,
                occurrence, null, null, null, null);
    }

    /**
     * Creates a copy completed by a human response.
     *
     * @param response the parsed response
     * @param nextStepId the step that follows
     * @param finishedAt when the response was applied
     * @return updated snapshot
     */
    public StepSnapshot resolveHuman(Object response, String nextStepId, Instant finishedAt) {
        return new StepSnapshot(StepStatus.SUCCESS, input, response, null, startedAt, finishedAt,
                occurrence, null, nextStepId, parallelGroupId, parallelBranchId);
    }

    /**
     * Creates a copy tagged with the concurrent group and branch it ran under.
     */
    public StepSnapshot inBranch(String groupId, String branchId) {
        return new StepSnapshot(status, input, output, error, startedAt, finishedAt,
                occurrence, this.branchId, nextStepId, groupId, branchId);
    }

    /**
     * Gets the time spent in this attempt.
     *
     * @return the duration, or null if the attempt has not finished
     */
    public Duration getDuration() {
        if (finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
