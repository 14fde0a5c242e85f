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

package org.stepline.workflow.tracing;

import org.stepline.workflow.human.HumanRequest;
import org.stepline.workflow.human.PendingHumanTask;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.step.WorkflowStep;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Telemetry of a single run. Every operation defaults to a no-op.
 * <p>
 * Implementations must not throw; the run never fails because of telemetry.
 */
public interface RunTelemetry {

    RunTelemetry NOOP = new RunTelemetry() {
    };

    default void startWorkflow(Instant startedAt, Object input) {
    }

    /**
     * Called when the run settles. {@link RunStatus#WAITING_HUMAN} is not final; the run may
     * be finished again after a resume.
     */
    default void finishWorkflow(Instant finishedAt, RunStatus status, Object output, Throwable error) {
    }

    default StepSpan startStep(WorkflowStep<?, ?> step, int occurrence, Instant startedAt,
                               String parallelGroupId, String parallelBranchId) {
        return StepSpan.NOOP;
    }

    default void recordStepSuccess(StepSpan span, Object input, Object output, Instant finishedAt) {
    }

    default void recordStepError(StepSpan span, Throwable error, Instant finishedAt) {
    }

    default void markWaitingForHuman(StepSpan span, PendingHumanTask task) {
    }

    default void recordHumanRequest(StepSpan span, HumanRequest request) {
    }

    default void recordHumanCompletion(StepSpan span, Object response, Instant completedAt) {
    }

    /**
     * Runs the step body with the step span as the current telemetry scope.
     */
    default <T> Mono<T> runWithStepContext(StepSpan span, Supplier<Mono<T>> body) {
        return Mono.defer(body);
    }
}
