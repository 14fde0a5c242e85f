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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.contextpropagation.ObservationThreadLocalAccessor;
import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.human.HumanRequest;
import org.stepline.workflow.human.PendingHumanTask;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.step.WorkflowStep;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * {@link RunTelemetry} backed by Micrometer observations: one observation per run and a
 * child observation per step execution.
 */
@Slf4j
class ObservationRunTelemetry implements RunTelemetry {

    static final String RUN_OBSERVATION = "stepline.workflow.run";
    static final String STEP_OBSERVATION = "stepline.workflow.step";
    static final String HUMAN_OBSERVATION = "stepline.workflow.human";

    private final ObservationRegistry registry;
    private final ObjectMapper objectMapper;
    private final String workflowId;
    private final String runId;
    private final String description;
    private final TelemetrySettings settings;

    private volatile Observation runObservation;

    ObservationRunTelemetry(ObservationRegistry registry, ObjectMapper objectMapper, String workflowId,
                            String runId, String description, TelemetrySettings settings) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.workflowId = workflowId;
        this.runId = runId;
        this.description = description;
        this.settings = settings;
    }

    @Override
    public void startWorkflow(Instant startedAt, Object input) {
        safely("startWorkflow", () -> {
            Observation observation = Observation.createNotStarted(RUN_OBSERVATION, registry)
                    .contextualName(settings.traceName())
                    .lowCardinalityKeyValue("workflow.id", workflowId)
                    .highCardinalityKeyValue("workflow.run.id", runId);
            if (description != null) {
                observation.highCardinalityKeyValue("workflow.description", description);
            }
            if (settings.userId() != null) {
                observation.highCardinalityKeyValue("user.id", settings.userId());
            }
            settings.metadata().forEach((key, value) ->
                    observation.highCardinalityKeyValue("workflow.metadata." + key, String.valueOf(value)));
            if (settings.recordInputs()) {
                observation.highCardinalityKeyValue("workflow.input", render(input));
            }
            runObservation = observation.start();
            log.debug("Started run observation: workflowId={}, runId={}, traceName={}",
                    workflowId, runId, settings.traceName());
        });
    }

    @Override
    public void finishWorkflow(Instant finishedAt, RunStatus status, Object output, Throwable error) {
        Observation observation = runObservation;
        if (observation == null) {
            return;
        }
        safely("finishWorkflow", () -> {
            if (status == RunStatus.WAITING_HUMAN) {
                observation.event(Observation.Event.of("workflow.waiting_human"));
                return;
            }
            observation.lowCardinalityKeyValue("workflow.outcome", status.value());
            if (settings.recordOutputs() && output != null) {
                observation.highCardinalityKeyValue("workflow.output", render(output));
            }
            if (error != null) {
                observation.error(error);
            }
            observation.stop();
            log.debug("Stopped run observation: workflowId={}, runId={}, outcome={}", workflowId, runId, status);
        });
    }

    @Override
    public StepSpan startStep(WorkflowStep<?, ?> step, int occurrence, Instant startedAt,
                              String parallelGroupId, String parallelBranchId) {
        try {
            Observation observation = Observation.createNotStarted(STEP_OBSERVATION, registry)
                    .contextualName(step.id())
                    .lowCardinalityKeyValue("workflow.id", workflowId)
                    .lowCardinalityKeyValue("step.id", step.id())
                    .lowCardinalityKeyValue("step.kind", step.kind().name().toLowerCase())
                    .highCardinalityKeyValue("workflow.run.id", runId)
                    .highCardinalityKeyValue("step.occurrence", String.valueOf(occurrence));
            if (parallelGroupId != null) {
                observation.lowCardinalityKeyValue("step.parallel.group", parallelGroupId);
                observation.lowCardinalityKeyValue("step.parallel.branch", parallelBranchId);
            }
            if (runObservation != null) {
                observation.parentObservation(runObservation);
            }
            return new ObservationStepSpan(step.id(), observation.start());
        } catch (RuntimeException e) {
            log.warn("Telemetry startStep failed: workflowId={}, runId={}, stepId={}, error={}",
                    workflowId, runId, step.id(), e.getMessage());
            return StepSpan.NOOP;
        }
    }

    @Override
    public void recordStepSuccess(StepSpan span, Object input, Object output, Instant finishedAt) {
        if (!(span instanceof ObservationStepSpan stepSpan)) {
            return;
        }
        safely("recordStepSuccess", () -> {
            Observation observation = stepSpan.observation();
            if (settings.recordInputs()) {
                observation.highCardinalityKeyValue("step.input", render(input));
            }
            if (settings.recordOutputs()) {
                observation.highCardinalityKeyValue("step.output", render(output));
            }
            observation.lowCardinalityKeyValue("step.outcome", "success");
            observation.stop();
        });
    }

    @Override
    public void recordStepError(StepSpan span, Throwable error, Instant finishedAt) {
        if (!(span instanceof ObservationStepSpan stepSpan)) {
            return;
        }
        safely("recordStepError", () -> {
            Observation observation = stepSpan.observation();
            observation.lowCardinalityKeyValue("step.outcome", "error");
            observation.error(error);
            observation.stop();
        });
    }

    @Override
    public void markWaitingForHuman(StepSpan span, PendingHumanTask task) {
        if (!(span instanceof ObservationStepSpan stepSpan)) {
            return;
        }
        safely("markWaitingForHuman", () -> {
            Observation observation = stepSpan.observation();
            observation.lowCardinalityKeyValue("step.outcome", "waiting_human");
            observation.highCardinalityKeyValue("human.requested_at", String.valueOf(task.requestedAt()));
            observation.stop();
        });
    }

    @Override
    public void recordHumanRequest(StepSpan span, HumanRequest request) {
        if (!(span instanceof ObservationStepSpan stepSpan)) {
            return;
        }
        safely("recordHumanRequest", () -> {
            Observation observation = stepSpan.observation();
            if (request.form() != null && request.form().title() != null) {
                observation.highCardinalityKeyValue("human.form.title", request.form().title());
            }
            if (settings.recordOutputs()) {
                observation.highCardinalityKeyValue("human.payload", render(request.payload()));
            }
        });
    }

    @Override
    public void recordHumanCompletion(StepSpan span, Object response, Instant completedAt) {
        safely("recordHumanCompletion", () -> {
            Observation observation = Observation.createNotStarted(HUMAN_OBSERVATION, registry)
                    .contextualName(span.stepId() + " response")
                    .lowCardinalityKeyValue("workflow.id", workflowId)
                    .lowCardinalityKeyValue("step.id", String.valueOf(span.stepId()))
                    .highCardinalityKeyValue("workflow.run.id", runId);
            if (runObservation != null) {
                observation.parentObservation(runObservation);
            }
            if (settings.recordInputs()) {
                observation.highCardinalityKeyValue("human.response", render(response));
            }
            observation.start().stop();
        });
    }

    @Override
    public <T> Mono<T> runWithStepContext(StepSpan span, Supplier<Mono<T>> body) {
        if (!(span instanceof ObservationStepSpan stepSpan)) {
            return Mono.defer(body);
        }
        return Mono.defer(body)
                .contextWrite(context -> context.put(ObservationThreadLocalAccessor.KEY, stepSpan.observation()));
    }

    private String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private void safely(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            log.warn("Telemetry {} failed: workflowId={}, runId={}, error={}", action, workflowId, runId, e.getMessage());
        }
    }

    record ObservationStepSpan(String stepId, Observation observation) implements StepSpan {
    }
}
