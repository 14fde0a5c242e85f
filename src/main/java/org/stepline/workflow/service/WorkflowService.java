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

package org.stepline.workflow.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.stepline.workflow.core.GraphInspection;
import org.stepline.workflow.core.RunIds;
import org.stepline.workflow.core.Workflow;
import org.stepline.workflow.core.WorkflowRegistry;
import org.stepline.workflow.core.WorkflowRun;
import org.stepline.workflow.core.WorkflowRunStream;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.exception.WorkflowNotFoundException;
import org.stepline.workflow.human.HumanInput;
import org.stepline.workflow.metrics.WorkflowMetrics;
import org.stepline.workflow.model.WorkflowRunOptions;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.properties.WorkflowProperties;
import org.stepline.workflow.tracing.WorkflowTracer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Service layer hosting workflow runs.
 * <p>
 * Runs are created from the {@link WorkflowRegistry}, kept in the {@link WorkflowRunRegistry} while
 * they can still be resumed or cancelled, and released once they settle terminally.
 */
@Slf4j
public class WorkflowService {

    private final WorkflowRegistry workflowRegistry;
    private final WorkflowRunRegistry runRegistry;
    private final WorkflowTracer tracer;
    @Nullable
    private final WorkflowMetrics metrics;
    private final WorkflowProperties properties;

    public WorkflowService(WorkflowRegistry workflowRegistry,
                           WorkflowRunRegistry runRegistry,
                           WorkflowTracer tracer,
                           @Nullable WorkflowMetrics metrics,
                           WorkflowProperties properties) {
        this.workflowRegistry = workflowRegistry;
        this.runRegistry = runRegistry;
        this.tracer = tracer;
        this.metrics = metrics;
        this.properties = properties;
    }

    public List<WorkflowSummary> listWorkflows() {
        return workflowRegistry.getAll().stream()
                .map(WorkflowSummary::from)
                .toList();
    }

    public Optional<WorkflowSummary> getWorkflow(String workflowId) {
        return workflowRegistry.get(workflowId).map(WorkflowSummary::from);
    }

    public Optional<GraphInspection> getInspection(String workflowId) {
        return workflowRegistry.get(workflowId).map(Workflow::inspect);
    }

    /**
     * Starts a run and completes with its result. Runs suspended on a human step stay
     * registered so they can be resumed.
     *
     * @return the run result, or an error with {@link WorkflowNotFoundException} for an unknown workflow
     */
    public Mono<WorkflowRunResult<Object>> run(String workflowId, WorkflowRunOptions options) {
        return Mono.defer(() -> {
            WorkflowRun<Object, Object> run = createRun(workflowId);
            log.info("Starting hosted run: workflowId={}, runId={}", workflowId, run.runId());
            return run.start(options)
                    .doOnNext(result -> releaseIfSettled(run, result));
        });
    }

    /**
     * Starts a run and exposes its events.
     */
    public Mono<RunStream> stream(String workflowId, WorkflowRunOptions options) {
        return Mono.fromCallable(() -> {
            WorkflowRun<Object, Object> run = createRun(workflowId);
            log.info("Streaming hosted run: workflowId={}, runId={}", workflowId, run.runId());
            WorkflowRunStream<Object> stream = run.stream(options);
            return new RunStream(run.runId(), stream.events(),
                    stream.result().doOnNext(result -> releaseIfSettled(run, result)), run::cancel);
        });
    }

    /**
     * Answers the pending human step of a hosted run and continues it.
     *
     * @return the result of the continued run, or an error with {@link WorkflowNotFoundException}
     *         for an unknown run and {@link org.stepline.workflow.exception.WorkflowResumeException}
     *         for a run that is not waiting on {@code stepId}
     */
    public Mono<WorkflowRunResult<Object>> resume(String workflowId, String runId, String stepId, Object data) {
        return Mono.defer(() -> {
            WorkflowRun<Object, Object> run = findRun(workflowId, runId);
            log.info("Resuming hosted run: workflowId={}, runId={}, stepId={}", workflowId, runId, stepId);
            return run.resumeWithHumanInput(new HumanInput(runId, stepId, data))
                    .doOnNext(result -> releaseIfSettled(run, result));
        });
    }

    /**
     * Cancels a hosted run. A run suspended on a human step settles as cancelled when it is next resumed.
     */
    public Mono<Void> cancel(String workflowId, String runId) {
        return Mono.fromRunnable(() -> {
            WorkflowRun<Object, Object> run = findRun(workflowId, runId);
            log.info("Cancelling hosted run: workflowId={}, runId={}, status={}", workflowId, runId, run.status());
            run.cancel();
        });
    }

    @SuppressWarnings("unchecked")
    private WorkflowRun<Object, Object> createRun(String workflowId) {
        Workflow<?, ?> workflow = workflowRegistry.get(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        String runId = RunIds.generate(properties.getRuns().getIdPrefix());
        WorkflowRun<Object, Object> run = (WorkflowRun<Object, Object>) (WorkflowRun<?, ?>)
                workflow.createRun(runId, tracer.isEnabled() ? tracer : null);
        if (metrics != null) {
            run.watch(metrics);
        }
        runRegistry.store(run);
        return run;
    }

    @SuppressWarnings("unchecked")
    private WorkflowRun<Object, Object> findRun(String workflowId, String runId) {
        return (WorkflowRun<Object, Object>) runRegistry.get(workflowId, runId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId, runId));
    }

    private void releaseIfSettled(WorkflowRun<?, ?> run, WorkflowRunResult<?> result) {
        if (result.status().isTerminal()) {
            runRegistry.remove(run.workflowId(), run.runId());
        }
    }

    /**
     * Summary of a registered workflow.
     */
    public record WorkflowSummary(
            String id,
            String description,
            int stepCount
    ) {
        public static WorkflowSummary from(Workflow<?, ?> workflow) {
            return new WorkflowSummary(workflow.id(), workflow.description(), workflow.graph().size());
        }
    }

    /**
     * A streamed hosted run.
     *
     * @param runId the run id
     * @param events the run events; completes when the run settles terminally
     * @param result the run result
     * @param canceller cancels the run
     */
    public record RunStream(
            String runId,
            Flux<WorkflowEvent> events,
            Mono<WorkflowRunResult<Object>> result,
            Runnable canceller
    ) {
        public void cancel() {
            canceller.run();
        }
    }
}
