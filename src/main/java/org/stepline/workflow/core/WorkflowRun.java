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

package org.stepline.workflow.core;

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.cancel.CancellationSource;
import org.stepline.workflow.cancel.CancellationToken;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.event.WorkflowEvent.ErrorInfo;
import org.stepline.workflow.event.WorkflowEventType;
import org.stepline.workflow.event.WorkflowWatcher;
import org.stepline.workflow.exception.WorkflowAbortedException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowResumeException;
import org.stepline.workflow.human.HumanInput;
import org.stepline.workflow.human.PendingHumanTask;
import org.stepline.workflow.model.Metadata;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.model.StepHistoryEntry;
import org.stepline.workflow.model.StepSnapshot;
import org.stepline.workflow.model.WorkflowRunOptions;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.step.HumanStep;
import org.stepline.workflow.step.StepInvocation;
import org.stepline.workflow.step.StepKind;
import org.stepline.workflow.step.StepResult;
import org.stepline.workflow.step.WorkflowStep;
import org.stepline.workflow.step.WorkflowStepContext;
import org.stepline.workflow.tracing.RunTelemetry;
import org.stepline.workflow.tracing.StepSpan;
import org.stepline.workflow.tracing.TelemetrySettings;
import org.stepline.workflow.tracing.WorkflowTracer;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * One execution of a {@link Workflow}.
 * <p>
 * A run walks the compiled graph one step at a time, records a {@link StepSnapshot} per step
 * entry and emits {@link WorkflowEvent}s to its watchers and to its event stream. Human steps
 * suspend the run with status {@link RunStatus#WAITING_HUMAN}; the run continues from
 * {@link #resumeWithHumanInput(HumanInput)}.
 * <p>
 * Errors raised by steps end the run as failed and never escape the returned {@link Mono}.
 * Misuse, such as starting twice or resuming a run that is not waiting, throws immediately.
 *
 * @param <I> the workflow input type
 * @param <O> the workflow output type
 */
@Slf4j
public class WorkflowRun<I, O> {

    private final Workflow<I, O> workflow;
    private final Graph graph;
    private final String runId;
    private final WorkflowTracer tracer;

    private final CancellationSource cancellation = new CancellationSource();
    private final AtomicBoolean started = new AtomicBoolean();
    private final List<WorkflowWatcher> watchers = new CopyOnWriteArrayList<>();
    private final Map<String, Object> store = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, StepHistoryEntry> history = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, List<StepSnapshot>> snapshots = new LinkedHashMap<>();
    private final Map<String, Integer> occurrences = new HashMap<>();

    private volatile CancellationToken token = CancellationToken.none();
    private volatile CancellationSource link;
    private volatile RunTelemetry telemetry = RunTelemetry.NOOP;
    private volatile Map<String, Object> metadata = new LinkedHashMap<>();
    private volatile Map<String, Object> ctx = new LinkedHashMap<>();
    private volatile Object initialInput;
    private volatile Object current;
    private volatile Instant startedAt;
    private volatile RunStatus status;
    private volatile PendingHuman pendingHuman;
    private Sinks.Many<WorkflowEvent> eventSink;

    WorkflowRun(Workflow<I, O> workflow, String runId, WorkflowTracer tracer) {
        this.workflow = workflow;
        this.graph = workflow.graph();
        this.runId = runId;
        this.tracer = tracer != null ? tracer : WorkflowTracer.noop();
    }

    public String runId() {
        return runId;
    }

    public String workflowId() {
        return workflow.id();
    }

    /**
     * Last settled status, {@code null} while the run has not settled yet.
     */
    public RunStatus status() {
        return status;
    }

    public Optional<PendingHumanTask> pendingHuman() {
        PendingHuman pending = pendingHuman;
        return Optional.ofNullable(pending != null ? pending.task() : null);
    }

    /**
     * Registers a synchronous listener for the events of this run.
     *
     * @return a handle that removes the listener
     */
    public Disposable watch(WorkflowWatcher watcher) {
        watchers.add(watcher);
        return () -> watchers.remove(watcher);
    }

    /**
     * Trips the run's internal cancellation source. The run stops before its next step and
     * in-flight steps observe the token.
     */
    public void cancel() {
        if (cancellation.cancel(new WorkflowAbortedException("Workflow run cancelled"))) {
            log.info("Workflow run cancelled: workflowId={}, runId={}", workflowId(), runId);
        }
    }

    /**
     * Starts the run.
     *
     * @throws WorkflowExecutionException when the run was already started
     */
    public Mono<WorkflowRunResult<O>> start(WorkflowRunOptions options) {
        if (!started.compareAndSet(false, true)) {
            throw new WorkflowExecutionException("Workflow run can only be started once");
        }
        WorkflowRunOptions effective = options != null ? options : WorkflowRunOptions.of(null);
        this.link = CancellationSource.linkedTo(cancellation.token(), effective.cancellationToken());
        this.token = link.token();
        this.metadata = effective.metadata() != null
                ? Metadata.deepCopy(effective.metadata())
                : workflow.initialMetadata();
        this.ctx = Metadata.merge(workflow.initialCtx(), effective.ctx());
        store.put(HumanStep.HISTORY_STORE_KEY, history);
        this.telemetry = tracer.startRun(workflowId(), runId, workflow.description(),
                TelemetrySettings.resolve(workflowId(), workflow.telemetry(), effective.telemetry()));
        this.startedAt = Instant.now();

        return Mono.defer(() -> execute(effective.inputData()))
                .onErrorResume(this::failUnexpectedly)
                .cache();
    }

    /**
     * Starts the run and exposes its events as a stream.
     *
     * @throws WorkflowExecutionException when the run was already started
     */
    public WorkflowRunStream<O> stream(WorkflowRunOptions options) {
        if (started.get()) {
            throw new WorkflowExecutionException("Workflow run can only be started once");
        }
        Sinks.Many<WorkflowEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
        synchronized (this) {
            this.eventSink = sink;
        }
        Mono<WorkflowRunResult<O>> result = start(options);
        Flux<WorkflowEvent> events = sink.asFlux()
                .doOnSubscribe(subscription -> result.subscribe(
                        outcome -> log.debug("Streamed run settled: workflowId={}, runId={}, status={}",
                                workflowId(), runId, outcome.status()),
                        error -> log.warn("Streamed run errored: workflowId={}, runId={}, error={}",
                                workflowId(), runId, error.getMessage())));
        return new WorkflowRunStream<>(events, result);
    }

    /**
     * Completes the pending human step with the given response and continues the run.
     * <p>
     * Validation happens immediately: on failure the exception is thrown and the run stays
     * suspended. On success the suspension is consumed and the returned {@link Mono} drives
     * the rest of the run.
     *
     * @throws WorkflowResumeException when the run is not waiting on the given step
     * @throws org.stepline.workflow.exception.SchemaValidationException when the response is rejected
     */
    public Mono<WorkflowRunResult<O>> resumeWithHumanInput(HumanInput input) {
        if (!started.get()) {
            throw new WorkflowResumeException("Workflow run has not been started");
        }
        PendingHuman pending;
        Object response;
        synchronized (this) {
            pending = this.pendingHuman;
            if (pending == null) {
                throw new WorkflowResumeException("No human interaction is pending for this run");
            }
            if (input.runId() != null && !input.runId().equals(runId)) {
                throw new WorkflowResumeException("Cannot resume run " + input.runId() + " with id " + runId);
            }
            if (!pending.step().id().equals(input.stepId())) {
                throw new WorkflowResumeException("Pending human interaction is for step "
                        + pending.step().id() + ", received " + input.stepId());
            }
            response = pending.step().parseResponse(input.data());
            this.pendingHuman = null;
            this.status = null;
        }
        log.info("HUMAN_RESUME: workflowId={}, runId={}, stepId={}", workflowId(), runId, pending.step().id());

        return Mono.defer(() -> continueAfterHuman(pending, response))
                .onErrorResume(this::failUnexpectedly)
                .cache();
    }

    private Mono<WorkflowRunResult<O>> execute(Object input) {
        Object validated;
        try {
            validated = workflow.validateInput(input);
        } catch (RuntimeException e) {
            log.error("WORKFLOW_FAILED: workflowId={}, runId={}, reason=invalid_input, error={}",
                    workflowId(), runId, e.getMessage());
            emitWorkflow(WorkflowEventType.WORKFLOW_ERROR, ErrorInfo.of(e));
            return Mono.just(settle(RunStatus.FAILED, null, e, null));
        }
        this.initialInput = validated;
        this.current = validated;
        telemetry.startWorkflow(startedAt, validated);
        log.info("WORKFLOW_START: workflowId={}, runId={}, entryStepId={}", workflowId(), runId, graph.entryId());
        emitWorkflow(WorkflowEventType.WORKFLOW_START, validated);
        return runLoop(graph.entryId());
    }

    /**
     * Drives the main loop from {@code entryId}. Each pass visits one step and either moves the
     * cursor or settles the run; passes are resubscribed by {@code repeat()} so revisits do not
     * nest.
     */
    private Mono<WorkflowRunResult<O>> runLoop(String entryId) {
        AtomicReference<String> cursor = new AtomicReference<>(entryId);
        return Mono.defer(() -> visitStep(cursor))
                .repeat()
                .filter(Optional::isPresent)
                .next()
                .map(Optional::get);
    }

    private Mono<Optional<WorkflowRunResult<O>>> visitStep(AtomicReference<String> cursor) {
        String stepId = cursor.get();
        if (token.isCancelled()) {
            return Mono.just(Optional.of(settleCancelled()));
        }
        if (stepId == null) {
            return Mono.just(Optional.of(complete()));
        }
        WorkflowStep<?, ?> step = graph.steps().get(stepId);
        if (step == null) {
            WorkflowExecutionException error = new WorkflowExecutionException("Unknown step " + stepId);
            log.error("WORKFLOW_FAILED: workflowId={}, runId={}, error={}", workflowId(), runId, error.getMessage());
            emitWorkflow(WorkflowEventType.WORKFLOW_ERROR, ErrorInfo.of(error));
            return Mono.just(Optional.of(settle(RunStatus.FAILED, null, error, null)));
        }

        Instant stepStartedAt = Instant.now();
        int occurrence = nextOccurrence(stepId);
        Object entering = current;
        StepSpan span = telemetry.startStep(step, occurrence, stepStartedAt, null, null);
        log.info("STEP_START: workflowId={}, runId={}, stepId={}, kind={}, occurrence={}",
                workflowId(), runId, stepId, step.kind(), occurrence);
        emitStep(WorkflowEventType.STEP_START, stepId, entering, null, null);
        RunStepContext context = new RunStepContext(stepId, null, null);

        if (step.kind() == StepKind.HUMAN) {
            return handleHumanStep((HumanStep<?, ?>) step, entering, context, span, occurrence, stepStartedAt)
                    .map(Optional::of);
        }

        StepInvocation invocation = new StepInvocation(entering, context, token, this::runBranch);
        return telemetry.runWithStepContext(span, () -> step.execute(invocation))
                .switchIfEmpty(Mono.error(() -> new WorkflowExecutionException(
                        "Step " + stepId + " completed without a result")))
                .flatMap(result -> graph.resolveTransition(step, result, context)
                        .map(transition -> StepAttempt.succeeded(result, transition)))
                .onErrorResume(error -> Mono.just(StepAttempt.failed(error)))
                .map(attempt -> {
                    if (attempt.error() != null) {
                        return Optional.of(onStepFailure(stepId, entering, attempt.error(),
                                occurrence, stepStartedAt, span));
                    }
                    String next = recordStepSuccess(stepId, attempt, occurrence, stepStartedAt, span, null, null);
                    current = attempt.result().output();
                    cursor.set(next);
                    return Optional.<WorkflowRunResult<O>>empty();
                });
    }

    private Mono<WorkflowRunResult<O>> handleHumanStep(HumanStep<?, ?> step, Object entering, RunStepContext context,
                                                       StepSpan span, int occurrence, Instant stepStartedAt) {
        return step.buildHumanRequest(new StepInvocation(entering, context, token, null))
                .map(request -> {
                    Instant requestedAt = Instant.now();
                    int index = record(step.id(),
                            StepSnapshot.waitingHuman(request.input(), stepStartedAt, requestedAt, occurrence));
                    PendingHumanTask task = new PendingHumanTask(runId, step.id(), workflowId(),
                            request.payload(), request.form(), requestedAt);
                    current = request.input();
                    pendingHuman = new PendingHuman(step, request.input(), context, index, occurrence, task, span);
                    telemetry.recordHumanRequest(span, request);
                    telemetry.markWaitingForHuman(span, task);
                    log.info("HUMAN_REQUESTED: workflowId={}, runId={}, stepId={}", workflowId(), runId, step.id());
                    emitStep(WorkflowEventType.STEP_HUMAN_REQUESTED, step.id(), task, null, null);
                    return settle(RunStatus.WAITING_HUMAN, null, null, task);
                })
                .onErrorResume(error -> Mono.just(
                        onStepFailure(step.id(), entering, error, occurrence, stepStartedAt, span)));
    }

    private Mono<WorkflowRunResult<O>> continueAfterHuman(PendingHuman pending, Object response) {
        HumanStep<?, ?> step = pending.step();
        StepResult result = new StepResult(pending.input(), response);
        return graph.resolveTransition(step, result, pending.context())
                .map(transition -> StepAttempt.succeeded(result, transition))
                .onErrorResume(error -> Mono.just(StepAttempt.failed(error)))
                .flatMap(attempt -> {
                    Instant finishedAt = Instant.now();
                    if (attempt.error() != null) {
                        replace(step.id(), pending.snapshotIndex(), StepSnapshot.failed(pending.input(),
                                attempt.error(), pending.task().requestedAt(), finishedAt, pending.occurrence()));
                        telemetry.recordHumanCompletion(pending.span(), response, finishedAt);
                        return Mono.just(failRun(step.id(), attempt.error()));
                    }
                    String next = attempt.transition().nextStepId();
                    synchronized (this) {
                        List<StepSnapshot> entries = snapshots.get(step.id());
                        StepSnapshot waiting = entries.get(pending.snapshotIndex());
                        entries.set(pending.snapshotIndex(), waiting.resolveHuman(response, next, finishedAt));
                    }
                    history.put(step.id(), new StepHistoryEntry(pending.input(), response));
                    telemetry.recordHumanCompletion(pending.span(), response, finishedAt);
                    emitBranch(step.id(), attempt.transition(), null, null);

                    Map<String, Object> completed = new LinkedHashMap<>();
                    completed.put("response", response);
                    completed.put("nextStepId", next);
                    log.info("HUMAN_COMPLETED: workflowId={}, runId={}, stepId={}, nextStepId={}",
                            workflowId(), runId, step.id(), next);
                    emitStep(WorkflowEventType.STEP_HUMAN_COMPLETED, step.id(), completed, null, null);
                    emitStep(WorkflowEventType.STEP_SUCCESS, step.id(), response, null, null);
                    current = response;
                    return runLoop(next);
                });
    }

    /**
     * Walks a concurrent sub-graph branch. Steps are recorded in the run history tagged with
     * the group and branch ids; the first failure ends the branch.
     */
    private Mono<StepResult> runBranch(String groupId, String branchId, Graph branch, Object input,
                                       CancellationToken branchToken) {
        log.debug("Branch start: workflowId={}, runId={}, groupId={}, branchId={}", workflowId(), runId, groupId, branchId);
        AtomicReference<BranchPosition> position = new AtomicReference<>(new BranchPosition(branch.entryId(), input));
        return Mono.defer(() -> visitBranchStep(groupId, branchId, branch, input, position, branchToken))
                .repeat()
                .filter(Optional::isPresent)
                .next()
                .map(Optional::get);
    }

    private Mono<Optional<StepResult>> visitBranchStep(String groupId, String branchId, Graph branch,
                                                       Object branchInput, AtomicReference<BranchPosition> position,
                                                       CancellationToken branchToken) {
        String stepId = position.get().stepId();
        Object value = position.get().value();
        if (stepId == null) {
            return Mono.just(Optional.of(new StepResult(branchInput, value)));
        }
        branchToken.throwIfCancelled();
        WorkflowStep<?, ?> step = branch.steps().get(stepId);
        if (step == null) {
            return Mono.error(new WorkflowExecutionException("Unknown step " + stepId));
        }
        Instant stepStartedAt = Instant.now();
        int occurrence = nextOccurrence(stepId);
        StepSpan span = telemetry.startStep(step, occurrence, stepStartedAt, groupId, branchId);
        log.info("STEP_START: workflowId={}, runId={}, stepId={}, kind={}, occurrence={}, groupId={}, branchId={}",
                workflowId(), runId, stepId, step.kind(), occurrence, groupId, branchId);
        emitStep(WorkflowEventType.STEP_START, stepId, value, groupId, branchId);
        RunStepContext context = new RunStepContext(stepId, groupId, branchId);
        StepInvocation invocation = new StepInvocation(value, context, branchToken, null);

        return telemetry.runWithStepContext(span, () -> step.execute(invocation))
                .switchIfEmpty(Mono.error(() -> new WorkflowExecutionException(
                        "Step " + stepId + " completed without a result")))
                .flatMap(result -> branch.resolveTransition(step, result, context)
                        .map(transition -> StepAttempt.succeeded(result, transition)))
                .doOnError(error -> {
                    Instant finishedAt = Instant.now();
                    record(stepId, StepSnapshot.failed(value, error, stepStartedAt, finishedAt, occurrence)
                            .inBranch(groupId, branchId));
                    telemetry.recordStepError(span, error, finishedAt);
                    log.error("STEP_FAILED: workflowId={}, runId={}, stepId={}, groupId={}, branchId={}, error={}",
                            workflowId(), runId, stepId, groupId, branchId, error.getMessage());
                    emitStep(WorkflowEventType.STEP_ERROR, stepId, ErrorInfo.of(error), groupId, branchId);
                })
                .map(attempt -> {
                    String next = recordStepSuccess(stepId, attempt, occurrence, stepStartedAt, span, groupId, branchId);
                    position.set(new BranchPosition(next, attempt.result().output()));
                    return Optional.<StepResult>empty();
                });
    }

    private String recordStepSuccess(String stepId, StepAttempt attempt, int occurrence, Instant stepStartedAt,
                                     StepSpan span, String groupId, String branchId) {
        Instant finishedAt = Instant.now();
        StepResult result = attempt.result();
        StepTransition transition = attempt.transition();
        StepSnapshot snapshot = StepSnapshot.success(result.input(), result.output(), stepStartedAt, finishedAt,
                occurrence, transition.branchId(), transition.nextStepId());
        record(stepId, groupId != null ? snapshot.inBranch(groupId, branchId) : snapshot);
        history.put(stepId, new StepHistoryEntry(result.input(), result.output()));
        telemetry.recordStepSuccess(span, result.input(), result.output(), finishedAt);
        emitBranch(stepId, transition, groupId, branchId);
        log.info("STEP_COMPLETE: workflowId={}, runId={}, stepId={}, status=SUCCESS, nextStepId={}, durationMs={}",
                workflowId(), runId, stepId, transition.nextStepId(),
                Duration.between(stepStartedAt, finishedAt).toMillis());
        emitStep(WorkflowEventType.STEP_SUCCESS, stepId, result.output(), groupId, branchId);
        return transition.nextStepId();
    }

    private void emitBranch(String stepId, StepTransition transition, String groupId, String branchId) {
        if (transition.branchId() == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("branchId", transition.branchId());
        payload.put("nextStepId", transition.nextStepId());
        payload.put("conditionStepId", stepId);
        emitStep(WorkflowEventType.STEP_BRANCH, stepId, payload, groupId, branchId);
    }

    private WorkflowRunResult<O> onStepFailure(String stepId, Object entering, Throwable error, int occurrence,
                                               Instant stepStartedAt, StepSpan span) {
        Instant finishedAt = Instant.now();
        record(stepId, StepSnapshot.failed(entering, error, stepStartedAt, finishedAt, occurrence));
        telemetry.recordStepError(span, error, finishedAt);
        log.error("STEP_FAILED: workflowId={}, runId={}, stepId={}, error={}, durationMs={}",
                workflowId(), runId, stepId, error.getMessage(), Duration.between(stepStartedAt, finishedAt).toMillis());
        emitStep(WorkflowEventType.STEP_ERROR, stepId, ErrorInfo.of(error), null, null);
        return failRun(stepId, error);
    }

    private WorkflowRunResult<O> failRun(String stepId, Throwable error) {
        if (token.isCancelled()) {
            return settleCancelled();
        }
        log.error("WORKFLOW_FAILED: workflowId={}, runId={}, stepId={}, error={}",
                workflowId(), runId, stepId, error.getMessage());
        emitWorkflow(WorkflowEventType.WORKFLOW_ERROR, ErrorInfo.of(error));
        return settle(RunStatus.FAILED, null, error, null);
    }

    private WorkflowRunResult<O> complete() {
        O output;
        try {
            output = workflow.validateOutput(current);
        } catch (RuntimeException e) {
            log.error("WORKFLOW_FAILED: workflowId={}, runId={}, reason=invalid_output, error={}",
                    workflowId(), runId, e.getMessage());
            emitWorkflow(WorkflowEventType.WORKFLOW_ERROR, ErrorInfo.of(e));
            return settle(RunStatus.FAILED, null, e, null);
        }
        emitWorkflow(WorkflowEventType.WORKFLOW_SUCCESS, output);
        return settle(RunStatus.SUCCESS, output, null, null);
    }

    private WorkflowRunResult<O> settleCancelled() {
        Throwable reason = token.reason();
        WorkflowAbortedException error = reason instanceof WorkflowAbortedException aborted
                ? aborted
                : new WorkflowAbortedException("Workflow run aborted", reason);
        log.info("WORKFLOW_CANCELLED: workflowId={}, runId={}, reason={}", workflowId(), runId, error.getMessage());
        emitWorkflow(WorkflowEventType.WORKFLOW_CANCELLED, ErrorInfo.of(error));
        return settle(RunStatus.CANCELLED, null, error, null);
    }

    private Mono<WorkflowRunResult<O>> failUnexpectedly(Throwable error) {
        log.error("Workflow run failed unexpectedly: workflowId={}, runId={}", workflowId(), runId, error);
        emitWorkflow(WorkflowEventType.WORKFLOW_ERROR, ErrorInfo.of(error));
        return Mono.just(settle(RunStatus.FAILED, null, error, null));
    }

    private WorkflowRunResult<O> settle(RunStatus outcome, O output, Throwable error, PendingHumanTask pending) {
        Instant finishedAt = Instant.now();
        this.status = outcome;
        telemetry.finishWorkflow(finishedAt, outcome, output, error);
        if (outcome == RunStatus.SUCCESS) {
            log.info("WORKFLOW_COMPLETE: workflowId={}, runId={}, status={}, durationMs={}",
                    workflowId(), runId, outcome, startedAt != null
                            ? Duration.between(startedAt, finishedAt).toMillis() : 0);
        }
        WorkflowRunResult<O> result;
        synchronized (this) {
            Map<String, List<StepSnapshot>> steps = new LinkedHashMap<>();
            snapshots.forEach((stepId, entries) -> steps.put(stepId, List.copyOf(entries)));
            result = new WorkflowRunResult<>(runId, outcome, output, error, Collections.unmodifiableMap(steps),
                    Metadata.deepCopy(metadata), Metadata.deepCopy(ctx), startedAt, finishedAt, pending);
        }
        if (outcome.isTerminal()) {
            if (link != null) {
                link.release();
            }
            closeStream();
        }
        return result;
    }

    private synchronized int nextOccurrence(String stepId) {
        return occurrences.merge(stepId, 1, Integer::sum);
    }

    private synchronized int record(String stepId, StepSnapshot snapshot) {
        List<StepSnapshot> entries = snapshots.computeIfAbsent(stepId, id -> new ArrayList<>());
        entries.add(snapshot);
        return entries.size() - 1;
    }

    private synchronized void replace(String stepId, int index, StepSnapshot snapshot) {
        snapshots.get(stepId).set(index, snapshot);
    }

    private void emitWorkflow(WorkflowEventType type, Object payload) {
        emit(WorkflowEvent.workflow(type, workflowId(), runId, metadata, payload));
    }

    private void emitStep(WorkflowEventType type, String stepId, Object payload, String groupId, String branchId) {
        emit(WorkflowEvent.step(type, workflowId(), runId, stepId, metadata, payload, groupId, branchId));
    }

    private synchronized void emit(WorkflowEvent event) {
        for (WorkflowWatcher watcher : watchers) {
            try {
                watcher.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Workflow watcher failed: workflowId={}, runId={}, event={}, error={}",
                        workflowId(), runId, event.getEventTypeString(), e.getMessage());
            }
        }
        if (eventSink != null) {
            eventSink.tryEmitNext(event);
        }
    }

    private synchronized void closeStream() {
        if (eventSink != null) {
            eventSink.tryEmitComplete();
            eventSink = null;
        }
    }

    private record StepAttempt(StepResult result, StepTransition transition, Throwable error) {

        static StepAttempt succeeded(StepResult result, StepTransition transition) {
            return new StepAttempt(result, transition, null);
        }

        static StepAttempt failed(Throwable error) {
            return new StepAttempt(null, null, error);
        }
    }

    private record BranchPosition(String stepId, Object value) {
    }

    private record PendingHuman(HumanStep<?, ?> step, Object input, WorkflowStepContext context, int snapshotIndex,
                                int occurrence, PendingHumanTask task, StepSpan span) {
    }

    /**
     * Per-step view of the run handed to step handlers.
     */
    private final class RunStepContext implements WorkflowStepContext {

        private final String stepId;
        private final String groupId;
        private final String branchId;

        private RunStepContext(String stepId, String groupId, String branchId) {
            this.stepId = stepId;
            this.groupId = groupId;
            this.branchId = branchId;
        }

        @Override
        public String workflowId() {
            return WorkflowRun.this.workflowId();
        }

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public String stepId() {
            return stepId;
        }

        @Override
        public Object initialInput() {
            return initialInput;
        }

        @Override
        public Map<String, Object> store() {
            return store;
        }

        @Override
        public Map<String, Object> getMetadata() {
            synchronized (WorkflowRun.this) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
            }
        }

        @Override
        public void updateMetadata(UnaryOperator<Map<String, Object>> updater) {
            synchronized (WorkflowRun.this) {
                Map<String, Object> next = updater.apply(new LinkedHashMap<>(metadata));
                metadata = next != null ? new LinkedHashMap<>(next) : new LinkedHashMap<>();
            }
        }

        @Override
        public Map<String, Object> getCtx() {
            synchronized (WorkflowRun.this) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(ctx));
            }
        }

        @Override
        public void updateCtx(UnaryOperator<Map<String, Object>> updater) {
            synchronized (WorkflowRun.this) {
                Map<String, Object> next = updater.apply(new LinkedHashMap<>(ctx));
                ctx = next != null ? new LinkedHashMap<>(next) : new LinkedHashMap<>();
            }
        }

        @Override
        public void emit(String name, Object payload) {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("name", name);
            event.put("payload", payload);
            emitStep(WorkflowEventType.STEP_EVENT, stepId, event, groupId, branchId);
        }
    }
}
