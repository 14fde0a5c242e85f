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

import org.junit.jupiter.api.Test;
import org.stepline.workflow.cancel.CancellationSource;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.event.WorkflowEventType;
import org.stepline.workflow.exception.ConcurrentGroupException;
import org.stepline.workflow.exception.SchemaValidationException;
import org.stepline.workflow.exception.WorkflowAbortedException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.model.StepSnapshot;
import org.stepline.workflow.model.StepStatus;
import org.stepline.workflow.model.WorkflowRunOptions;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.step.ConcurrentGroupStep;
import org.stepline.workflow.step.HumanStep;
import org.stepline.workflow.step.IterativeLoopStep;
import org.stepline.workflow.step.PlainStep;
import org.stepline.workflow.step.Steps;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowRunTest {

    private static PlainStep<Object, Object> constant(String id, Object output) {
        return Steps.<Object, Object>step(id).handle(args -> output).build();
    }

    @Test
    void shouldRunStepsInOrderAndReturnLastOutput() {
        PlainStep<Object, Object> a = constant("A", Map.of("x", 1));
        PlainStep<Object, Object> b = Steps.<Object, Object>step("B")
                .handle(args -> Map.of("seen", args.input()))
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("pair").then(a).then(b).commit();

        StepVerifier.create(workflow.run(Map.of()))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.result()).isEqualTo(Map.of("seen", Map.of("x", 1)));
                    assertThat(result.runId()).startsWith("run_");
                    assertThat(result.stepSnapshots("A")).hasSize(1);
                    assertThat(result.stepSnapshots("B")).hasSize(1);
                    StepSnapshot first = result.stepSnapshots("A").get(0);
                    assertThat(first.status()).isEqualTo(StepStatus.SUCCESS);
                    assertThat(first.occurrence()).isEqualTo(1);
                    assertThat(first.nextStepId()).isEqualTo("B");
                    assertThat(first.output()).isEqualTo(Map.of("x", 1));
                    assertThat(result.stepSnapshots("B").get(0).nextStepId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void shouldContinueAfterConditionBlockWhenNoBranchResolves() {
        List<String> executed = new CopyOnWriteArrayList<>();
        PlainStep<Object, Object> check = Steps.<Object, Object>step("A")
                .handle(args -> {
                    executed.add("A");
                    return args.input();
                })
                .branchWhen(t -> "big".equals(t.output()) ? "big" : null)
                .build();
        PlainStep<Object, Object> c = Steps.<Object, Object>step("C").handle(args -> {
            executed.add("C");
            return "c";
        }).build();
        PlainStep<Object, Object> d = Steps.<Object, Object>step("D").handle(args -> {
            executed.add("D");
            return "d";
        }).build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("route")
                .condition(check)
                .branches(Map.of("big", c))
                .then(d)
                .commit();

        StepVerifier.create(workflow.run("small"))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.result()).isEqualTo("d");
                    assertThat(result.steps()).doesNotContainKey("C");
                    assertThat(result.stepSnapshots("A").get(0).nextStepId()).isEqualTo("D");
                })
                .verifyComplete();
        assertThat(executed).containsExactly("A", "D");
    }

    @Test
    void shouldFollowResolvedBranchAndSkipSiblings() {
        PlainStep<Object, Object> check = Steps.condition("check")
                .branchWhen(t -> (String) t.output())
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("branches")
                .condition(check)
                .branches(Map.of("b1", constant("T1", "one"), "b2", constant("T2", "two")))
                .then(constant("after", "done"))
                .commit();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(events::add);

        StepVerifier.create(run.start(WorkflowRunOptions.of("b1")))
                .assertNext(result -> {
                    assertThat(result.steps()).containsOnlyKeys("check", "T1", "after");
                    StepSnapshot checkSnapshot = result.stepSnapshots("check").get(0);
                    assertThat(checkSnapshot.branchId()).isEqualTo("b1");
                    assertThat(checkSnapshot.nextStepId()).isEqualTo("T1");
                    assertThat(result.stepSnapshots("T1").get(0).nextStepId()).isEqualTo("after");
                })
                .verifyComplete();

        assertThat(events).filteredOn(event -> event.type() == WorkflowEventType.STEP_BRANCH)
                .singleElement()
                .satisfies(event -> assertThat(event.payload())
                        .isEqualTo(Map.of("branchId", "b1", "nextStepId", "T1", "conditionStepId", "check")));
    }

    @Test
    void shouldRecordOneSnapshotPerVisit() {
        AtomicInteger visits = new AtomicInteger();
        PlainStep<Object, Object> repeat = Steps.<Object, Object>step("repeat")
                .handle(args -> visits.incrementAndGet())
                .nextWhen(t -> (Integer) t.output() < 3 ? "repeat" : null)
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("revisit")
                .then(repeat)
                .then(constant("end", "finished"))
                .commit();

        StepVerifier.create(workflow.run(0))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.stepSnapshots("repeat"))
                            .extracting(StepSnapshot::occurrence)
                            .containsExactly(1, 2, 3);
                    assertThat(result.stepSnapshots("repeat"))
                            .extracting(StepSnapshot::nextStepId)
                            .containsExactly("repeat", "repeat", "end");
                    assertThat(result.stepSnapshots("end")).hasSize(1);
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectSecondStart() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("once")
                .then(constant("A", "a"))
                .commit();
        WorkflowRun<Object, Object> run = workflow.createRun("run_fixed01");
        Mono<WorkflowRunResult<Object>> first = run.start(WorkflowRunOptions.of("in"));

        assertThatThrownBy(() -> run.start(WorkflowRunOptions.of("again")))
                .isInstanceOf(WorkflowExecutionException.class)
                .hasMessage("Workflow run can only be started once");

        StepVerifier.create(first)
                .assertNext(result -> {
                    assertThat(result.runId()).isEqualTo("run_fixed01");
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.result()).isEqualTo("a");
                })
                .verifyComplete();
    }

    @Test
    void shouldCancelBeforeAnyStepRuns() {
        AtomicInteger executions = new AtomicInteger();
        PlainStep<Object, Object> a = Steps.<Object, Object>step("A")
                .handle(args -> executions.incrementAndGet())
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("cancelled").then(a).commit();
        CancellationSource external = new CancellationSource();
        external.cancel(new WorkflowAbortedException("caller gave up"));
        List<WorkflowEventType> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(event -> events.add(event.type()));

        StepVerifier.create(run.start(WorkflowRunOptions.builder()
                        .inputData("in")
                        .cancellationToken(external.token())
                        .build()))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
                    assertThat(result.steps()).isEmpty();
                    assertThat(result.error()).isInstanceOf(WorkflowAbortedException.class)
                            .hasMessage("caller gave up");
                })
                .verifyComplete();
        assertThat(executions).hasValue(0);
        assertThat(events).contains(WorkflowEventType.WORKFLOW_CANCELLED)
                .doesNotContain(WorkflowEventType.STEP_START);
        assertThat(run.status()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void shouldStopBeforeNextStepWhenCancelledMidRun() {
        AtomicReference<WorkflowRun<Object, Object>> holder = new AtomicReference<>();
        PlainStep<Object, Object> a = Steps.<Object, Object>step("A")
                .handle(args -> {
                    holder.get().cancel();
                    return "a";
                })
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("interrupted")
                .then(a)
                .then(constant("B", "b"))
                .commit();
        WorkflowRun<Object, Object> run = workflow.createRun();
        holder.set(run);

        StepVerifier.create(run.start(WorkflowRunOptions.of("in")))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
                    assertThat(result.steps()).containsOnlyKeys("A");
                    assertThat(result.error()).hasMessage("Workflow run cancelled");
                })
                .verifyComplete();
    }

    @Test
    void shouldFailRunWhenStepThrows() {
        PlainStep<Object, Object> broken = Steps.<Object, Object>step("broken")
                .handle(args -> {
                    throw new IllegalStateException("disk full");
                })
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("failing")
                .then(broken)
                .then(constant("never", "x"))
                .commit();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(events::add);

        StepVerifier.create(run.start(WorkflowRunOptions.of("in")))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                    assertThat(result.error()).isInstanceOf(IllegalStateException.class).hasMessage("disk full");
                    StepSnapshot snapshot = result.stepSnapshots("broken").get(0);
                    assertThat(snapshot.status()).isEqualTo(StepStatus.FAILED);
                    assertThat(snapshot.input()).isEqualTo("in");
                    assertThat(result.steps()).doesNotContainKey("never");
                })
                .verifyComplete();

        assertThat(events).extracting(WorkflowEvent::type).containsExactly(
                WorkflowEventType.WORKFLOW_START,
                WorkflowEventType.STEP_START,
                WorkflowEventType.STEP_ERROR,
                WorkflowEventType.WORKFLOW_ERROR);
        assertThat(events.get(2).payload()).isEqualTo(new WorkflowEvent.ErrorInfo("IllegalStateException", "disk full"));
    }

    @Test
    void shouldEmitLifecycleEventsInOrder() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("events")
                .then(constant("A", "a"))
                .then(constant("B", "b"))
                .commit();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(events::add);

        StepVerifier.create(run.start(WorkflowRunOptions.of("in"))).expectNextCount(1).verifyComplete();

        assertThat(events).extracting(WorkflowEvent::type).containsExactly(
                WorkflowEventType.WORKFLOW_START,
                WorkflowEventType.STEP_START,
                WorkflowEventType.STEP_SUCCESS,
                WorkflowEventType.STEP_START,
                WorkflowEventType.STEP_SUCCESS,
                WorkflowEventType.WORKFLOW_SUCCESS);
        assertThat(events).allSatisfy(event -> {
            assertThat(event.workflowId()).isEqualTo("events");
            assertThat(event.runId()).isEqualTo(run.runId());
        });
        assertThat(events.get(0).payload()).isEqualTo("in");
        assertThat(events.get(2).stepId()).isEqualTo("A");
        assertThat(events.get(2).payload()).isEqualTo("a");
        assertThat(events.get(5).payload()).isEqualTo("b");
    }

    @Test
    void shouldKeepRunningWhenWatcherThrows() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("noisy")
                .then(constant("A", "a"))
                .commit();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(event -> {
            throw new IllegalStateException("listener bug");
        });

        StepVerifier.create(run.start(WorkflowRunOptions.of("in")))
                .assertNext(result -> assertThat(result.status()).isEqualTo(RunStatus.SUCCESS))
                .verifyComplete();
    }

    @Test
    void shouldStopNotifyingDisposedWatcher() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("quiet")
                .then(constant("A", "a"))
                .commit();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(events::add).dispose();

        StepVerifier.create(run.start(WorkflowRunOptions.of("in"))).expectNextCount(1).verifyComplete();

        assertThat(events).isEmpty();
    }

    @Test
    void shouldForwardCustomStepEvents() {
        PlainStep<Object, Object> reporting = Steps.<Object, Object>step("report")
                .handle(args -> {
                    args.context().emit("progress", 50);
                    return "done";
                })
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("custom").then(reporting).commit();
        List<WorkflowEvent> events = new CopyOnWriteArrayList<>();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.watch(events::add);

        StepVerifier.create(run.start(WorkflowRunOptions.of("in"))).expectNextCount(1).verifyComplete();

        assertThat(events).filteredOn(event -> event.type() == WorkflowEventType.STEP_EVENT)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.stepId()).isEqualTo("report");
                    assertThat(event.payload()).isEqualTo(Map.of("name", "progress", "payload", 50));
                });
    }

    @Test
    void shouldFailWhenInputIsRejected() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("strict")
                .inputSchema(value -> {
                    if (!(value instanceof String)) {
                        throw new IllegalArgumentException("expected text");
                    }
                    return value;
                })
                .then(constant("A", "a"))
                .commit();

        StepVerifier.create(workflow.run(42))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                    assertThat(result.error()).isInstanceOf(SchemaValidationException.class)
                            .hasMessageContaining("workflow strict input");
                    assertThat(result.steps()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void shouldFinalizeAndValidateOutput() {
        Workflow<Object, Integer> workflow = WorkflowBuilder.<Object, Integer>builder("finalized")
                .then(constant("A", "12"))
                .finalize(value -> Integer.parseInt((String) value))
                .outputSchema(value -> (Integer) value)
                .commit();

        StepVerifier.create(workflow.run("in"))
                .assertNext(result -> assertThat(result.result()).isEqualTo(12))
                .verifyComplete();
    }

    @Test
    void shouldFailWhenOutputIsRejected() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("bad-output")
                .then(constant("A", "a"))
                .outputSchema(value -> {
                    throw new IllegalArgumentException("never valid");
                })
                .commit();

        StepVerifier.create(workflow.run("in"))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                    assertThat(result.error()).hasMessageContaining("workflow bad-output output");
                    assertThat(result.stepSnapshots("A").get(0).status()).isEqualTo(StepStatus.SUCCESS);
                })
                .verifyComplete();
    }

    @Test
    void shouldMergeCtxAndReplaceMetadata() {
        PlainStep<Object, Object> tagging = Steps.<Object, Object>step("tag")
                .handle(args -> {
                    args.context().updateCtx(ctx -> {
                        ctx.put("visited", true);
                        return ctx;
                    });
                    args.context().updateMetadata(metadata -> {
                        metadata.put("stage", "tagged");
                        return metadata;
                    });
                    return args.ctx().get("region");
                })
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("contextual")
                .metadata(Map.of("owner", "default"))
                .ctx(Map.of("region", "eu", "tier", "gold"))
                .then(tagging)
                .commit();

        StepVerifier.create(workflow.run(WorkflowRunOptions.builder()
                        .inputData("in")
                        .metadata(Map.of("owner", "caller"))
                        .ctx(Map.of("region", "us"))
                        .build()))
                .assertNext(result -> {
                    assertThat(result.result()).isEqualTo("us");
                    assertThat(result.ctx()).containsEntry("region", "us")
                            .containsEntry("tier", "gold")
                            .containsEntry("visited", true);
                    assertThat(result.metadata()).containsEntry("owner", "caller")
                            .containsEntry("stage", "tagged");
                })
                .verifyComplete();
        assertThat(workflow.initialCtx()).doesNotContainKey("visited");
    }

    @Test
    void shouldFailGroupNamingFailedBranch() {
        PlainStep<Object, Object> left = Steps.<Object, Object>step("L")
                .handle(args -> "left-done")
                .build();
        PlainStep<Object, Object> right = Steps.<Object, Object>step("R")
                .handle(args -> {
                    throw new IllegalStateException("right exploded");
                })
                .build();
        ConcurrentGroupStep<Object, Object> group = Steps.<Object, Object>concurrent("G")
                .child("left", left)
                .child("right", right)
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("fan").concurrent(group).commit();

        StepVerifier.create(workflow.run("in"))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                    assertThat(result.error()).isInstanceOf(ConcurrentGroupException.class)
                            .hasMessageContaining("right");
                    assertThat(((ConcurrentGroupException) result.error()).getFailures()).containsOnlyKeys("right");
                })
                .verifyComplete();
    }

    @Test
    void shouldFailLoopExceedingMaxIterations() {
        AtomicInteger executions = new AtomicInteger();
        PlainStep<Object, Object> body = Steps.<Object, Object>step("tick")
                .handle(args -> executions.incrementAndGet())
                .build();
        IterativeLoopStep<Object, Object> loop = Steps.<Object, Object>loop("spin")
                .body(body)
                .condition(state -> true)
                .maxIterations(3)
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("looping").loop(loop).commit();

        StepVerifier.create(workflow.run("in"))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                    assertThat(result.error()).hasMessageContaining("exceeded maxIterations (3)");
                    assertThat(result.stepSnapshots("spin")).hasSize(1);
                })
                .verifyComplete();
        assertThat(executions).hasValue(3);
    }

    @Test
    void shouldStreamEventsAndResult() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("streamed")
                .then(constant("A", "a"))
                .commit();

        WorkflowRunStream<Object> stream = workflow.stream(WorkflowRunOptions.of("in"));

        StepVerifier.create(stream.events().map(WorkflowEvent::type))
                .expectNext(WorkflowEventType.WORKFLOW_START,
                        WorkflowEventType.STEP_START,
                        WorkflowEventType.STEP_SUCCESS,
                        WorkflowEventType.WORKFLOW_SUCCESS)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(stream.result())
                .assertNext(result -> assertThat(result.result()).isEqualTo("a"))
                .verifyComplete();
    }

    @Test
    void shouldRejectStreamOnStartedRun() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("started")
                .then(constant("A", "a"))
                .commit();
        WorkflowRun<Object, Object> run = workflow.createRun();
        run.start(WorkflowRunOptions.of("in"));

        assertThatThrownBy(() -> run.stream(WorkflowRunOptions.of("in")))
                .isInstanceOf(WorkflowExecutionException.class);
    }

    @Test
    void shouldExposeStepHistoryThroughStore() {
        PlainStep<Object, Object> reader = Steps.<Object, Object>step("reader")
                .handle(args -> args.context().store().containsKey(HumanStep.HISTORY_STORE_KEY))
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("store")
                .then(constant("first", "x"))
                .then(reader)
                .commit();

        StepVerifier.create(workflow.run("in"))
                .assertNext(result -> assertThat(result.result()).isEqualTo(true))
                .verifyComplete();
    }

    @Test
    void shouldRevisitStepTenThousandTimes() {
        PlainStep<Object, Object> inc = Steps.<Object, Object>step("inc")
                .handle(args -> (Integer) args.input() + 1)
                .nextWhen(t -> (Integer) t.output() < 10_000 ? "inc" : null)
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("revisits").then(inc).commit();

        StepVerifier.create(workflow.run(0))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.result()).isEqualTo(10_000);
                    assertThat(result.stepSnapshots("inc")).hasSize(10_000);
                })
                .verifyComplete();
    }

    @Test
    void shouldRunLongLoopInsideWorkflow() {
        PlainStep<Object, Object> inc = Steps.<Object, Object>step("inc")
                .handle(args -> (Integer) args.input() + 1)
                .build();
        IterativeLoopStep<Object, Object> loop = Steps.<Object, Object>loop("counter")
                .body(inc)
                .condition(state -> state.iteration() < 10_000)
                .maxIterations(10_000)
                .collect(summary -> summary.lastResult())
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("counting").loop(loop).commit();

        StepVerifier.create(workflow.run(0))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
                    assertThat(result.result()).isEqualTo(10_000);
                })
                .verifyComplete();
    }

    @Test
    void shouldDetachFromCallerTokenOnceSettled() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("detached")
                .then(constant("A", "a"))
                .commit();
        CancellationSource shutdown = new CancellationSource();

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(workflow.run(WorkflowRunOptions.builder()
                            .inputData("in")
                            .cancellationToken(shutdown.token())
                            .build()))
                    .assertNext(result -> assertThat(result.status()).isEqualTo(RunStatus.SUCCESS))
                    .verifyComplete();
        }

        assertThat(shutdown.token().listenerCount()).isZero();
    }
}
