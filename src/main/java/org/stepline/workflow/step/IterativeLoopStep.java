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

package org.stepline.workflow.step;

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.cancel.CancellationToken;
import org.stepline.workflow.exception.WorkflowAbortedException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Step that re-runs a body step while a condition holds, bounded by {@code maxIterations}.
 * <p>
 * The condition is checked before every iteration. Asking for another pass once the bound
 * is reached fails the step. The first iteration receives the loop input, later ones the
 * previous output, unless a {@code nextInput} function is configured.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@Slf4j
public class IterativeLoopStep<I, O> extends AbstractWorkflowStep<I, O> {

    private final LoopCondition<I> condition;
    private final WorkflowStep<?, ?> body;
    private final int maxIterations;
    private final Function<LoopState<I>, Object> nextInput;
    private final Function<LoopSummary<I>, O> collect;

    protected IterativeLoopStep(Builder<I, O> builder) {
        super(builder);
        if (builder.body == null) {
            throw new WorkflowValidationException("Iterative step " + builder.id() + " requires a body step");
        }
        if (builder.condition == null) {
            throw new WorkflowValidationException("Iterative step " + builder.id() + " requires a condition");
        }
        if (builder.maxIterations <= 0) {
            throw new WorkflowValidationException(
                    "Iterative step " + builder.id() + " requires a positive maxIterations");
        }
        this.condition = builder.condition;
        this.body = builder.body;
        this.maxIterations = builder.maxIterations;
        this.nextInput = builder.nextInput;
        this.collect = builder.collect;
    }

    public static <I, O> Builder<I, O> builder(String id) {
        return new Builder<>(id);
    }

    @Override
    public StepKind kind() {
        return StepKind.LOOP;
    }

    public WorkflowStep<?, ?> body() {
        return body;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public Mono<StepResult> execute(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            List<Object> results = Collections.synchronizedList(new ArrayList<>());
            return iterate(input, results, invocation)
                    .flatMap(iterations -> complete(input, summarize(input, results, iterations, invocation)));
        });
    }

    /**
     * Runs passes until the condition says stop. Each pass is a fresh subscription driven by
     * {@code repeat()}, so the iteration count does not grow the stack.
     */
    private Mono<Integer> iterate(I input, List<Object> results, StepInvocation invocation) {
        AtomicInteger iteration = new AtomicInteger();
        AtomicReference<Object> lastOutput = new AtomicReference<>();
        return Mono.defer(() -> pass(input, lastOutput, iteration, results, invocation))
                .repeat()
                .filter(Optional::isPresent)
                .next()
                .map(Optional::get);
    }

    private Mono<Optional<Integer>> pass(I input, AtomicReference<Object> lastOutput, AtomicInteger counter,
                                         List<Object> results, StepInvocation invocation) {
        CancellationToken token = invocation.cancellationToken();
        token.throwIfCancelled();
        int iteration = counter.get();
        LoopState<I> state = new LoopState<>(input, lastOutput.get(), iteration, invocation.context(), token);
        Mono<Boolean> test = condition.test(state);
        return (test != null ? test : Mono.just(false))
                .defaultIfEmpty(false)
                .flatMap(proceed -> {
                    if (!proceed) {
                        log.debug("Loop finished: stepId={}, iterations={}", id(), iteration);
                        return Mono.just(Optional.of(iteration));
                    }
                    if (iteration >= maxIterations) {
                        return Mono.error(new WorkflowExecutionException(
                                "Iterative step " + id() + " exceeded maxIterations (" + maxIterations + ")"));
                    }
                    Object bodyInput = nextInput != null
                            ? nextInput.apply(state)
                            : iteration == 0 ? input : state.lastOutput();
                    log.debug("Loop iteration: stepId={}, iteration={}", id(), iteration);
                    return body.execute(invocation.withInput(bodyInput))
                            .onErrorMap(error -> !(error instanceof WorkflowAbortedException),
                                    error -> new WorkflowExecutionException(
                                            "Iterative step " + id() + " failed at iteration " + iteration
                                                    + ": " + error.getMessage(), error))
                            .map(result -> {
                                results.add(result.output());
                                lastOutput.set(result.output());
                                counter.incrementAndGet();
                                return Optional.<Integer>empty();
                            });
                });
    }

    @SuppressWarnings("unchecked")
    private Mono<O> summarize(I input, List<Object> results, int iterations, StepInvocation invocation) {
        List<Object> snapshot;
        synchronized (results) {
            snapshot = Collections.unmodifiableList(new ArrayList<>(results));
        }
        Object last = snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
        if (collect == null) {
            return Mono.just((O) new LoopOutput(last, snapshot));
        }
        return Mono.fromCallable(() -> collect.apply(
                new LoopSummary<>(input, snapshot, last, iterations, invocation.context())));
    }

    /**
     * State handed to the loop condition and the next-input function.
     *
     * @param input the validated loop input
     * @param lastOutput output of the previous iteration, {@code null} before the first
     * @param iteration zero-based index of the iteration about to run
     */
    public record LoopState<I>(I input, Object lastOutput, int iteration, WorkflowStepContext context,
                               CancellationToken cancellationToken) {
    }

    /**
     * Everything the loop produced, passed to the collect function.
     */
    public record LoopSummary<I>(I input, List<Object> results, Object lastResult, int iterations,
                                 WorkflowStepContext context) {
    }

    /**
     * Default loop output.
     */
    public record LoopOutput(Object lastResult, List<Object> allResults) {
    }

    @FunctionalInterface
    public interface LoopCondition<I> {
        Mono<Boolean> test(LoopState<I> state);
    }

    /**
     * Builder for {@link IterativeLoopStep}.
     */
    public static class Builder<I, O> extends AbstractWorkflowStep.Builder<I, O, Builder<I, O>> {
        private LoopCondition<I> condition;
        private WorkflowStep<?, ?> body;
        private int maxIterations;
        private Function<LoopState<I>, Object> nextInput;
        private Function<LoopSummary<I>, O> collect;

        protected Builder(String id) {
            super(id);
        }

        public Builder<I, O> condition(Predicate<LoopState<I>> condition) {
            Objects.requireNonNull(condition, "condition");
            this.condition = state -> Mono.fromCallable(() -> condition.test(state));
            return this;
        }

        public Builder<I, O> conditionAsync(LoopCondition<I> condition) {
            this.condition = condition;
            return this;
        }

        public Builder<I, O> body(WorkflowStep<?, ?> body) {
            this.body = body;
            return this;
        }

        public Builder<I, O> maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder<I, O> nextInput(Function<LoopState<I>, Object> nextInput) {
            this.nextInput = nextInput;
            return this;
        }

        public Builder<I, O> collect(Function<LoopSummary<I>, O> collect) {
            this.collect = collect;
            return this;
        }

        @Override
        protected Builder<I, O> self() {
            return this;
        }

        public IterativeLoopStep<I, O> build() {
            return new IterativeLoopStep<>(this);
        }
    }
}
