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
import org.stepline.workflow.cancel.CancellationSource;
import org.stepline.workflow.cancel.CancellationToken;
import org.stepline.workflow.core.Graph;
import org.stepline.workflow.exception.ConcurrentGroupException;
import org.stepline.workflow.exception.WorkflowAbortedException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Step that runs named children, or named sub-graph branches, concurrently and joins
 * their outputs into a {@code branchId -> output} map.
 * <p>
 * Children receive a token derived from the run's token, which the group trips when it
 * fails fast. The map keeps declaration order. If an aggregator is configured its result
 * becomes the step output, otherwise the map itself does.
 * <p>
 * Groups built from child steps always fail fast; groups built from sub-graphs may use
 * {@link FailureStrategy#WAIT_ALL}.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@Slf4j
public class ConcurrentGroupStep<I, O> extends AbstractWorkflowStep<I, O> {

    private final Map<String, WorkflowStep<?, ?>> children;
    private final Map<String, Graph> branches;
    private final ConcurrentAggregator<I, O> aggregator;
    private final FailureStrategy failureStrategy;

    protected ConcurrentGroupStep(Builder<I, O> builder) {
        super(builder);
        if (builder.children.isEmpty() && builder.branches.isEmpty()) {
            throw new WorkflowValidationException("Concurrent step " + builder.id() + " requires at least one branch");
        }
        if (!builder.children.isEmpty() && !builder.branches.isEmpty()) {
            throw new WorkflowValidationException(
                    "Concurrent step " + builder.id() + " cannot mix child steps and sub-graph branches");
        }
        if (!builder.children.isEmpty() && builder.failureStrategy == FailureStrategy.WAIT_ALL) {
            throw new WorkflowValidationException(
                    "Concurrent step " + builder.id() + " with child steps only supports fail-fast");
        }
        this.children = Collections.unmodifiableMap(new LinkedHashMap<>(builder.children));
        this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(builder.branches));
        this.aggregator = builder.aggregator;
        this.failureStrategy = builder.failureStrategy;
    }

    public static <I, O> Builder<I, O> builder(String id) {
        return new Builder<>(id);
    }

    @Override
    public StepKind kind() {
        return StepKind.CONCURRENT;
    }

    public Map<String, WorkflowStep<?, ?>> children() {
        return children;
    }

    public Map<String, Graph> branchGraphs() {
        return branches;
    }

    public FailureStrategy failureStrategy() {
        return failureStrategy;
    }

    @Override
    public Mono<StepResult> execute(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            CancellationSource groupCancellation = CancellationSource.linkedTo(invocation.cancellationToken());
            StepInvocation branchInvocation = invocation.withInput(input)
                    .withCancellationToken(groupCancellation.token());
            List<String> names = new ArrayList<>(children.isEmpty() ? branches.keySet() : children.keySet());

            log.debug("Concurrent fan-out: stepId={}, branches={}, strategy={}", id(), names, failureStrategy);

            Mono<Map<String, Object>> joined = failureStrategy == FailureStrategy.FAIL_FAST
                    ? joinFailFast(names, branchInvocation, groupCancellation)
                    : joinWaitAll(names, branchInvocation);

            return joined
                    .flatMap(results -> complete(input, aggregate(input, results, invocation)))
                    .doFinally(signal -> groupCancellation.release());
        });
    }

    private Mono<Map<String, Object>> joinFailFast(List<String> names, StepInvocation invocation,
                                                   CancellationSource groupCancellation) {
        return Flux.fromIterable(names)
                .flatMap(name -> runBranch(name, invocation)
                        .map(result -> new BranchOutcome(name, result.output(), null))
                        .onErrorMap(error -> new ConcurrentGroupException(
                                "Concurrent step " + id() + " failed in branch " + name + ": " + error.getMessage(),
                                id(), Map.of(name, error))))
                .doOnError(error -> groupCancellation.cancel(
                        new WorkflowAbortedException("Concurrent step " + id() + " cancelled after a branch failed")))
                .collectList()
                .map(outcomes -> ordered(names, outcomes));
    }

    private Mono<Map<String, Object>> joinWaitAll(List<String> names, StepInvocation invocation) {
        return Flux.fromIterable(names)
                .flatMap(name -> runBranch(name, invocation)
                        .map(result -> new BranchOutcome(name, result.output(), null))
                        .onErrorResume(error -> Mono.just(new BranchOutcome(name, null, error))))
                .collectList()
                .flatMap(outcomes -> {
                    Map<String, Throwable> failures = new LinkedHashMap<>();
                    for (String name : names) {
                        outcomes.stream()
                                .filter(outcome -> outcome.name().equals(name) && outcome.error() != null)
                                .findFirst()
                                .ifPresent(outcome -> failures.put(name, outcome.error()));
                    }
                    if (!failures.isEmpty()) {
                        return Mono.error(new ConcurrentGroupException(
                                "Concurrent step " + id() + " failed in branches " + String.join(", ", failures.keySet()),
                                id(), failures));
                    }
                    return Mono.just(ordered(names, outcomes));
                });
    }

    private Mono<StepResult> runBranch(String name, StepInvocation invocation) {
        WorkflowStep<?, ?> child = children.get(name);
        if (child != null) {
            return child.execute(invocation);
        }
        BranchRunner runner = invocation.branchRunner();
        if (runner == null) {
            return Mono.error(new WorkflowExecutionException(
                    "Concurrent step " + id() + " cannot run branch " + name + " outside of a workflow run"));
        }
        return runner.run(id(), name, branches.get(name), invocation.input(), invocation.cancellationToken());
    }

    @SuppressWarnings("unchecked")
    private Mono<O> aggregate(I input, Map<String, Object> results, StepInvocation invocation) {
        if (aggregator == null) {
            return Mono.just((O) results);
        }
        Mono<O> aggregated = aggregator.aggregate(new ConcurrentResults<>(
                input, results, invocation.context(), invocation.cancellationToken()));
        return aggregated != null ? aggregated : Mono.empty();
    }

    private static Map<String, Object> ordered(List<String> names, List<BranchOutcome> outcomes) {
        Map<String, Object> byName = new LinkedHashMap<>();
        outcomes.forEach(outcome -> byName.put(outcome.name(), outcome.output()));
        Map<String, Object> results = new LinkedHashMap<>();
        names.forEach(name -> results.put(name, byName.get(name)));
        return Collections.unmodifiableMap(results);
    }

    private record BranchOutcome(String name, Object output, Throwable error) {
    }

    /**
     * Joined branch outputs passed to a {@link ConcurrentAggregator}.
     *
     * @param input the validated group input
     * @param results branch outputs in declaration order
     * @param context run services
     * @param cancellationToken the run's token
     */
    public record ConcurrentResults<I>(I input, Map<String, Object> results, WorkflowStepContext context,
                                       CancellationToken cancellationToken) {
    }

    /**
     * Transforms the joined branch outputs into the group output.
     */
    @FunctionalInterface
    public interface ConcurrentAggregator<I, O> {
        Mono<O> aggregate(ConcurrentResults<I> results);
    }

    /**
     * Builder for {@link ConcurrentGroupStep}.
     */
    public static class Builder<I, O> extends AbstractWorkflowStep.Builder<I, O, Builder<I, O>> {
        private final Map<String, WorkflowStep<?, ?>> children = new LinkedHashMap<>();
        private final Map<String, Graph> branches = new LinkedHashMap<>();
        private ConcurrentAggregator<I, O> aggregator;
        private FailureStrategy failureStrategy = FailureStrategy.FAIL_FAST;

        protected Builder(String id) {
            super(id);
        }

        /**
         * Adds a child step receiving the group input.
         */
        public Builder<I, O> child(String name, WorkflowStep<?, ?> step) {
            ensureUnique(name);
            children.put(name, step);
            return this;
        }

        /**
         * Adds a sub-graph branch whose entry step receives the group input.
         */
        public Builder<I, O> branch(String name, Graph graph) {
            ensureUnique(name);
            branches.put(name, graph);
            return this;
        }

        public Builder<I, O> aggregate(Function<ConcurrentResults<I>, O> function) {
            this.aggregator = results -> Mono.fromCallable(() -> function.apply(results));
            return this;
        }

        public Builder<I, O> aggregator(ConcurrentAggregator<I, O> aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder<I, O> onError(FailureStrategy failureStrategy) {
            this.failureStrategy = failureStrategy != null ? failureStrategy : FailureStrategy.FAIL_FAST;
            return this;
        }

        private void ensureUnique(String name) {
            if (children.containsKey(name) || branches.containsKey(name)) {
                throw new WorkflowValidationException(
                        "Concurrent step " + id() + " already has a branch named " + name);
            }
        }

        @Override
        protected Builder<I, O> self() {
            return this;
        }

        public ConcurrentGroupStep<I, O> build() {
            return new ConcurrentGroupStep<>(this);
        }
    }
}
