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
import org.stepline.workflow.exception.WorkflowAbortedException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Step that applies an item step to every element of a list derived from its input.
 * Results keep the order of the items even when processed concurrently.
 *
 * @param <I> the input type
 * @param <T> the item type
 * @param <O> the output type
 */
@Slf4j
public class ForEachStep<I, T, O> extends AbstractWorkflowStep<I, O> {

    private final Function<StepArgs<I>, List<T>> items;
    private final WorkflowStep<?, ?> itemStep;
    private final int concurrency;
    private final Function<List<Object>, O> collect;

    protected ForEachStep(Builder<I, T, O> builder) {
        super(builder);
        if (builder.items == null) {
            throw new WorkflowValidationException("ForEach step " + builder.id() + " requires an items function");
        }
        if (builder.itemStep == null) {
            throw new WorkflowValidationException("ForEach step " + builder.id() + " requires an item step");
        }
        if (builder.concurrency <= 0) {
            throw new WorkflowValidationException("ForEach step " + builder.id() + " requires a positive concurrency");
        }
        this.items = builder.items;
        this.itemStep = builder.itemStep;
        this.concurrency = builder.concurrency;
        this.collect = builder.collect;
    }

    public static <I, T, O> Builder<I, T, O> builder(String id) {
        return new Builder<>(id);
    }

    @Override
    public StepKind kind() {
        return StepKind.PLAIN;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StepResult> execute(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            List<T> elements = items.apply(new StepArgs<>(input, invocation.context(), invocation.cancellationToken()));
            List<T> source = elements != null ? elements : List.of();
            List<Integer> indexes = new ArrayList<>();
            for (int i = 0; i < source.size(); i++) {
                indexes.add(i);
            }
            log.debug("ForEach start: stepId={}, items={}, concurrency={}", id(), source.size(), concurrency);

            Mono<List<Object>> processed = Flux.fromIterable(indexes)
                    .flatMapSequential(index -> processItem(index, source.get(index), invocation), concurrency)
                    .collectList()
                    .map(results -> results.stream().map(result -> result.orElse(null)).toList());

            return complete(input, processed.map(results -> collect != null
                    ? collect.apply(Collections.unmodifiableList(results))
                    : (O) results));
        });
    }

    private Mono<Optional<Object>> processItem(int index, T item, StepInvocation invocation) {
        return Mono.defer(() -> {
            invocation.cancellationToken().throwIfCancelled();
            return itemStep.execute(invocation.withInput(item));
        })
                .map(result -> Optional.ofNullable(result.output()))
                .onErrorMap(error -> !(error instanceof WorkflowAbortedException),
                        error -> new WorkflowExecutionException("ForEach step " + id()
                                + " failed while processing item at index " + index + ": " + error.getMessage(), error));
    }

    /**
     * Builder for {@link ForEachStep}.
     */
    public static class Builder<I, T, O> extends AbstractWorkflowStep.Builder<I, O, Builder<I, T, O>> {
        private Function<StepArgs<I>, List<T>> items;
        private WorkflowStep<?, ?> itemStep;
        private int concurrency = 1;
        private Function<List<Object>, O> collect;

        protected Builder(String id) {
            super(id);
        }

        public Builder<I, T, O> items(Function<StepArgs<I>, List<T>> items) {
            this.items = items;
            return this;
        }

        public Builder<I, T, O> itemStep(WorkflowStep<?, ?> itemStep) {
            this.itemStep = itemStep;
            return this;
        }

        public Builder<I, T, O> concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder<I, T, O> collect(Function<List<Object>, O> collect) {
            this.collect = collect;
            return this;
        }

        @Override
        protected Builder<I, T, O> self() {
            return this;
        }

        public ForEachStep<I, T, O> build() {
            return new ForEachStep<>(this);
        }
    }
}
