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
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

/**
 * Step that validates its input, invokes a {@link StepHandler} and validates the output.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@Slf4j
public class PlainStep<I, O> extends AbstractWorkflowStep<I, O> {

    private final StepHandler<I, O> handler;

    protected PlainStep(Builder<I, O> builder) {
        super(builder);
        this.handler = Objects.requireNonNull(builder.handler, "handler cannot be null for step " + builder.id());
    }

    public static <I, O> Builder<I, O> builder(String id) {
        return new Builder<>(id);
    }

    /**
     * Creates a step from a handler with no schemas or transitions.
     */
    public static <I, O> PlainStep<I, O> of(String id, StepHandler<I, O> handler) {
        return PlainStep.<I, O>builder(id).handler(handler).build();
    }

    @Override
    public StepKind kind() {
        return StepKind.PLAIN;
    }

    @Override
    public Mono<StepResult> execute(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            log.debug("Invoking handler: stepId={}", id());
            Mono<O> output = handler.handle(new StepArgs<>(input, invocation.context(), invocation.cancellationToken()));
            return complete(input, output != null ? output : Mono.empty());
        });
    }

    /**
     * Builder for {@link PlainStep}.
     */
    public static class Builder<I, O> extends AbstractWorkflowStep.Builder<I, O, Builder<I, O>> {
        private StepHandler<I, O> handler;

        protected Builder(String id) {
            super(id);
        }

        public Builder<I, O> handler(StepHandler<I, O> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Uses synchronous logic as the handler.
         */
        public Builder<I, O> handle(Function<StepArgs<I>, O> function) {
            this.handler = StepHandler.sync(function);
            return this;
        }

        @Override
        protected Builder<I, O> self() {
            return this;
        }

        public PlainStep<I, O> build() {
            return new PlainStep<>(this);
        }
    }
}
