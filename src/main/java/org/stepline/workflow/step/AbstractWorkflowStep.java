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

import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.schema.Schema;
import org.stepline.workflow.schema.SchemaValidation;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Function;

/**
 * Shared state and transition logic of all step variants.
 *
 * @param <I> the validated input type
 * @param <O> the validated output type
 */
public abstract class AbstractWorkflowStep<I, O> implements WorkflowStep<I, O> {

    private final String id;
    private final String description;
    private final Schema<I> inputSchema;
    private final Schema<O> outputSchema;
    private final String staticNext;
    private final NextResolver<I, O> nextResolver;
    private final BranchResolver<I, O> branchResolver;

    protected AbstractWorkflowStep(Builder<I, O, ?> builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new WorkflowValidationException("Step id cannot be blank");
        }
        this.id = builder.id;
        this.description = builder.description;
        this.inputSchema = builder.inputSchema;
        this.outputSchema = builder.outputSchema;
        this.staticNext = builder.staticNext;
        this.nextResolver = builder.nextResolver;
        this.branchResolver = builder.branchResolver;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Optional<String> staticNext() {
        return Optional.ofNullable(staticNext);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<String> resolveNext(Transition<?, ?> transition) {
        if (staticNext != null) {
            return Mono.just(staticNext);
        }
        if (nextResolver == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> nullSafe(nextResolver.resolve((Transition<I, O>) transition)));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<String> resolveBranch(Transition<?, ?> transition) {
        if (branchResolver == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> nullSafe(branchResolver.resolve((Transition<I, O>) transition)));
    }

    protected I validateInput(Object value) {
        return SchemaValidation.validate(inputSchema, value, "step " + id + " input");
    }

    protected O validateOutput(Object value) {
        return SchemaValidation.validate(outputSchema, value, "step " + id + " output");
    }

    /**
     * Validates the produced output and pairs it with the input; an empty output is
     * validated as {@code null}.
     */
    protected Mono<StepResult> complete(I input, Mono<? extends O> output) {
        return output
                .map(value -> new StepResult(input, validateOutput(value)))
                .switchIfEmpty(Mono.fromSupplier(() -> new StepResult(input, validateOutput(null))));
    }

    protected Schema<O> outputSchema() {
        return outputSchema;
    }

    private static <T> Mono<T> nullSafe(Mono<T> mono) {
        return mono != null ? mono : Mono.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }

    /**
     * Base builder shared by the step variants.
     *
     * @param <B> the concrete builder type
     */
    public abstract static class Builder<I, O, B extends Builder<I, O, B>> {
        private final String id;
        private String description;
        private Schema<I> inputSchema;
        private Schema<O> outputSchema;
        private String staticNext;
        private NextResolver<I, O> nextResolver;
        private BranchResolver<I, O> branchResolver;

        protected Builder(String id) {
            this.id = id;
        }

        public B description(String description) {
            this.description = description;
            return self();
        }

        public B inputSchema(Schema<I> inputSchema) {
            this.inputSchema = inputSchema;
            return self();
        }

        public B outputSchema(Schema<O> outputSchema) {
            this.outputSchema = outputSchema;
            return self();
        }

        /**
         * Declares a literal next step.
         */
        public B next(String stepId) {
            this.staticNext = stepId;
            this.nextResolver = null;
            return self();
        }

        /**
         * Declares a dynamic next step.
         */
        public B next(NextResolver<I, O> resolver) {
            this.nextResolver = resolver;
            this.staticNext = null;
            return self();
        }

        /**
         * Declares a synchronous dynamic next step; a {@code null} result defers to the default.
         */
        public B nextWhen(Function<Transition<I, O>, String> resolver) {
            return next(transition -> Mono.justOrEmpty(resolver.apply(transition)));
        }

        /**
         * Declares the branch resolver of a condition step.
         */
        public B branch(BranchResolver<I, O> resolver) {
            this.branchResolver = resolver;
            return self();
        }

        /**
         * Declares a synchronous branch resolver; a {@code null} result takes no branch.
         */
        public B branchWhen(Function<Transition<I, O>, String> resolver) {
            return branch(transition -> Mono.justOrEmpty(resolver.apply(transition)));
        }

        protected String id() {
            return id;
        }

        protected String description() {
            return description;
        }

        protected abstract B self();
    }
}
