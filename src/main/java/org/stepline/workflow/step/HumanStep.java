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
import org.stepline.workflow.human.HumanForm;
import org.stepline.workflow.human.HumanRequest;
import org.stepline.workflow.model.StepHistoryEntry;
import org.stepline.workflow.schema.Schema;
import org.stepline.workflow.schema.SchemaValidation;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Step that suspends the run and waits for a human response.
 * <p>
 * The run never invokes a handler for this step. It calls
 * {@link #buildHumanRequest(StepInvocation)} to prepare the form and payload, suspends,
 * and later converts the raw response with {@link #parseResponse(Object)}.
 *
 * @param <I> the input type
 * @param <O> the output type (the parsed response)
 */
@Slf4j
public class HumanStep<I, O> extends AbstractWorkflowStep<I, O> {

    /**
     * Store key under which the run publishes the per-step input/output history.
     */
    public static final String HISTORY_STORE_KEY = "stepline.workflow.step-history";

    private final Function<WorkflowStepContext, HumanForm> formBuilder;
    private final HumanPayloadResolver<I> payloadResolver;
    private final Schema<?> responseSchema;

    protected HumanStep(Builder<I, O> builder) {
        super(builder);
        this.formBuilder = builder.formBuilder != null
                ? builder.formBuilder
                : context -> new HumanForm(builder.description() != null ? builder.description() : builder.id(), null, null);
        this.payloadResolver = builder.payloadResolver != null
                ? builder.payloadResolver
                : args -> Mono.justOrEmpty(args.current());
        this.responseSchema = builder.responseSchema;
    }

    public static <I, O> Builder<I, O> builder(String id) {
        return new Builder<>(id);
    }

    @Override
    public StepKind kind() {
        return StepKind.HUMAN;
    }

    /**
     * Passes the validated input through. Runs route human steps through
     * {@link #buildHumanRequest(StepInvocation)} instead.
     */
    @Override
    @SuppressWarnings("unchecked")
    public Mono<StepResult> execute(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            return complete(input, Mono.justOrEmpty((O) input));
        });
    }

    /**
     * Validates the input and prepares the form and payload shown to the human.
     */
    public Mono<HumanRequest> buildHumanRequest(StepInvocation invocation) {
        return Mono.defer(() -> {
            I input = validateInput(invocation.input());
            WorkflowStepContext context = invocation.context();
            Map<String, StepHistoryEntry> history = historySnapshot(context);
            HumanForm form = formBuilder.apply(context);
            Mono<?> payload = payloadResolver.resolve(new HumanPayloadArgs<>(input, history, context));
            log.debug("Human request prepared: stepId={}, fields={}", id(), form.fields().size());
            return (payload != null ? payload : Mono.empty())
                    .<Optional<Object>>map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .map(resolved -> new HumanRequest(input, form, resolved.orElse(null)));
        });
    }

    /**
     * Converts raw response data into the step output.
     *
     * @throws org.stepline.workflow.exception.SchemaValidationException when the response
     *         or the resulting output is rejected
     */
    public O parseResponse(Object data) {
        Object parsed = SchemaValidation.validate(responseSchema, data, "human step " + id() + " response");
        return validateOutput(parsed);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, StepHistoryEntry> historySnapshot(WorkflowStepContext context) {
        if (context == null) {
            return Map.of();
        }
        Object history = context.store().get(HISTORY_STORE_KEY);
        if (!(history instanceof Map<?, ?> entries)) {
            return Map.of();
        }
        synchronized (entries) {
            return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, StepHistoryEntry>) entries));
        }
    }

    /**
     * Arguments of a {@link HumanPayloadResolver}.
     *
     * @param current the validated step input
     * @param steps last input/output of every step completed so far
     * @param context run services
     */
    public record HumanPayloadArgs<I>(I current, Map<String, StepHistoryEntry> steps, WorkflowStepContext context) {
    }

    /**
     * Computes the payload presented alongside the form.
     */
    @FunctionalInterface
    public interface HumanPayloadResolver<I> {
        Mono<?> resolve(HumanPayloadArgs<I> args);
    }

    /**
     * Builder for {@link HumanStep}.
     */
    public static class Builder<I, O> extends AbstractWorkflowStep.Builder<I, O, Builder<I, O>> {
        private Function<WorkflowStepContext, HumanForm> formBuilder;
        private HumanPayloadResolver<I> payloadResolver;
        private Schema<?> responseSchema;

        protected Builder(String id) {
            super(id);
        }

        public Builder<I, O> form(HumanForm form) {
            this.formBuilder = context -> form;
            return this;
        }

        public Builder<I, O> form(Function<WorkflowStepContext, HumanForm> formBuilder) {
            this.formBuilder = formBuilder;
            return this;
        }

        public Builder<I, O> payload(Function<HumanPayloadArgs<I>, ?> resolver) {
            this.payloadResolver = args -> Mono.justOrEmpty(resolver.apply(args));
            return this;
        }

        public Builder<I, O> payloadAsync(HumanPayloadResolver<I> resolver) {
            this.payloadResolver = resolver;
            return this;
        }

        public Builder<I, O> responseSchema(Schema<?> responseSchema) {
            this.responseSchema = responseSchema;
            return this;
        }

        @Override
        protected Builder<I, O> self() {
            return this;
        }

        public HumanStep<I, O> build() {
            return new HumanStep<>(this);
        }
    }
}
