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
import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.schema.Schema;
import org.stepline.workflow.step.ConcurrentGroupStep;
import org.stepline.workflow.step.FailureStrategy;
import org.stepline.workflow.step.HumanStep;
import org.stepline.workflow.step.IterativeLoopStep;
import org.stepline.workflow.step.WorkflowStep;
import org.stepline.workflow.tracing.TelemetryOptions;
import org.stepline.workflow.tracing.WorkflowTracer;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent declaration of a {@link Workflow}.
 * <pre>{@code
 * Workflow<Order, Receipt> workflow = WorkflowBuilder.<Order, Receipt>builder("checkout")
 *         .then(validate)
 *         .condition(route).then(express, standard)
 *         .concurrent("notify", group -> group
 *                 .branch("email", branch -> branch.then(sendEmail))
 *                 .branch("sms", branch -> branch.then(sendSms)))
 *         .then(receipt)
 *         .commit();
 * }</pre>
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@Slf4j
public final class WorkflowBuilder<I, O> {

    private final String id;
    private String description;
    private Schema<I> inputSchema;
    private Schema<O> outputSchema;
    private Map<String, Object> metadata;
    private Map<String, Object> ctx;
    private TelemetryOptions telemetry;
    private Function<Object, O> finalizer;
    private WorkflowTracer tracer;
    private final GraphDeclaration declaration;

    private WorkflowBuilder(String id) {
        if (id == null || id.isBlank()) {
            throw new WorkflowValidationException("Workflow id cannot be blank");
        }
        this.id = id;
        this.declaration = new GraphDeclaration(id, false, new HashSet<>());
    }

    public static <I, O> WorkflowBuilder<I, O> builder(String id) {
        return new WorkflowBuilder<>(id);
    }

    public WorkflowBuilder<I, O> description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder<I, O> inputSchema(Schema<I> inputSchema) {
        this.inputSchema = inputSchema;
        return this;
    }

    public WorkflowBuilder<I, O> outputSchema(Schema<O> outputSchema) {
        this.outputSchema = outputSchema;
        return this;
    }

    /**
     * Default run metadata, deep-copied into each run unless the run supplies its own.
     */
    public WorkflowBuilder<I, O> metadata(Map<String, Object> metadata) {
        this.metadata = metadata;
        return this;
    }

    /**
     * Base ctx; a run's ctx entries are merged over it.
     */
    public WorkflowBuilder<I, O> ctx(Map<String, Object> ctx) {
        this.ctx = ctx;
        return this;
    }

    public WorkflowBuilder<I, O> telemetry(TelemetryOptions telemetry) {
        this.telemetry = telemetry;
        return this;
    }

    /**
     * Maps the last step output to the workflow output before output validation.
     */
    public WorkflowBuilder<I, O> finalize(Function<Object, O> finalizer) {
        this.finalizer = finalizer;
        return this;
    }

    public WorkflowBuilder<I, O> tracer(WorkflowTracer tracer) {
        this.tracer = tracer;
        return this;
    }

    public WorkflowBuilder<I, O> then(WorkflowStep<?, ?> step) {
        declaration.append(step);
        return this;
    }

    public WorkflowBuilder<I, O> human(HumanStep<?, ?> step) {
        declaration.append(step);
        return this;
    }

    public WorkflowBuilder<I, O> loop(IterativeLoopStep<?, ?> step) {
        declaration.append(step);
        return this;
    }

    /**
     * Adds a condition step; its branches are declared on the returned builder.
     */
    public ConditionBuilder<WorkflowBuilder<I, O>> condition(WorkflowStep<?, ?> step) {
        declaration.appendCondition(step);
        return new ConditionBuilder<>(this, declaration, step.id());
    }

    /**
     * Adds a concurrent group of sub-graph branches.
     */
    public WorkflowBuilder<I, O> concurrent(String groupId, Consumer<ConcurrentGroupSpec> configure) {
        ConcurrentGroupSpec spec = new ConcurrentGroupSpec(groupId, new HashSet<>(declaration.usedIds()));
        configure.accept(spec);
        declaration.append(spec.build());
        return this;
    }

    /**
     * Adds a prebuilt concurrent group.
     */
    public WorkflowBuilder<I, O> concurrent(ConcurrentGroupStep<?, ?> step) {
        declaration.append(step);
        return this;
    }

    /**
     * Compiles the declaration.
     *
     * @throws WorkflowValidationException when the declaration is invalid
     */
    @SuppressWarnings("unchecked")
    public Workflow<I, O> commit() {
        Graph graph = declaration.compile();
        Function<Object, O> effectiveFinalizer = finalizer != null ? finalizer : value -> (O) value;
        log.info("Committed workflow: id={}, steps={}, entryStepId={}", id, graph.size(), graph.entryId());
        return new Workflow<>(id, description, inputSchema, outputSchema, metadata, ctx, telemetry,
                effectiveFinalizer, graph, tracer);
    }

    /**
     * Declares the branches of a condition step. Branches given as a list are named
     * {@code "0"}, {@code "1"} and so on.
     *
     * @param <P> the builder to return to
     */
    public static final class ConditionBuilder<P> {
        private final P parent;
        private final GraphDeclaration declaration;
        private final String conditionId;

        ConditionBuilder(P parent, GraphDeclaration declaration, String conditionId) {
            this.parent = parent;
            this.declaration = declaration;
            this.conditionId = conditionId;
        }

        public P then(WorkflowStep<?, ?>... steps) {
            Map<String, WorkflowStep<?, ?>> branches = new LinkedHashMap<>();
            for (int i = 0; i < steps.length; i++) {
                branches.put(String.valueOf(i), steps[i]);
            }
            declaration.registerBranches(conditionId, branches);
            return parent;
        }

        public P branches(Map<String, ? extends WorkflowStep<?, ?>> steps) {
            declaration.registerBranches(conditionId, new LinkedHashMap<>(steps));
            return parent;
        }
    }

    /**
     * Declares the steps of one concurrent branch. Human steps and nested concurrent groups
     * are rejected.
     */
    public static final class BranchBuilder {
        private final GraphDeclaration declaration;

        BranchBuilder(GraphDeclaration declaration) {
            this.declaration = declaration;
        }

        public BranchBuilder then(WorkflowStep<?, ?> step) {
            declaration.append(step);
            return this;
        }

        public BranchBuilder loop(IterativeLoopStep<?, ?> step) {
            declaration.append(step);
            return this;
        }

        public ConditionBuilder<BranchBuilder> condition(WorkflowStep<?, ?> step) {
            declaration.appendCondition(step);
            return new ConditionBuilder<>(this, declaration, step.id());
        }
    }

    /**
     * Declares a concurrent group built from sub-graph branches.
     */
    public static final class ConcurrentGroupSpec {
        private final String groupId;
        private final Set<String> usedIds;
        private final ConcurrentGroupStep.Builder<Object, Object> step;

        ConcurrentGroupSpec(String groupId, Set<String> usedIds) {
            this.groupId = groupId;
            this.usedIds = usedIds;
            this.usedIds.add(groupId);
            this.step = ConcurrentGroupStep.builder(groupId);
        }

        public ConcurrentGroupSpec description(String description) {
            step.description(description);
            return this;
        }

        public ConcurrentGroupSpec branch(String branchId, Consumer<BranchBuilder> configure) {
            GraphDeclaration branch = new GraphDeclaration(groupId + ":" + branchId, true, usedIds);
            configure.accept(new BranchBuilder(branch));
            if (branch.isEmpty()) {
                throw new WorkflowValidationException(
                        "Concurrent branch " + branchId + " in " + groupId + " requires at least one step");
            }
            step.branch(branchId, branch.compile());
            return this;
        }

        public ConcurrentGroupSpec aggregate(Function<ConcurrentGroupStep.ConcurrentResults<Object>, Object> aggregate) {
            step.aggregate(aggregate);
            return this;
        }

        public ConcurrentGroupSpec onError(FailureStrategy strategy) {
            step.onError(strategy);
            return this;
        }

        ConcurrentGroupStep<Object, Object> build() {
            return step.build();
        }
    }
}
