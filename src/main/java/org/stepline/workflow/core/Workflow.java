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

import org.stepline.workflow.model.Metadata;
import org.stepline.workflow.model.WorkflowRunOptions;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.schema.Schema;
import org.stepline.workflow.schema.SchemaValidation;
import org.stepline.workflow.tracing.TelemetryOptions;
import org.stepline.workflow.tracing.WorkflowTracer;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * A committed workflow: an immutable compiled graph plus its schemas, defaults and
 * telemetry configuration. Each execution is a {@link WorkflowRun}.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public final class Workflow<I, O> {

    private final String id;
    private final String description;
    private final Schema<I> inputSchema;
    private final Schema<O> outputSchema;
    private final Map<String, Object> metadata;
    private final Map<String, Object> ctx;
    private final TelemetryOptions telemetry;
    private final Function<Object, O> finalizer;
    private final Graph graph;
    private final WorkflowTracer tracer;

    Workflow(String id, String description, Schema<I> inputSchema, Schema<O> outputSchema,
             Map<String, Object> metadata, Map<String, Object> ctx, TelemetryOptions telemetry,
             Function<Object, O> finalizer, Graph graph, WorkflowTracer tracer) {
        this.id = id;
        this.description = description;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.metadata = Metadata.deepCopy(metadata);
        this.ctx = Metadata.deepCopy(ctx);
        this.telemetry = telemetry;
        this.finalizer = finalizer;
        this.graph = graph;
        this.tracer = tracer != null ? tracer : WorkflowTracer.noop();
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public Graph graph() {
        return graph;
    }

    public TelemetryOptions telemetry() {
        return telemetry;
    }

    public WorkflowRun<I, O> createRun() {
        return createRun(RunIds.generate());
    }

    public WorkflowRun<I, O> createRun(String runId) {
        return createRun(runId, tracer);
    }

    /**
     * Creates a run reporting telemetry through the given tracer instead of the workflow's own.
     */
    public WorkflowRun<I, O> createRun(String runId, WorkflowTracer runTracer) {
        return new WorkflowRun<>(this, runId != null ? runId : RunIds.generate(), runTracer != null ? runTracer : tracer);
    }

    public Mono<WorkflowRunResult<O>> run(WorkflowRunOptions options) {
        return createRun().start(options);
    }

    public Mono<WorkflowRunResult<O>> run(Object input) {
        return run(WorkflowRunOptions.of(input));
    }

    public WorkflowRunStream<O> stream(WorkflowRunOptions options) {
        return createRun().stream(options);
    }

    public I validateInput(Object value) {
        return SchemaValidation.validate(inputSchema, value, "workflow " + id + " input");
    }

    /**
     * Applies the finalizer to the last step output and validates the result.
     */
    public O validateOutput(Object value) {
        O finalized = finalizer.apply(value);
        return SchemaValidation.validate(outputSchema, finalized, "workflow " + id + " output");
    }

    /**
     * A fresh deep copy of the default run metadata.
     */
    public Map<String, Object> initialMetadata() {
        return Metadata.deepCopy(metadata);
    }

    public Map<String, Object> initialCtx() {
        return Metadata.deepCopy(ctx);
    }

    public GraphInspection inspect() {
        return graph.inspect();
    }

    @Override
    public String toString() {
        return "Workflow[" + id + ", steps=" + graph.sequence() + "]";
    }
}
