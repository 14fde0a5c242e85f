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

package org.stepline.workflow.rest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.stepline.workflow.core.GraphInspection;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.event.WorkflowEvent.ErrorInfo;
import org.stepline.workflow.event.WorkflowEventType;
import org.stepline.workflow.exception.SchemaValidationException;
import org.stepline.workflow.exception.WorkflowNotFoundException;
import org.stepline.workflow.exception.WorkflowResumeException;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.rest.dto.ResumeRequest;
import org.stepline.workflow.rest.dto.RunResultResponse;
import org.stepline.workflow.rest.dto.RunWorkflowRequest;
import org.stepline.workflow.service.WorkflowService;
import org.stepline.workflow.service.WorkflowService.WorkflowSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for hosted workflow runs.
 * <p>
 * A thin layer mapping HTTP requests onto the {@link WorkflowService}. Provides endpoints for:
 * <ul>
 *   <li>Listing workflows and inspecting their graphs</li>
 *   <li>Running workflows, optionally streaming their events as server-sent events</li>
 *   <li>Answering pending human steps</li>
 *   <li>Cancelling runs</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("${stepline.workflow.api.base-path:/api/v1/workflows}")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService workflowService;

    @GetMapping
    public Mono<ResponseEntity<List<WorkflowSummary>>> listWorkflows() {
        return Mono.just(ResponseEntity.ok(workflowService.listWorkflows()));
    }

    @GetMapping("/{workflowId}")
    public Mono<ResponseEntity<WorkflowSummary>> getWorkflow(@PathVariable String workflowId) {
        return Mono.justOrEmpty(workflowService.getWorkflow(workflowId))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Gets the nodes and edges of a workflow graph for visualization.
     */
    @GetMapping("/{workflowId}/graph")
    public Mono<ResponseEntity<GraphInspection>> getGraph(@PathVariable String workflowId) {
        return Mono.justOrEmpty(workflowService.getInspection(workflowId))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Runs a workflow until it settles or suspends on a human step.
     * <p>
     * Responds 200 for a settled run and 202 for a run waiting on a human.
     */
    @PostMapping("/{workflowId}/run")
    public Mono<ResponseEntity<RunResultResponse>> runWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) RunWorkflowRequest request) {

        RunWorkflowRequest effective = request != null ? request : new RunWorkflowRequest();
        log.info("Running workflow via API: workflowId={}", workflowId);

        return workflowService.run(workflowId, effective.toOptions())
                .map(result -> toResponse(workflowId, result))
                .onErrorResume(WorkflowNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * Runs a workflow and streams its events.
     * <p>
     * The stream opens with a {@code run} event carrying the run id, continues with one event per
     * workflow event named by its type, and closes with a {@code result} event. A run suspended on
     * a human step closes the stream after {@code step:human:requested}. Failures to start the run
     * are reported as an {@code error} event. Disconnecting cancels the run.
     */
    @PostMapping(value = "/{workflowId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) RunWorkflowRequest request) {

        RunWorkflowRequest effective = request != null ? request : new RunWorkflowRequest();
        log.info("Streaming workflow via API: workflowId={}", workflowId);

        return workflowService.stream(workflowId, effective.toOptions())
                .flatMapMany(stream -> Flux.concat(
                                Mono.just(sse("run", Map.of("runId", stream.runId()))),
                                stream.events()
                                        .takeUntil(event -> event.type() == WorkflowEventType.STEP_HUMAN_REQUESTED)
                                        .map(this::toEvent),
                                stream.result().map(result -> sse("result", RunResultResponse.from(workflowId, result))))
                        .doOnCancel(stream::cancel))
                .onErrorResume(error -> Mono.just(sse("error", ErrorInfo.of(error))));
    }

    @PostMapping("/{workflowId}/runs/{runId}/resume")
    public Mono<ResponseEntity<RunResultResponse>> resumeRun(
            @PathVariable String workflowId,
            @PathVariable String runId,
            @Valid @RequestBody ResumeRequest request) {

        log.info("Resuming run via API: workflowId={}, runId={}, stepId={}", workflowId, runId, request.getStepId());

        return workflowService.resume(workflowId, runId, request.getStepId(), request.getData())
                .map(result -> toResponse(workflowId, result))
                .onErrorResume(WorkflowNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()))
                .onErrorResume(WorkflowResumeException.class, e ->
                        Mono.just(ResponseEntity.badRequest().build()))
                .onErrorResume(SchemaValidationException.class, e ->
                        Mono.just(ResponseEntity.badRequest().build()));
    }

    @PostMapping("/{workflowId}/runs/{runId}/cancel")
    public Mono<ResponseEntity<Void>> cancelRun(
            @PathVariable String workflowId,
            @PathVariable String runId) {

        log.info("Cancelling run via API: workflowId={}, runId={}", workflowId, runId);

        return workflowService.cancel(workflowId, runId)
                .then(Mono.just(ResponseEntity.accepted().<Void>build()))
                .onErrorResume(WorkflowNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    private ResponseEntity<RunResultResponse> toResponse(String workflowId, WorkflowRunResult<?> result) {
        HttpStatus status = result.status() == RunStatus.WAITING_HUMAN ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(RunResultResponse.from(workflowId, result));
    }

    private ServerSentEvent<Object> toEvent(WorkflowEvent event) {
        return sse(event.getEventTypeString(), event);
    }

    private static ServerSentEvent<Object> sse(String name, Object data) {
        return ServerSentEvent.<Object>builder(data).event(name).build();
    }
}
