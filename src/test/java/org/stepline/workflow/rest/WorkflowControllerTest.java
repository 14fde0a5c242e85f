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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerSentEvent;
import org.stepline.workflow.core.GraphInspection;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.event.WorkflowEventType;
import org.stepline.workflow.exception.SchemaValidationException;
import org.stepline.workflow.exception.WorkflowNotFoundException;
import org.stepline.workflow.exception.WorkflowResumeException;
import org.stepline.workflow.human.HumanForm;
import org.stepline.workflow.human.PendingHumanTask;
import org.stepline.workflow.model.RunStatus;
import org.stepline.workflow.model.StepSnapshot;
import org.stepline.workflow.model.WorkflowRunOptions;
import org.stepline.workflow.model.WorkflowRunResult;
import org.stepline.workflow.rest.dto.ResumeRequest;
import org.stepline.workflow.rest.dto.RunResultResponse;
import org.stepline.workflow.rest.dto.RunWorkflowRequest;
import org.stepline.workflow.service.WorkflowService;
import org.stepline.workflow.service.WorkflowService.RunStream;
import org.stepline.workflow.service.WorkflowService.WorkflowSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for WorkflowController.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowControllerTest {

    @Mock
    private WorkflowService workflowService;

    private WorkflowController controller;

    @BeforeEach
    void setUp() {
        controller = new WorkflowController(workflowService);
    }

    private static WorkflowRunResult<Object> result(RunStatus status, Object output, PendingHumanTask pending) {
        Instant now = Instant.now();
        StepSnapshot snapshot = StepSnapshot.success("in", output, now.minusMillis(5), now, 1, null, null);
        return new WorkflowRunResult<>("run_1", status, output, null, Map.of("only", List.of(snapshot)),
                Map.of(), Map.of(), now.minusMillis(10), now, pending);
    }

    @Test
    void shouldListWorkflows() {
        when(workflowService.listWorkflows()).thenReturn(List.of(
                new WorkflowSummary("workflow-1", "First", 2),
                new WorkflowSummary("workflow-2", null, 1)));

        StepVerifier.create(controller.listWorkflows())
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody()).hasSize(2);
                })
                .verifyComplete();
    }

    @Test
    void shouldGetWorkflow() {
        when(workflowService.getWorkflow("workflow-1"))
                .thenReturn(Optional.of(new WorkflowSummary("workflow-1", "First", 2)));

        StepVerifier.create(controller.getWorkflow("workflow-1"))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody().stepCount()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownWorkflow() {
        when(workflowService.getWorkflow("unknown")).thenReturn(Optional.empty());

        StepVerifier.create(controller.getWorkflow("unknown"))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                .verifyComplete();
    }

    @Test
    void shouldGetGraph() {
        GraphInspection inspection = new GraphInspection("a", List.of(), List.of());
        when(workflowService.getInspection("workflow-1")).thenReturn(Optional.of(inspection));

        StepVerifier.create(controller.getGraph("workflow-1"))
                .assertNext(response -> assertThat(response.getBody()).isSameAs(inspection))
                .verifyComplete();
    }

    @Test
    void shouldRunWorkflow() {
        when(workflowService.run(eq("workflow-1"), any())).thenReturn(Mono.just(result(RunStatus.SUCCESS, "done", null)));
        RunWorkflowRequest request = new RunWorkflowRequest();
        request.setInput(Map.of("orderId", "123"));
        request.setCtx(Map.of("tenant", "acme"));

        StepVerifier.create(controller.runWorkflow("workflow-1", request))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    RunResultResponse body = response.getBody();
                    assertThat(body.getWorkflowId()).isEqualTo("workflow-1");
                    assertThat(body.getStatus()).isEqualTo("success");
                    assertThat(body.getResult()).isEqualTo("done");
                    assertThat(body.getSteps().get("only").get(0).getStatus()).isEqualTo("success");
                    assertThat(body.getDurationMs()).isEqualTo(10L);
                })
                .verifyComplete();

        ArgumentCaptor<WorkflowRunOptions> options = ArgumentCaptor.forClass(WorkflowRunOptions.class);
        verify(workflowService).run(eq("workflow-1"), options.capture());
        assertThat(options.getValue().inputData()).isEqualTo(Map.of("orderId", "123"));
        assertThat(options.getValue().ctx()).containsEntry("tenant", "acme");
    }

    @Test
    void shouldAcceptRunWaitingForHuman() {
        PendingHumanTask task = new PendingHumanTask("run_1", "approve", "workflow-1", null,
                HumanForm.of("Approve"), Instant.now());
        when(workflowService.run(eq("workflow-1"), any()))
                .thenReturn(Mono.just(result(RunStatus.WAITING_HUMAN, null, task)));

        StepVerifier.create(controller.runWorkflow("workflow-1", null))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
                    assertThat(response.getBody().getStatus()).isEqualTo("waiting_human");
                    assertThat(response.getBody().getPendingHuman().stepId()).isEqualTo("approve");
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundWhenRunningUnknownWorkflow() {
        when(workflowService.run(eq("unknown"), any())).thenReturn(Mono.error(new WorkflowNotFoundException("unknown")));

        StepVerifier.create(controller.runWorkflow("unknown", new RunWorkflowRequest()))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                .verifyComplete();
    }

    @Test
    void shouldResumeRun() {
        when(workflowService.resume("workflow-1", "run_1", "approve", "yes"))
                .thenReturn(Mono.just(result(RunStatus.SUCCESS, "booked", null)));

        StepVerifier.create(controller.resumeRun("workflow-1", "run_1", new ResumeRequest("approve", "yes")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody().getResult()).isEqualTo("booked");
                })
                .verifyComplete();
    }

    @Test
    void shouldMapResumeFailures() {
        when(workflowService.resume("workflow-1", "run_missing", "approve", null))
                .thenReturn(Mono.error(new WorkflowNotFoundException("workflow-1", "run_missing")));
        when(workflowService.resume("workflow-1", "run_1", "other", null))
                .thenReturn(Mono.error(new WorkflowResumeException("Pending human interaction is for step approve, received other")));
        when(workflowService.resume("workflow-1", "run_1", "approve", null))
                .thenReturn(Mono.error(new SchemaValidationException("human step approve response",
                        new IllegalArgumentException("missing decision"))));

        StepVerifier.create(controller.resumeRun("workflow-1", "run_missing", new ResumeRequest("approve", null)))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                .verifyComplete();
        StepVerifier.create(controller.resumeRun("workflow-1", "run_1", new ResumeRequest("other", null)))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                .verifyComplete();
        StepVerifier.create(controller.resumeRun("workflow-1", "run_1", new ResumeRequest("approve", null)))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                .verifyComplete();
    }

    @Test
    void shouldCancelRun() {
        when(workflowService.cancel("workflow-1", "run_1")).thenReturn(Mono.empty());
        when(workflowService.cancel("workflow-1", "run_gone"))
                .thenReturn(Mono.error(new WorkflowNotFoundException("workflow-1", "run_gone")));

        StepVerifier.create(controller.cancelRun("workflow-1", "run_1"))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED))
                .verifyComplete();
        StepVerifier.create(controller.cancelRun("workflow-1", "run_gone"))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                .verifyComplete();
    }

    @Test
    void shouldStreamRunEvents() {
        Flux<WorkflowEvent> events = Flux.just(
                WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_START, "workflow-1", "run_1", Map.of(), "in"),
                WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_SUCCESS, "workflow-1", "run_1", Map.of(), "done"));
        when(workflowService.stream(eq("workflow-1"), any())).thenReturn(Mono.just(new RunStream("run_1", events,
                Mono.just(result(RunStatus.SUCCESS, "done", null)), () -> {
                })));

        StepVerifier.create(controller.streamWorkflow("workflow-1", null).map(ServerSentEvent::event))
                .expectNext("run", "workflow:start", "workflow:success", "result")
                .verifyComplete();
    }

    @Test
    void shouldCloseStreamAfterHumanRequest() {
        AtomicBoolean cancelled = new AtomicBoolean();
        PendingHumanTask task = new PendingHumanTask("run_1", "approve", "workflow-1", null,
                HumanForm.of("Approve"), Instant.now());
        Flux<WorkflowEvent> events = Flux.concat(
                Flux.just(
                        WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_START, "workflow-1", "run_1", Map.of(), "in"),
                        WorkflowEvent.step(WorkflowEventType.STEP_HUMAN_REQUESTED, "workflow-1", "run_1", "approve",
                                Map.of(), task, null, null)),
                Flux.never());
        when(workflowService.stream(eq("workflow-1"), any())).thenReturn(Mono.just(new RunStream("run_1", events,
                Mono.just(result(RunStatus.WAITING_HUMAN, null, task)), () -> cancelled.set(true))));

        StepVerifier.create(controller.streamWorkflow("workflow-1", new RunWorkflowRequest()))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("run");
                    assertThat(event.data()).isEqualTo(Map.of("runId", "run_1"));
                })
                .assertNext(event -> assertThat(event.event()).isEqualTo("workflow:start"))
                .assertNext(event -> assertThat(event.event()).isEqualTo("step:human:requested"))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("result");
                    assertThat(((RunResultResponse) event.data()).getStatus()).isEqualTo("waiting_human");
                })
                .verifyComplete();
        assertThat(cancelled).isFalse();
    }

    @Test
    void shouldReportStreamStartFailureAsEvent() {
        when(workflowService.stream(eq("unknown"), any())).thenReturn(Mono.error(new WorkflowNotFoundException("unknown")));

        StepVerifier.create(controller.streamWorkflow("unknown", null))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("error");
                    assertThat(event.data()).isEqualTo(new WorkflowEvent.ErrorInfo("WorkflowNotFoundException",
                            "Workflow not found: unknown"));
                })
                .verifyComplete();
    }
}
