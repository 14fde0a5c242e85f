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

package org.stepline.workflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.event.WorkflowWatcher;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for workflow runs, fed by run events.
 * <p>
 * Metrics:
 * <ul>
 *   <li>{@code stepline.workflow.started} counter per workflow</li>
 *   <li>{@code stepline.workflow.completed} counter per workflow and status</li>
 *   <li>{@code stepline.workflow.duration} timer per workflow and status</li>
 *   <li>{@code stepline.workflow.active} gauge of runs started and not settled</li>
 *   <li>{@code stepline.workflow.step.started} and {@code stepline.workflow.step.completed} counters</li>
 *   <li>{@code stepline.workflow.step.duration} timer</li>
 *   <li>{@code stepline.workflow.human.requested} counter</li>
 * </ul>
 */
@Slf4j
public class WorkflowMetrics implements WorkflowWatcher {

    private static final String METRIC_PREFIX = "stepline.workflow.";

    private static final String TAG_WORKFLOW_ID = "workflowId";
    private static final String TAG_STEP_ID = "stepId";
    private static final String TAG_STATUS = "status";

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicInteger> activeWorkflows = new ConcurrentHashMap<>();
    private final Map<String, Timer.Sample> runSamples = new ConcurrentHashMap<>();
    private final Map<String, Timer.Sample> stepSamples = new ConcurrentHashMap<>();

    public WorkflowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("WorkflowMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    @Override
    public void onEvent(WorkflowEvent event) {
        switch (event.type()) {
            case WORKFLOW_START -> recordWorkflowStarted(event);
            case WORKFLOW_SUCCESS -> recordWorkflowCompleted(event, "success");
            case WORKFLOW_ERROR -> recordWorkflowCompleted(event, "failed");
            case WORKFLOW_CANCELLED -> recordWorkflowCompleted(event, "cancelled");
            case STEP_START -> recordStepStarted(event);
            case STEP_SUCCESS -> recordStepCompleted(event, "success");
            case STEP_ERROR -> recordStepCompleted(event, "failed");
            case STEP_HUMAN_REQUESTED -> recordHumanRequested(event);
            default -> {
            }
        }
    }

    // ==================== Workflow Metrics ====================

    private void recordWorkflowStarted(WorkflowEvent event) {
        Counter.builder(METRIC_PREFIX + "started")
                .description("Number of workflow runs started")
                .tag(TAG_WORKFLOW_ID, event.workflowId())
                .register(meterRegistry)
                .increment();

        activeGauge(event.workflowId()).incrementAndGet();
        runSamples.put(event.runId(), Timer.start(meterRegistry));

        log.debug("METRIC: workflow.started workflowId={}, runId={}", event.workflowId(), event.runId());
    }

    private void recordWorkflowCompleted(WorkflowEvent event, String status) {
        Counter.builder(METRIC_PREFIX + "completed")
                .description("Number of workflow runs completed")
                .tag(TAG_WORKFLOW_ID, event.workflowId())
                .tag(TAG_STATUS, status)
                .register(meterRegistry)
                .increment();

        Timer.Sample sample = runSamples.remove(event.runId());
        if (sample != null) {
            sample.stop(Timer.builder(METRIC_PREFIX + "duration")
                    .description("Workflow run duration")
                    .tag(TAG_WORKFLOW_ID, event.workflowId())
                    .tag(TAG_STATUS, status)
                    .register(meterRegistry));
            AtomicInteger active = activeWorkflows.get(event.workflowId());
            if (active != null && active.get() > 0) {
                active.decrementAndGet();
            }
        }

        log.debug("METRIC: workflow.completed workflowId={}, runId={}, status={}",
                event.workflowId(), event.runId(), status);
    }

    // ==================== Step Metrics ====================

    private void recordStepStarted(WorkflowEvent event) {
        Counter.builder(METRIC_PREFIX + "step.started")
                .description("Number of steps started")
                .tag(TAG_WORKFLOW_ID, event.workflowId())
                .tag(TAG_STEP_ID, event.stepId())
                .register(meterRegistry)
                .increment();

        stepSamples.put(stepKey(event), Timer.start(meterRegistry));
    }

    private void recordStepCompleted(WorkflowEvent event, String status) {
        Counter.builder(METRIC_PREFIX + "step.completed")
                .description("Number of steps completed")
                .tag(TAG_WORKFLOW_ID, event.workflowId())
                .tag(TAG_STEP_ID, event.stepId())
                .tag(TAG_STATUS, status)
                .register(meterRegistry)
                .increment();

        Timer.Sample sample = stepSamples.remove(stepKey(event));
        if (sample != null) {
            sample.stop(Timer.builder(METRIC_PREFIX + "step.duration")
                    .description("Step execution duration")
                    .tag(TAG_WORKFLOW_ID, event.workflowId())
                    .tag(TAG_STEP_ID, event.stepId())
                    .tag(TAG_STATUS, status)
                    .register(meterRegistry));
        }

        log.debug("METRIC: step.completed workflowId={}, stepId={}, status={}",
                event.workflowId(), event.stepId(), status);
    }

    private void recordHumanRequested(WorkflowEvent event) {
        Counter.builder(METRIC_PREFIX + "human.requested")
                .description("Number of human interactions requested")
                .tag(TAG_WORKFLOW_ID, event.workflowId())
                .tag(TAG_STEP_ID, event.stepId())
                .register(meterRegistry)
                .increment();

        // time spent waiting for a person is not step duration
        stepSamples.remove(stepKey(event));
    }

    // ==================== Helper Methods ====================

    private AtomicInteger activeGauge(String workflowId) {
        return activeWorkflows.computeIfAbsent(workflowId, id -> {
            AtomicInteger gauge = new AtomicInteger(0);
            Gauge.builder(METRIC_PREFIX + "active", gauge, AtomicInteger::get)
                    .description("Number of workflow runs in progress")
                    .tag(TAG_WORKFLOW_ID, id)
                    .register(meterRegistry);
            return gauge;
        });
    }

    private static String stepKey(WorkflowEvent event) {
        return event.runId() + ":" + event.stepId();
    }
}
