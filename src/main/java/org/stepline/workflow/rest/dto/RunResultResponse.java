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

package org.stepline.workflow.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.stepline.workflow.event.WorkflowEvent.ErrorInfo;
import org.stepline.workflow.human.PendingHumanTask;
import org.stepline.workflow.model.WorkflowRunResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a run result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResultResponse {

    private String workflowId;
    private String runId;
    private String status;
    private Object result;
    private ErrorInfo error;
    private Map<String, List<StepSnapshotResponse>> steps;
    private Map<String, Object> metadata;
    private Map<String, Object> ctx;
    private PendingHumanTask pendingHuman;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;

    public static RunResultResponse from(String workflowId, WorkflowRunResult<?> result) {
        Map<String, List<StepSnapshotResponse>> steps = new LinkedHashMap<>();
        result.steps().forEach((stepId, snapshots) -> steps.put(stepId, snapshots.stream()
                .map(StepSnapshotResponse::from)
                .toList()));
        return RunResultResponse.builder()
                .workflowId(workflowId)
                .runId(result.runId())
                .status(result.status().value())
                .result(result.result())
                .error(result.error() != null ? ErrorInfo.of(result.error()) : null)
                .steps(steps)
                .metadata(result.metadata())
                .ctx(result.ctx())
                .pendingHuman(result.pendingHuman())
                .startedAt(result.startedAt())
                .finishedAt(result.finishedAt())
                .durationMs(result.getDuration() != null ? result.getDuration().toMillis() : null)
                .build();
    }
}
