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
import org.stepline.workflow.model.StepSnapshot;

import java.time.Instant;

/**
 * Response DTO for one recorded step attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepSnapshotResponse {

    private String status;
    private Object input;
    private Object output;
    private ErrorInfo error;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;
    private int occurrence;
    private String branchId;
    private String nextStepId;
    private String parallelGroupId;
    private String parallelBranchId;

    public static StepSnapshotResponse from(StepSnapshot snapshot) {
        return StepSnapshotResponse.builder()
                .status(snapshot.status().value())
                .input(snapshot.input())
                .output(snapshot.output())
                .error(snapshot.error() != null ? ErrorInfo.of(snapshot.error()) : null)
                .startedAt(snapshot.startedAt())
                .finishedAt(snapshot.finishedAt())
                .durationMs(snapshot.getDuration() != null ? snapshot.getDuration().toMillis() : null)
                .occurrence(snapshot.occurrence())
                .branchId(snapshot.branchId())
                .nextStepId(snapshot.nextStepId())
                .parallelGroupId(snapshot.parallelGroupId())
                .parallelBranchId(snapshot.parallelBranchId())
                .build();
    }
}
