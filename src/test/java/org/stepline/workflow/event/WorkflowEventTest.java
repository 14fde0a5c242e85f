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

package org.stepline.workflow.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void shouldCopyMetadataAtEmission() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("attempt", 1);

        WorkflowEvent event = WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_START, "orders", "run_1", metadata, "in");
        metadata.put("attempt", 2);

        assertThat(event.metadata()).containsEntry("attempt", 1);
        assertThat(event.stepId()).isNull();
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void shouldExposeWireNames() {
        WorkflowEvent event = WorkflowEvent.step(WorkflowEventType.STEP_HUMAN_REQUESTED, "orders", "run_1", "approve",
                null, null, null, null);

        assertThat(event.getEventTypeString()).isEqualTo("step:human:requested");
        assertThat(event.metadata()).isEmpty();
        assertThat(WorkflowEventType.WORKFLOW_CANCELLED.isWorkflowLevel()).isTrue();
        assertThat(WorkflowEventType.STEP_BRANCH.isWorkflowLevel()).isFalse();
    }

    @Test
    void shouldSerializeWithoutNullFields() throws Exception {
        WorkflowEvent event = WorkflowEvent.step(WorkflowEventType.STEP_SUCCESS, "orders", "run_1", "charge",
                Map.of(), "ok", null, null);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event));

        assertThat(json.get("type").asText()).isEqualTo("step:success");
        assertThat(json.get("stepId").asText()).isEqualTo("charge");
        assertThat(json.has("parallelGroupId")).isFalse();
        assertThat(json.get("payload").asText()).isEqualTo("ok");
    }

    @Test
    void shouldDescribeErrors() {
        WorkflowEvent.ErrorInfo info = WorkflowEvent.ErrorInfo.of(new IllegalArgumentException("bad input"));

        assertThat(info.type()).isEqualTo("IllegalArgumentException");
        assertThat(info.message()).isEqualTo("bad input");
        assertThat(WorkflowEvent.ErrorInfo.of(null)).isNull();
    }
}
