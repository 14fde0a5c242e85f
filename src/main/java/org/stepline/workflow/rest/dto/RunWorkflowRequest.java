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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.stepline.workflow.model.WorkflowRunOptions;

import java.util.Map;

/**
 * Request DTO for starting a workflow run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunWorkflowRequest {

    /**
     * Input value handed to the workflow.
     */
    private Object input;

    /**
     * Run metadata. Replaces the workflow's default metadata when present.
     */
    private Map<String, Object> metadata;

    /**
     * Run context, merged over the workflow's default context.
     */
    private Map<String, Object> ctx;

    public WorkflowRunOptions toOptions() {
        return WorkflowRunOptions.builder()
                .inputData(input)
                .metadata(metadata)
                .ctx(ctx)
                .build();
    }
}
