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

package org.stepline.workflow.human;

import java.util.Objects;

/**
 * Response supplied to resume a suspended run.
 *
 * @param runId optional id of the run being resumed; checked when present
 * @param stepId the human step being answered
 * @param data the raw response, parsed by the step
 */
public record HumanInput(String runId, String stepId, Object data) {

    public HumanInput {
        Objects.requireNonNull(stepId, "stepId cannot be null");
    }

    public static HumanInput of(String stepId, Object data) {
        return new HumanInput(null, stepId, data);
    }
}
