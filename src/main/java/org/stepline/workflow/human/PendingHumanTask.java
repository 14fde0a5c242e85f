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

import java.time.Instant;

/**
 * Human task a suspended run is waiting on.
 *
 * @param runId the suspended run
 * @param stepId the human step to resume
 * @param workflowId the workflow the run belongs to
 * @param output the payload prepared for the human
 * @param form the requested form
 * @param requestedAt when the request was issued
 */
public record PendingHumanTask(
        String runId,
        String stepId,
        String workflowId,
        Object output,
        HumanForm form,
        Instant requestedAt
) {
}
