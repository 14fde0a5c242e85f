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

package org.stepline.workflow.step;

import org.stepline.workflow.cancel.CancellationToken;

/**
 * Engine-side call into {@link WorkflowStep#execute(StepInvocation)}.
 *
 * @param input the raw value entering the step
 * @param context run services
 * @param cancellationToken token the step and its children observe
 * @param branchRunner walks sub-graph branches of concurrent groups, may be null
 */
public record StepInvocation(
        Object input,
        WorkflowStepContext context,
        CancellationToken cancellationToken,
        BranchRunner branchRunner
) {

    public StepInvocation {
        cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.none();
    }

    public StepInvocation withInput(Object newInput) {
        return new StepInvocation(newInput, context, cancellationToken, branchRunner);
    }

    public StepInvocation withCancellationToken(CancellationToken token) {
        return new StepInvocation(input, context, token, branchRunner);
    }
}
