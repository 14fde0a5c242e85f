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

import java.util.Map;

/**
 * Arguments passed to a {@link StepHandler}.
 *
 * @param input the validated step input
 * @param context run services
 * @param cancellationToken token to observe for cooperative cancellation
 * @param <I> the input type
 */
public record StepArgs<I>(I input, WorkflowStepContext context, CancellationToken cancellationToken) {

    /**
     * Shortcut for {@code context().getCtx()}.
     */
    public Map<String, Object> ctx() {
        return context.getCtx();
    }
}
