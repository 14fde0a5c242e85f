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

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Run-scoped services available to a step while it executes.
 */
public interface WorkflowStepContext {

    String workflowId();

    String runId();

    /**
     * Id of the step this context was built for.
     */
    String stepId();

    /**
     * The validated workflow input.
     */
    Object initialInput();

    /**
     * Key/value store shared by every step of the run. Concurrent children share the same
     * store; concurrent writes to one key are the caller's concern.
     */
    Map<String, Object> store();

    /**
     * Returns a copy of the current run metadata.
     */
    Map<String, Object> getMetadata();

    /**
     * Replaces the run metadata with the updater's result.
     */
    void updateMetadata(UnaryOperator<Map<String, Object>> updater);

    /**
     * Returns a copy of the current run context.
     */
    Map<String, Object> getCtx();

    /**
     * Replaces the run context with the updater's result.
     */
    void updateCtx(UnaryOperator<Map<String, Object>> updater);

    /**
     * Emits a custom {@code step:event} on the run's event channel.
     */
    void emit(String name, Object payload);
}
