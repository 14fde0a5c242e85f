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

package org.stepline.workflow.tracing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective telemetry configuration of one run.
 *
 * @param traceName name of the run span
 * @param metadata attributes added to the run span
 * @param recordInputs whether inputs are attached to spans
 * @param recordOutputs whether outputs are attached to spans
 * @param userId user attributed with the run, may be null
 */
public record TelemetrySettings(
        String traceName,
        Map<String, Object> metadata,
        boolean recordInputs,
        boolean recordOutputs,
        String userId
) {

    /**
     * Resolves the run-level option against the workflow-level one.
     * <p>
     * An explicitly disabled run option wins. Otherwise telemetry is on when either level
     * enables it; metadata is merged (run entries win) and scalar fields prefer the run
     * level, then the workflow level, then the defaults (trace name = workflow id, inputs
     * and outputs recorded).
     *
     * @return the settings, or {@code null} when telemetry is off for the run
     */
    public static TelemetrySettings resolve(String workflowId, TelemetryOptions base, TelemetryOptions override) {
        if (override != null && !override.enabled()) {
            return null;
        }
        boolean baseEnabled = base != null && base.enabled();
        boolean overrideEnabled = override != null && override.enabled();
        if (!baseEnabled && !overrideEnabled) {
            return null;
        }
        TelemetryOptions effectiveBase = baseEnabled ? base : null;

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (effectiveBase != null) {
            metadata.putAll(effectiveBase.metadata());
        }
        if (override != null) {
            metadata.putAll(override.metadata());
        }

        return new TelemetrySettings(
                firstNonNull(override != null ? override.traceName() : null,
                        effectiveBase != null ? effectiveBase.traceName() : null, workflowId),
                Collections.unmodifiableMap(metadata),
                firstNonNull(override != null ? override.recordInputs() : null,
                        effectiveBase != null ? effectiveBase.recordInputs() : null, Boolean.TRUE),
                firstNonNull(override != null ? override.recordOutputs() : null,
                        effectiveBase != null ? effectiveBase.recordOutputs() : null, Boolean.TRUE),
                firstNonNull(override != null ? override.userId() : null,
                        effectiveBase != null ? effectiveBase.userId() : null, null));
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
