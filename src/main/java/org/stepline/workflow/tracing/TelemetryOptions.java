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

import java.util.Map;

/**
 * Telemetry policy declared on a workflow or supplied for a single run.
 * <p>
 * A {@code null} option means "not configured"; {@link #disabled()} explicitly turns
 * telemetry off, which on a run overrides whatever the workflow declares. Unset
 * fields ({@code null}) fall back to the other level and then to the defaults applied
 * by {@link TelemetrySettings#resolve}.
 *
 * @param enabled whether telemetry is requested
 * @param traceName name of the run span, defaults to the workflow id
 * @param metadata attributes added to the run span
 * @param recordInputs whether inputs are attached to spans
 * @param recordOutputs whether outputs are attached to spans
 * @param userId user attributed with the run
 */
public record TelemetryOptions(
        boolean enabled,
        String traceName,
        Map<String, Object> metadata,
        Boolean recordInputs,
        Boolean recordOutputs,
        String userId
) {

    public TelemetryOptions {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Telemetry on, every other field left to the defaults.
     */
    public static TelemetryOptions defaults() {
        return new TelemetryOptions(true, null, null, null, null, null);
    }

    public static TelemetryOptions disabled() {
        return new TelemetryOptions(false, null, null, null, null, null);
    }

    public TelemetryOptions withTraceName(String traceName) {
        return new TelemetryOptions(true, traceName, metadata, recordInputs, recordOutputs, userId);
    }

    public TelemetryOptions withMetadata(Map<String, Object> metadata) {
        return new TelemetryOptions(true, traceName, metadata, recordInputs, recordOutputs, userId);
    }

    public TelemetryOptions withRecording(Boolean recordInputs, Boolean recordOutputs) {
        return new TelemetryOptions(true, traceName, metadata, recordInputs, recordOutputs, userId);
    }

    public TelemetryOptions withUserId(String userId) {
        return new TelemetryOptions(true, traceName, metadata, recordInputs, recordOutputs, userId);
    }
}
