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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Creates the {@link RunTelemetry} of each run.
 * <p>
 * Telemetry is recorded through the Micrometer {@link ObservationRegistry}, which bridges to
 * whatever tracer the application configured. When no registry is available, or when the
 * workflow and the run both leave telemetry disabled, runs get {@link RunTelemetry#NOOP}.
 */
@Slf4j
public class WorkflowTracer {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final ObservationRegistry observationRegistry;
    private final ObjectMapper objectMapper;

    public WorkflowTracer(@Nullable ObservationRegistry observationRegistry) {
        this(observationRegistry, null);
    }

    public WorkflowTracer(@Nullable ObservationRegistry observationRegistry, @Nullable ObjectMapper objectMapper) {
        this.observationRegistry = observationRegistry != null
                ? observationRegistry
                : ObservationRegistry.NOOP;
        this.objectMapper = objectMapper != null ? objectMapper : DEFAULT_MAPPER;
    }

    public static WorkflowTracer noop() {
        return new WorkflowTracer(null);
    }

    public boolean isEnabled() {
        return observationRegistry != ObservationRegistry.NOOP;
    }

    /**
     * Creates the telemetry of one run.
     *
     * @param settings resolved settings, {@code null} when telemetry is off for the run
     */
    public RunTelemetry startRun(String workflowId, String runId, @Nullable String description,
                                 @Nullable TelemetrySettings settings) {
        if (settings == null || !isEnabled()) {
            return RunTelemetry.NOOP;
        }
        log.debug("Tracing run: workflowId={}, runId={}, traceName={}", workflowId, runId, settings.traceName());
        return new ObservationRunTelemetry(observationRegistry, objectMapper, workflowId, runId, description, settings);
    }
}
