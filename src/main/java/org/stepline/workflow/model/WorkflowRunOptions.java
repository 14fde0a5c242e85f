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

package org.stepline.workflow.model;

import org.stepline.workflow.cancel.CancellationToken;
import org.stepline.workflow.tracing.TelemetryOptions;

import java.util.Map;

/**
 * Options for starting a workflow run.
 *
 * @param inputData the raw workflow input, validated by the workflow's input schema
 * @param metadata run metadata replacing the workflow defaults, or null to use them
 * @param ctx context entries merged over the workflow's base context
 * @param cancellationToken external token composed with the run's own controller
 * @param telemetry telemetry override for this run
 */
public record WorkflowRunOptions(
        Object inputData,
        Map<String, Object> metadata,
        Map<String, Object> ctx,
        CancellationToken cancellationToken,
        TelemetryOptions telemetry
) {

    public static WorkflowRunOptions of(Object inputData) {
        return new WorkflowRunOptions(inputData, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link WorkflowRunOptions}.
     */
    public static class Builder {
        private Object inputData;
        private Map<String, Object> metadata;
        private Map<String, Object> ctx;
        private CancellationToken cancellationToken;
        private TelemetryOptions telemetry;

        public Builder inputData(Object inputData) {
            this.inputData = inputData;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder ctx(Map<String, Object> ctx) {
            this.ctx = ctx;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public Builder telemetry(TelemetryOptions telemetry) {
            this.telemetry = telemetry;
            return this;
        }

        public WorkflowRunOptions build() {
            return new WorkflowRunOptions(inputData, metadata, ctx, cancellationToken, telemetry);
        }
    }
}
