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

package org.stepline.workflow.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Stepline workflow engine.
 * <p>
 * Example configuration:
 * <pre>
 * stepline:
 *   workflow:
 *     enabled: true
 *     metrics-enabled: true
 *     tracing-enabled: true
 *     api:
 *       enabled: true
 *       base-path: /api/v1/workflows
 *     runs:
 *       max-retained: 1000
 *       id-prefix: run_
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stepline.workflow")
public class WorkflowProperties {

    /**
     * Whether the workflow engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether run and step meters are recorded when a MeterRegistry is present.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether runs report observations when an ObservationRegistry is present.
     */
    private boolean tracingEnabled = true;

    /**
     * REST API configuration.
     */
    @Valid
    @NotNull
    private ApiConfig api = new ApiConfig();

    /**
     * Hosted run configuration.
     */
    @Valid
    @NotNull
    private RunsConfig runs = new RunsConfig();

    @Data
    public static class ApiConfig {

        /**
         * Whether the REST controller is exposed.
         */
        private boolean enabled = true;

        /**
         * Base path of the REST API.
         */
        @NotBlank
        private String basePath = "/api/v1/workflows";
    }

    @Data
    public static class RunsConfig {

        /**
         * Maximum number of runs kept addressable for resume and cancel.
         * The oldest run is evicted when the limit is exceeded.
         */
        @Min(1)
        private int maxRetained = 1000;

        /**
         * Prefix of generated run ids.
         */
        @NotBlank
        private String idPrefix = "run_";
    }
}
