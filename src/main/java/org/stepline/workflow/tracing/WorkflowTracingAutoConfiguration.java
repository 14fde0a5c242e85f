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
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for run tracing through the Micrometer Observation API.
 * <p>
 * Runs report observations when an {@link ObservationRegistry} bean is present; otherwise the
 * tracer is a no-op. Disable with:
 * <pre>
 * stepline:
 *   workflow:
 *     tracing-enabled: false
 * </pre>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.observation.ObservationAutoConfiguration")
@ConditionalOnClass(ObservationRegistry.class)
@ConditionalOnProperty(prefix = "stepline.workflow", name = "tracing-enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowTracingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowTracer workflowTracer(ObjectProvider<ObservationRegistry> observationRegistry,
                                         ObjectProvider<ObjectMapper> objectMapper) {
        ObservationRegistry registry = observationRegistry.getIfAvailable();
        log.info("Configuring WorkflowTracer (observationRegistry: {})", registry != null);
        return new WorkflowTracer(registry, objectMapper.getIfAvailable());
    }
}
