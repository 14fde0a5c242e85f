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

package org.stepline.workflow.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for workflow metrics using Micrometer.
 * <p>
 * The following meters are exposed:
 * <ul>
 *   <li><b>stepline.workflow.started</b> - Counter of runs started</li>
 *   <li><b>stepline.workflow.completed</b> - Counter of runs settled, tagged by status</li>
 *   <li><b>stepline.workflow.duration</b> - Timer for run duration</li>
 *   <li><b>stepline.workflow.active</b> - Gauge of runs in flight</li>
 *   <li><b>stepline.workflow.step.started</b> - Counter of steps started</li>
 *   <li><b>stepline.workflow.step.completed</b> - Counter of steps completed, tagged by status</li>
 *   <li><b>stepline.workflow.step.duration</b> - Timer for step duration</li>
 *   <li><b>stepline.workflow.human.requested</b> - Counter of human requests issued</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "stepline.workflow", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        log.info("Configuring WorkflowMetrics with Micrometer MeterRegistry");
        return new WorkflowMetrics(meterRegistry);
    }
}
