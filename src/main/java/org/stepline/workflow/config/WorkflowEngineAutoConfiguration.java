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

package org.stepline.workflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.stepline.workflow.core.Workflow;
import org.stepline.workflow.core.WorkflowRegistry;
import org.stepline.workflow.metrics.WorkflowMetrics;
import org.stepline.workflow.metrics.WorkflowMetricsAutoConfiguration;
import org.stepline.workflow.properties.WorkflowProperties;
import org.stepline.workflow.rest.WorkflowController;
import org.stepline.workflow.service.WorkflowRunRegistry;
import org.stepline.workflow.service.WorkflowService;
import org.stepline.workflow.tracing.WorkflowTracer;
import org.stepline.workflow.tracing.WorkflowTracingAutoConfiguration;

/**
 * Auto-configuration for the Stepline workflow engine.
 * <p>
 * Creates the following beans:
 * <ul>
 *   <li>WorkflowRegistry - holds every {@link Workflow} bean of the context</li>
 *   <li>WorkflowRunRegistry - keeps hosted runs addressable for resume and cancel</li>
 *   <li>WorkflowService - hosts runs</li>
 *   <li>WorkflowController - REST API endpoints</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(after = {WorkflowTracingAutoConfiguration.class, WorkflowMetricsAutoConfiguration.class})
@EnableConfigurationProperties(WorkflowProperties.class)
@ConditionalOnProperty(prefix = "stepline.workflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRegistry workflowRegistry(ObjectProvider<Workflow<?, ?>> workflows) {
        WorkflowRegistry registry = new WorkflowRegistry();
        workflows.orderedStream().forEach(registry::register);
        log.info("Creating WorkflowRegistry with {} workflows", registry.size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRunRegistry workflowRunRegistry(WorkflowProperties properties) {
        log.info("Creating WorkflowRunRegistry retaining at most {} runs", properties.getRuns().getMaxRetained());
        return new WorkflowRunRegistry(properties.getRuns().getMaxRetained());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowService workflowService(
            WorkflowRegistry workflowRegistry,
            WorkflowRunRegistry runRegistry,
            ObjectProvider<WorkflowTracer> workflowTracer,
            ObjectProvider<WorkflowMetrics> workflowMetrics,
            WorkflowProperties properties) {
        WorkflowTracer tracer = workflowTracer.getIfAvailable(WorkflowTracer::noop);
        WorkflowMetrics metrics = workflowMetrics.getIfAvailable();
        log.info("Creating WorkflowService (tracing: {}, metrics: {})", tracer.isEnabled(), metrics != null);
        return new WorkflowService(workflowRegistry, runRegistry, tracer, metrics, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(prefix = "stepline.workflow.api", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowController workflowController(WorkflowService workflowService, WorkflowProperties properties) {
        log.info("Creating WorkflowController REST API at {}", properties.getApi().getBasePath());
        return new WorkflowController(workflowService);
    }
}
