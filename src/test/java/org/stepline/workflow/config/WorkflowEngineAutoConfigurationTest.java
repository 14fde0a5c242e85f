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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ReactiveWebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.stepline.workflow.core.Workflow;
import org.stepline.workflow.core.WorkflowBuilder;
import org.stepline.workflow.core.WorkflowRegistry;
import org.stepline.workflow.metrics.WorkflowMetrics;
import org.stepline.workflow.metrics.WorkflowMetricsAutoConfiguration;
import org.stepline.workflow.rest.WorkflowController;
import org.stepline.workflow.service.WorkflowService;
import org.stepline.workflow.step.PlainStep;
import org.stepline.workflow.step.StepHandler;
import org.stepline.workflow.tracing.WorkflowTracer;
import org.stepline.workflow.tracing.WorkflowTracingAutoConfiguration;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEngineAutoConfigurationTest {

    private static final AutoConfigurations ENGINE = AutoConfigurations.of(
            WorkflowTracingAutoConfiguration.class,
            WorkflowMetricsAutoConfiguration.class,
            WorkflowEngineAutoConfiguration.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(ENGINE)
            .withUserConfiguration(WorkflowsConfiguration.class);

    @Test
    void shouldRegisterWorkflowBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(WorkflowService.class);
            assertThat(context.getBean(WorkflowRegistry.class).getWorkflowIds())
                    .containsExactlyInAnyOrder("greeting", "farewell");
            assertThat(context).doesNotHaveBean(WorkflowController.class);
            assertThat(context).doesNotHaveBean(WorkflowMetrics.class);
            assertThat(context.getBean(WorkflowTracer.class).isEnabled()).isFalse();
        });
    }

    @Test
    void shouldWireMetricsAndTracingWhenRegistriesExist() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(ObservationRegistry.class, ObservationRegistry::create)
                .run(context -> {
                    assertThat(context).hasSingleBean(WorkflowMetrics.class);
                    assertThat(context.getBean(WorkflowTracer.class).isEnabled()).isTrue();
                });
    }

    @Test
    void shouldHonourFeatureSwitches() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("stepline.workflow.metrics-enabled=false", "stepline.workflow.tracing-enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(WorkflowMetrics.class);
                    assertThat(context).doesNotHaveBean(WorkflowTracer.class);
                    assertThat(context).hasSingleBean(WorkflowService.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("stepline.workflow.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(WorkflowService.class);
                    assertThat(context).doesNotHaveBean(WorkflowRegistry.class);
                });
    }

    @Test
    void shouldRejectInvalidRunRetention() {
        contextRunner
                .withPropertyValues("stepline.workflow.runs.max-retained=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldExposeControllerInReactiveWebApplication() {
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(ENGINE)
                .withUserConfiguration(WorkflowsConfiguration.class)
                .run(context -> assertThat(context).hasSingleBean(WorkflowController.class));
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(ENGINE)
                .withPropertyValues("stepline.workflow.api.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(WorkflowController.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class WorkflowsConfiguration {

        @Bean
        Workflow<Object, Object> greetingWorkflow() {
            return WorkflowBuilder.<Object, Object>builder("greeting")
                    .then(PlainStep.of("greet", StepHandler.identity()))
                    .commit();
        }

        @Bean
        Workflow<Object, Object> farewellWorkflow() {
            return WorkflowBuilder.<Object, Object>builder("farewell")
                    .then(PlainStep.of("wave", StepHandler.identity()))
                    .commit();
        }
    }
}
