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

package org.stepline.workflow.core;

import org.junit.jupiter.api.Test;
import org.stepline.workflow.exception.BranchResolutionException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.step.PlainStep;
import org.stepline.workflow.step.StepHandler;
import org.stepline.workflow.step.StepResult;
import org.stepline.workflow.step.Steps;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTest {

    private static PlainStep<Object, Object> step(String id) {
        return PlainStep.of(id, StepHandler.identity());
    }

    @Test
    void shouldUseDeclarationOrderAsDefaultNext() {
        Graph graph = Graph.of(step("a"), step("b"), step("c"));

        assertThat(graph.entryId()).isEqualTo("a");
        assertThat(graph.defaultNext("a")).isEqualTo("b");
        assertThat(graph.defaultNext("b")).isEqualTo("c");
        assertThat(graph.defaultNext("c")).isNull();
        assertThat(graph.sequence()).containsExactly("a", "b", "c");
    }

    @Test
    void shouldSkipSiblingBranchTargetsAfterBranch() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("routing")
                .condition(Steps.condition("check").branchWhen(t -> "b1").build())
                .branches(Map.of("b1", step("t1"), "b2", step("t2")))
                .then(step("after"))
                .commit();
        Graph graph = workflow.graph();

        assertThat(graph.resolveDefaultNext("t1", false)).isEqualTo("after");
        assertThat(graph.resolveDefaultNext("t2", false)).isEqualTo("after");
        assertThat(graph.resolveDefaultNext("check", false)).isEqualTo("after");
    }

    @Test
    void shouldLeaveLastStepAfterConditionWithoutDefault() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("tail")
                .condition(step("check"))
                .then(step("only"))
                .commit();

        assertThat(workflow.graph().resolveDefaultNext("only", false)).isNull();
        assertThat(workflow.graph().branches("check")).containsEntry("0", "only");
    }

    @Test
    void shouldPreferBranchTargetOverResolvedNext() {
        PlainStep<Object, Object> check = Steps.condition("check")
                .branchWhen(t -> "yes")
                .next("no-target")
                .build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("precedence")
                .condition(check)
                .branches(Map.of("yes", step("yes-target")))
                .then(step("no-target"))
                .commit();

        StepVerifier.create(workflow.graph().resolveTransition(check, new StepResult("in", "in"), null))
                .assertNext(transition -> {
                    assertThat(transition.branchId()).isEqualTo("yes");
                    assertThat(transition.nextStepId()).isEqualTo("yes-target");
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownBranch() {
        PlainStep<Object, Object> check = Steps.condition("check").branchWhen(t -> "missing").build();
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("unknown-branch")
                .condition(check)
                .then(step("target"))
                .commit();

        StepVerifier.create(workflow.graph().resolveTransition(check, new StepResult(1, 1), null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(BranchResolutionException.class)
                        .hasMessage("Unknown branch missing for step check"))
                .verify();
    }

    @Test
    void shouldRejectBranchOnStepWithoutBranches() {
        PlainStep<Object, Object> plain = Steps.condition("plain").branchWhen(t -> "x").build();
        Graph graph = Graph.of(plain);

        StepVerifier.create(graph.resolveTransition(plain, new StepResult(1, 1), null))
                .expectError(BranchResolutionException.class)
                .verify();
    }

    @Test
    void shouldRejectResolvedNextToUnknownStep() {
        PlainStep<Object, Object> jumper = Steps.condition("jumper").nextWhen(t -> "nowhere").build();
        Graph graph = Graph.of(jumper, step("somewhere"));

        StepVerifier.create(graph.resolveTransition(jumper, new StepResult(1, 1), null))
                .expectErrorMessage("Step jumper resolved next to unknown step nowhere")
                .verify();
    }

    @Test
    void shouldFallBackToDefaultWhenResolverReturnsNull() {
        PlainStep<Object, Object> maybe = Steps.condition("maybe").nextWhen(t -> null).build();
        Graph graph = Graph.of(maybe, step("next"));

        StepVerifier.create(graph.resolveTransition(maybe, new StepResult(1, 1), null))
                .assertNext(transition -> {
                    assertThat(transition.branchId()).isNull();
                    assertThat(transition.nextStepId()).isEqualTo("next");
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectEmptyGraph() {
        assertThatThrownBy(() -> Graph.of())
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessage("Cannot commit a workflow without steps");
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> Graph.of(step("a"), step("a")))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessage("Duplicate workflow step id a");
    }

    @Test
    void shouldRejectUnknownStaticNext() {
        PlainStep<Object, Object> broken = Steps.condition("broken").next("ghost").build();

        assertThatThrownBy(() -> Graph.of(broken))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessage("Step broken references unknown next step ghost");
    }

    @Test
    void shouldRejectStaticCycles() {
        PlainStep<Object, Object> back = Steps.condition("b").next("a").build();

        assertThatThrownBy(() -> Graph.of(step("a"), back))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageStartingWith("Cycle detected involving step");
    }

    @Test
    void shouldDescribeNodesAndEdges() {
        Workflow<Object, Object> workflow = WorkflowBuilder.<Object, Object>builder("inspect")
                .then(step("start"))
                .condition(step("check"))
                .branches(Map.of("left", step("left-step")))
                .concurrent("fan", group -> group
                        .branch("one", branch -> branch.then(step("one-a")))
                        .branch("two", branch -> branch.then(step("two-a"))))
                .commit();

        GraphInspection inspection = workflow.inspect();

        assertThat(inspection.entryId()).isEqualTo("start");
        assertThat(inspection.nodes()).extracting(GraphInspection.Node::id)
                .containsExactly("start", "check", "left-step", "fan", "one-a", "two-a");
        assertThat(inspection.nodes()).filteredOn(node -> node.id().equals("check"))
                .extracting(GraphInspection.Node::type).containsExactly("condition");
        assertThat(inspection.nodes()).filteredOn(node -> node.id().equals("two-a"))
                .first()
                .satisfies(node -> {
                    assertThat(node.parallelGroupId()).isEqualTo("fan");
                    assertThat(node.parallelBranchId()).isEqualTo("two");
                });
        assertThat(inspection.edges()).contains(
                new GraphInspection.Edge("start", "check", "sequence", null),
                new GraphInspection.Edge("check", "left-step", "branch", "left"),
                new GraphInspection.Edge("check", "fan", "sequence", null),
                new GraphInspection.Edge("left-step", "fan", "sequence", null),
                new GraphInspection.Edge("fan", "one-a", "parallel", "one"),
                new GraphInspection.Edge("fan", "two-a", "parallel", "two"));
    }

    @Test
    void shouldExposeStepLookup() {
        Graph graph = Graph.of(step("a"));

        assertThat(graph.step("a")).isPresent();
        assertThat(graph.step("b")).isEmpty();
        assertThat(graph.contains("a")).isTrue();
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void shouldRejectTransitionOnUnknownStepIdGracefully() {
        PlainStep<Object, Object> jumper = Steps.condition("jumper").nextWhen(t -> "void").build();

        StepVerifier.create(Graph.of(jumper).resolveTransition(jumper, new StepResult(null, null), null))
                .expectError(WorkflowExecutionException.class)
                .verify();
    }
}
