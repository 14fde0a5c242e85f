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

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.exception.BranchResolutionException;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.step.ConcurrentGroupStep;
import org.stepline.workflow.step.StepKind;
import org.stepline.workflow.step.StepResult;
import org.stepline.workflow.step.Transition;
import org.stepline.workflow.step.WorkflowStep;
import org.stepline.workflow.step.WorkflowStepContext;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, immutable step graph.
 * <p>
 * Steps run in declaration order unless a step resolves a branch or a next step. Branch
 * targets of a condition are laid out right after it; once a branch member completes
 * without an explicit next, the walk continues with the first step after the condition
 * that is not one of its branch members.
 * <p>
 * Compilation rejects empty graphs, duplicate ids, conditions without branches, unknown
 * targets and cycles over the static edges.
 */
@Slf4j
public final class Graph {

    private final String name;
    private final Map<String, WorkflowStep<?, ?>> steps;
    private final List<String> sequence;
    private final Map<String, Map<String, String>> branchLookup;
    private final Set<String> conditionSteps;
    private final String entryId;
    private final Map<String, Integer> positions;
    private final Map<String, String> branchOwners;
    private final Map<String, Set<String>> branchMembers;

    private Graph(String name, Map<String, WorkflowStep<?, ?>> steps, List<String> sequence,
                  Map<String, Map<String, String>> branchLookup, Set<String> conditionSteps) {
        this.name = name;
        this.steps = Collections.unmodifiableMap(steps);
        this.sequence = List.copyOf(sequence);
        Map<String, Map<String, String>> lookup = new LinkedHashMap<>();
        branchLookup.forEach((conditionId, branches) ->
                lookup.put(conditionId, Collections.unmodifiableMap(new LinkedHashMap<>(branches))));
        this.branchLookup = Collections.unmodifiableMap(lookup);
        this.conditionSteps = Collections.unmodifiableSet(new LinkedHashSet<>(conditionSteps));
        this.entryId = sequence.get(0);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < sequence.size(); i++) {
            index.put(sequence.get(i), i);
        }
        this.positions = Collections.unmodifiableMap(index);

        Map<String, String> owners = new HashMap<>();
        Map<String, Set<String>> members = new HashMap<>();
        this.branchLookup.forEach((conditionId, branches) -> {
            members.put(conditionId, Set.copyOf(branches.values()));
            branches.values().forEach(target -> owners.putIfAbsent(target, conditionId));
        });
        this.branchOwners = Collections.unmodifiableMap(owners);
        this.branchMembers = Collections.unmodifiableMap(members);
    }

    /**
     * Compiles a linear graph, typically used as a concurrent sub-graph branch.
     */
    public static Graph of(WorkflowStep<?, ?>... steps) {
        return compile("graph", Arrays.asList(steps), Map.of(), Set.of());
    }

    /**
     * Compiles and validates a graph.
     *
     * @param name label used in log and error messages
     * @param sequence steps in declaration order
     * @param branchLookup condition id to its {@code branchId -> targetId} map
     * @param conditionSteps ids declared as conditions
     * @throws WorkflowValidationException when the declaration is invalid
     */
    static Graph compile(String name, List<WorkflowStep<?, ?>> sequence,
                         Map<String, Map<String, String>> branchLookup, Set<String> conditionSteps) {
        if (sequence == null || sequence.isEmpty()) {
            throw new WorkflowValidationException("Cannot commit a workflow without steps");
        }
        Map<String, WorkflowStep<?, ?>> steps = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        for (WorkflowStep<?, ?> step : sequence) {
            if (steps.putIfAbsent(step.id(), step) != null) {
                throw new WorkflowValidationException("Duplicate workflow step id " + step.id());
            }
            order.add(step.id());
        }

        Set<String> conditions = new LinkedHashSet<>(conditionSteps);
        conditions.addAll(branchLookup.keySet());
        for (String conditionId : conditions) {
            if (!steps.containsKey(conditionId)) {
                throw new WorkflowValidationException("Unknown condition step " + conditionId);
            }
            Map<String, String> branches = branchLookup.get(conditionId);
            if (branches == null || branches.isEmpty()) {
                throw new WorkflowValidationException(
                        "Condition step " + conditionId + " is missing branch declarations");
            }
            for (String target : branches.values()) {
                if (!steps.containsKey(target)) {
                    throw new WorkflowValidationException(
                            "Condition step " + conditionId + " references unknown branch target " + target);
                }
            }
        }

        for (WorkflowStep<?, ?> step : sequence) {
            Optional<String> staticNext = step.staticNext();
            if (staticNext.isPresent() && !steps.containsKey(staticNext.get())) {
                throw new WorkflowValidationException(
                        "Step " + step.id() + " references unknown next step " + staticNext.get());
            }
        }

        Graph graph = new Graph(name, steps, order, branchLookup, conditions);
        graph.validateConcurrentBranches();
        graph.validateNoCycles();
        log.debug("Compiled graph '{}': {} steps, {} conditions", name, order.size(), conditions.size());
        return graph;
    }

    private void validateConcurrentBranches() {
        Set<String> seen = new HashSet<>(steps.keySet());
        for (WorkflowStep<?, ?> step : steps.values()) {
            if (!(step instanceof ConcurrentGroupStep<?, ?> group)) {
                continue;
            }
            group.branchGraphs().forEach((branchId, branch) -> {
                for (WorkflowStep<?, ?> member : branch.steps().values()) {
                    if (member.kind() == StepKind.HUMAN) {
                        throw new WorkflowValidationException("Human step " + member.id()
                                + " cannot run inside concurrent branch " + branchId + " of " + group.id());
                    }
                    if (member instanceof ConcurrentGroupStep<?, ?> nested && !nested.branchGraphs().isEmpty()) {
                        throw new WorkflowValidationException("Nested concurrent groups are not supported: "
                                + member.id() + " in branch " + branchId + " of " + group.id());
                    }
                    if (!seen.add(member.id())) {
                        throw new WorkflowValidationException("Duplicate workflow step id " + member.id()
                                + " detected in concurrent branch " + branchId + " of " + group.id());
                    }
                }
            });
        }
    }

    private void validateNoCycles() {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (int i = 0; i < sequence.size(); i++) {
            Set<String> targets = adjacency.computeIfAbsent(sequence.get(i), id -> new LinkedHashSet<>());
            if (i + 1 < sequence.size()) {
                targets.add(sequence.get(i + 1));
            }
        }
        branchLookup.forEach((conditionId, branches) -> adjacency.get(conditionId).addAll(branches.values()));
        steps.values().forEach(step -> step.staticNext().ifPresent(next -> adjacency.get(step.id()).add(next)));

        Set<String> visited = new HashSet<>();
        Set<String> stack = new HashSet<>();
        for (String stepId : adjacency.keySet()) {
            String cyclic = findCycle(stepId, adjacency, visited, stack, new ArrayList<>());
            if (cyclic != null) {
                throw new WorkflowValidationException("Cycle detected involving step " + cyclic);
            }
        }
    }

    private String findCycle(String stepId, Map<String, Set<String>> adjacency, Set<String> visited,
                             Set<String> stack, List<String> path) {
        if (stack.contains(stepId)) {
            path.add(stepId);
            log.error("Cycle detected in graph '{}': {}", name, String.join(" -> ", path));
            return stepId;
        }
        if (visited.contains(stepId)) {
            return null;
        }
        stack.add(stepId);
        path.add(stepId);
        for (String next : adjacency.getOrDefault(stepId, Set.of())) {
            String cyclic = findCycle(next, adjacency, visited, stack, new ArrayList<>(path));
            if (cyclic != null) {
                return cyclic;
            }
        }
        stack.remove(stepId);
        visited.add(stepId);
        return null;
    }

    public String entryId() {
        return entryId;
    }

    public Map<String, WorkflowStep<?, ?>> steps() {
        return steps;
    }

    public List<String> sequence() {
        return sequence;
    }

    public Set<String> conditionSteps() {
        return conditionSteps;
    }

    public Map<String, String> branches(String conditionId) {
        return branchLookup.getOrDefault(conditionId, Map.of());
    }

    public Optional<WorkflowStep<?, ?>> step(String stepId) {
        return Optional.ofNullable(stepId != null ? steps.get(stepId) : null);
    }

    public boolean contains(String stepId) {
        return stepId != null && steps.containsKey(stepId);
    }

    public int size() {
        return steps.size();
    }

    /**
     * Next step in declaration order, or {@code null} for the last step.
     */
    public String defaultNext(String stepId) {
        Integer position = positions.get(stepId);
        if (position == null || position + 1 >= sequence.size()) {
            return null;
        }
        return sequence.get(position + 1);
    }

    /**
     * Next step when neither a branch target nor a resolved next applies.
     *
     * @param stepId the completed step
     * @param branchResolved whether the step resolved a branch
     */
    public String resolveDefaultNext(String stepId, boolean branchResolved) {
        if (!branchResolved && conditionSteps.contains(stepId)) {
            return afterCondition(stepId);
        }
        String owner = branchOwners.get(stepId);
        if (owner != null) {
            return afterCondition(owner);
        }
        return defaultNext(stepId);
    }

    private String afterCondition(String conditionId) {
        Integer position = positions.get(conditionId);
        Set<String> members = branchMembers.getOrDefault(conditionId, Set.of());
        for (int i = position + 1; i < sequence.size(); i++) {
            String candidate = sequence.get(i);
            if (!members.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Resolves branch and next step for a completed step: the branch target wins over a
     * resolved next, which wins over the default next.
     */
    public Mono<StepTransition> resolveTransition(WorkflowStep<?, ?> step, StepResult result,
                                                  WorkflowStepContext context) {
        Transition<Object, Object> transition = new Transition<>(result.input(), result.output(), context);
        return step.resolveBranch(transition)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(branch -> {
                    String branchId = branch.orElse(null);
                    String branchTarget = null;
                    if (branchId != null) {
                        Map<String, String> lookup = branchLookup.get(step.id());
                        if (lookup == null || lookup.isEmpty()) {
                            return Mono.error(new BranchResolutionException(step.id(),
                                    "No branches configured for step " + step.id()));
                        }
                        branchTarget = lookup.get(branchId);
                        if (branchTarget == null) {
                            return Mono.error(new BranchResolutionException(step.id(),
                                    "Unknown branch " + branchId + " for step " + step.id()));
                        }
                    }
                    String target = branchTarget;
                    return step.resolveNext(transition)
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .flatMap(next -> {
                                String resolved = next.orElse(null);
                                if (resolved != null && !steps.containsKey(resolved)) {
                                    return Mono.error(new WorkflowExecutionException(
                                            "Step " + step.id() + " resolved next to unknown step " + resolved));
                                }
                                String nextStepId = target != null ? target
                                        : resolved != null ? resolved
                                        : resolveDefaultNext(step.id(), branchId != null);
                                return Mono.just(new StepTransition(branchId, nextStepId));
                            });
                });
    }

    /**
     * Describes nodes and edges of this graph and of its concurrent sub-graphs.
     */
    public GraphInspection inspect() {
        List<GraphInspection.Node> nodes = new ArrayList<>();
        List<GraphInspection.Edge> edges = new ArrayList<>();
        describe(null, null, nodes, edges);
        return new GraphInspection(entryId, nodes, edges);
    }

    private void describe(String groupId, String branchId, List<GraphInspection.Node> nodes,
                          List<GraphInspection.Edge> edges) {
        for (String stepId : sequence) {
            WorkflowStep<?, ?> step = steps.get(stepId);
            boolean condition = conditionSteps.contains(stepId);
            nodes.add(new GraphInspection.Node(stepId, condition ? "condition" : "step",
                    step.kind().name().toLowerCase(), step.description(), groupId, branchId));

            if (condition) {
                branches(stepId).forEach((id, target) -> edges.add(GraphInspection.Edge.branch(stepId, target, id)));
                String after = afterCondition(stepId);
                if (after != null) {
                    edges.add(GraphInspection.Edge.sequence(stepId, after));
                }
            } else {
                String next = step.staticNext().orElseGet(() -> resolveDefaultNext(stepId, false));
                if (next != null) {
                    edges.add(GraphInspection.Edge.sequence(stepId, next));
                }
            }

            if (step instanceof ConcurrentGroupStep<?, ?> group) {
                group.branchGraphs().forEach((name, branch) -> {
                    edges.add(GraphInspection.Edge.parallel(stepId, branch.entryId(), name));
                    branch.describe(stepId, name, nodes, edges);
                });
            }
        }
    }

    @Override
    public String toString() {
        return "Graph[" + name + ", steps=" + sequence + "]";
    }
}
