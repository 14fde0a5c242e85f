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

import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.step.ConcurrentGroupStep;
import org.stepline.workflow.step.StepKind;
import org.stepline.workflow.step.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable step declaration collected by the builders and compiled into a {@link Graph}.
 * Step ids are checked against a set shared with every declaration of the same workflow.
 */
final class GraphDeclaration {

    private final String name;
    private final boolean concurrentBranch;
    private final Set<String> usedIds;
    private final List<WorkflowStep<?, ?>> sequence = new ArrayList<>();
    private final Map<String, Map<String, String>> branchLookup = new LinkedHashMap<>();
    private final Set<String> conditionSteps = new LinkedHashSet<>();

    GraphDeclaration(String name, boolean concurrentBranch, Set<String> usedIds) {
        this.name = name;
        this.concurrentBranch = concurrentBranch;
        this.usedIds = usedIds;
    }

    String name() {
        return name;
    }

    Set<String> usedIds() {
        return usedIds;
    }

    boolean isEmpty() {
        return sequence.isEmpty();
    }

    void append(WorkflowStep<?, ?> step) {
        if (step == null) {
            throw new WorkflowValidationException("Cannot add a null step to " + name);
        }
        if (concurrentBranch) {
            if (step.kind() == StepKind.HUMAN) {
                throw new WorkflowValidationException(
                        "Human step " + step.id() + " cannot run inside concurrent branch " + name);
            }
            if (step instanceof ConcurrentGroupStep<?, ?> group && !group.branchGraphs().isEmpty()) {
                throw new WorkflowValidationException(
                        "Nested concurrent groups are not supported: " + step.id() + " in " + name);
            }
        }
        if (!usedIds.add(step.id())) {
            throw new WorkflowValidationException("Duplicate workflow step id " + step.id());
        }
        if (step instanceof ConcurrentGroupStep<?, ?> group) {
            group.branchGraphs().values().forEach(branch -> branch.steps().keySet().forEach(memberId -> {
                if (!usedIds.add(memberId)) {
                    throw new WorkflowValidationException("Duplicate workflow step id " + memberId
                            + " detected in concurrent step " + group.id());
                }
            }));
        }
        sequence.add(step);
    }

    void appendCondition(WorkflowStep<?, ?> step) {
        append(step);
        conditionSteps.add(step.id());
    }

    void registerBranches(String conditionId, Map<String, WorkflowStep<?, ?>> branches) {
        if (branchLookup.containsKey(conditionId)) {
            throw new WorkflowValidationException("Condition step " + conditionId + " already has branches registered");
        }
        if (branches == null || branches.isEmpty()) {
            throw new WorkflowValidationException("Condition step " + conditionId + " requires at least one branch step");
        }
        Map<String, String> targets = new LinkedHashMap<>();
        branches.forEach((branchId, step) -> {
            append(step);
            targets.put(branchId, step.id());
        });
        branchLookup.put(conditionId, targets);
    }

    Graph compile() {
        return Graph.compile(name, sequence, branchLookup, conditionSteps);
    }
}
