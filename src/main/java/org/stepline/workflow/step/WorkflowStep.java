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

package org.stepline.workflow.step;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Unit of work in a workflow graph.
 * <p>
 * Every step exposes the same three operations; behaviour specific to a variant is
 * selected by {@link #kind()}.
 *
 * @param <I> the validated input type
 * @param <O> the validated output type
 */
public interface WorkflowStep<I, O> {

    String id();

    String description();

    StepKind kind();

    /**
     * Validates the input, runs the step logic and validates the output.
     */
    Mono<StepResult> execute(StepInvocation invocation);

    /**
     * Resolves the explicit next step; empty defers to the graph's default-next.
     */
    Mono<String> resolveNext(Transition<?, ?> transition);

    /**
     * Resolves the branch taken by this step; empty means this is not a conditional outcome.
     */
    Mono<String> resolveBranch(Transition<?, ?> transition);

    /**
     * Returns the literal next step id, when one is declared.
     */
    Optional<String> staticNext();
}
