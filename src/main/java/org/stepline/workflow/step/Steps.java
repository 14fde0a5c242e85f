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

/**
 * Entry points for the step builders.
 */
public final class Steps {

    private Steps() {
    }

    public static <I, O> PlainStep.Builder<I, O> step(String id) {
        return PlainStep.builder(id);
    }

    /**
     * A plain step that passes its input through; pair with {@code branch(...)} to route.
     */
    public static <I> PlainStep.Builder<I, I> condition(String id) {
        return PlainStep.<I, I>builder(id).handler(StepHandler.identity());
    }

    public static <I, O> HumanStep.Builder<I, O> human(String id) {
        return HumanStep.builder(id);
    }

    public static <I, O> IterativeLoopStep.Builder<I, O> loop(String id) {
        return IterativeLoopStep.builder(id);
    }

    public static <I, O> ConcurrentGroupStep.Builder<I, O> concurrent(String id) {
        return ConcurrentGroupStep.builder(id);
    }

    public static <I, T, O> ForEachStep.Builder<I, T, O> forEach(String id) {
        return ForEachStep.builder(id);
    }
}
