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

import java.util.function.Function;

/**
 * Host-supplied step logic.
 * <p>
 * An empty {@link Mono} produces a {@code null} output.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@FunctionalInterface
public interface StepHandler<I, O> {

    Mono<O> handle(StepArgs<I> args);

    /**
     * Adapts synchronous logic; exceptions become error signals.
     */
    static <I, O> StepHandler<I, O> sync(Function<StepArgs<I>, O> function) {
        return args -> Mono.fromCallable(() -> function.apply(args));
    }

    /**
     * Returns a handler passing its input through.
     */
    @SuppressWarnings("unchecked")
    static <I, O> StepHandler<I, O> identity() {
        return args -> Mono.justOrEmpty((O) args.input());
    }
}
