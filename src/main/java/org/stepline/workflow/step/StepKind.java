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
 * Execution variant of a step. The run dispatches on this tag.
 */
public enum StepKind {

    /**
     * Validates input, invokes a handler, validates output.
     */
    PLAIN,

    /**
     * Suspends the run until a human response is supplied.
     */
    HUMAN,

    /**
     * Fans out to named children or sub-graphs and joins their outputs.
     */
    CONCURRENT,

    /**
     * Repeats a body step while a condition holds, up to a bound.
     */
    LOOP
}
