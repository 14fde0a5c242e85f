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

package org.stepline.workflow.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when one or more branches of a concurrent group fail.
 * <p>
 * With the fail-fast strategy {@link #getFailures()} holds the single branch that
 * tripped the group; with wait-all it holds every failed branch in declaration order.
 */
public class ConcurrentGroupException extends WorkflowExecutionException {

    private final String stepId;
    private final Map<String, Throwable> failures;

    public ConcurrentGroupException(String message, String stepId, Map<String, Throwable> failures) {
        super(message, failures.isEmpty() ? null : failures.values().iterator().next());
        this.stepId = stepId;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public String getStepId() {
        return stepId;
    }

    public Map<String, Throwable> getFailures() {
        return failures;
    }
}
