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

package org.stepline.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a recorded step attempt.
 */
public enum StepStatus {

    /**
     * The step produced an output.
     */
    SUCCESS("success"),

    /**
     * The step, its validation or its transition failed.
     */
    FAILED("failed"),

    /**
     * The step is a human step awaiting a response.
     */
    WAITING_HUMAN("waiting_human");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
