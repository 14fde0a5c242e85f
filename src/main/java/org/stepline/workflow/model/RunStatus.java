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
 * Outcome of a workflow run (or of one start/resume leg of it).
 */
public enum RunStatus {

    /**
     * The run reached the end of the graph and its output passed validation.
     */
    SUCCESS("success"),

    /**
     * A step, a transition or output validation failed.
     */
    FAILED("failed"),

    /**
     * The run observed cancellation.
     */
    CANCELLED("cancelled"),

    /**
     * The run is suspended on a human step and may be resumed.
     */
    WAITING_HUMAN("waiting_human");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Checks whether no further progress is possible.
     *
     * @return true for success, failed and cancelled
     */
    public boolean isTerminal() {
        return this != WAITING_HUMAN;
    }
}
