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

package org.stepline.workflow.service;

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.core.WorkflowRun;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory index of hosted runs, addressable by workflow id and run id.
 * <p>
 * Holds at most {@code maxRetained} runs; registering beyond the limit evicts the oldest run.
 */
@Slf4j
public class WorkflowRunRegistry {

    private final int maxRetained;
    private final Map<String, WorkflowRun<?, ?>> runs = new LinkedHashMap<>();

    public WorkflowRunRegistry(int maxRetained) {
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be positive");
        }
        this.maxRetained = maxRetained;
    }

    public synchronized void store(WorkflowRun<?, ?> run) {
        runs.put(key(run.workflowId(), run.runId()), run);
        Iterator<Map.Entry<String, WorkflowRun<?, ?>>> iterator = runs.entrySet().iterator();
        while (runs.size() > maxRetained && iterator.hasNext()) {
            Map.Entry<String, WorkflowRun<?, ?>> eldest = iterator.next();
            iterator.remove();
            log.warn("Evicted workflow run from registry: key={}, status={}",
                    eldest.getKey(), eldest.getValue().status());
        }
    }

    public synchronized Optional<WorkflowRun<?, ?>> get(String workflowId, String runId) {
        return Optional.ofNullable(runs.get(key(workflowId, runId)));
    }

    public synchronized boolean remove(String workflowId, String runId) {
        return runs.remove(key(workflowId, runId)) != null;
    }

    public synchronized int size() {
        return runs.size();
    }

    private static String key(String workflowId, String runId) {
        return workflowId + ":" + runId;
    }
}
