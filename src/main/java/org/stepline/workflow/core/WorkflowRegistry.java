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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the committed workflows an application exposes, keyed by workflow id.
 */
@Slf4j
public class WorkflowRegistry {

    private final Map<String, Workflow<?, ?>> workflows = new ConcurrentHashMap<>();

    public void register(Workflow<?, ?> workflow) {
        String id = workflow.id();
        if (workflows.containsKey(id)) {
            log.info("Replacing registered workflow: id={}", id);
        }
        workflows.put(id, workflow);
        log.info("Registered workflow: id={}, steps={}, entryStepId={}",
                id, workflow.graph().size(), workflow.graph().entryId());
    }

    public boolean unregister(String workflowId) {
        Workflow<?, ?> removed = workflows.remove(workflowId);
        if (removed != null) {
            log.info("Unregistered workflow: {}", workflowId);
            return true;
        }
        return false;
    }

    public Optional<Workflow<?, ?>> get(String workflowId) {
        return Optional.ofNullable(workflowId != null ? workflows.get(workflowId) : null);
    }

    public Collection<Workflow<?, ?>> getAll() {
        return Collections.unmodifiableCollection(workflows.values());
    }

    public Set<String> getWorkflowIds() {
        return Collections.unmodifiableSet(workflows.keySet());
    }

    public boolean contains(String workflowId) {
        return workflows.containsKey(workflowId);
    }

    public int size() {
        return workflows.size();
    }
}
