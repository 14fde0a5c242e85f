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

import org.stepline.workflow.cancel.CancellationToken;
import org.stepline.workflow.core.Graph;
import reactor.core.publisher.Mono;

/**
 * Walks one sub-graph branch of a concurrent group.
 * <p>
 * Supplied by the run so branch steps are recorded in the run history and emit events
 * tagged with their group and branch.
 */
@FunctionalInterface
public interface BranchRunner {

    /**
     * @param groupId id of the concurrent group step
     * @param branchId name of the branch
     * @param branch the compiled branch graph
     * @param input value entering the branch entry step
     * @param cancellationToken the group's token
     * @return the branch input and the output of its last step
     */
    Mono<StepResult> run(String groupId, String branchId, Graph branch, Object input,
                         CancellationToken cancellationToken);
}
