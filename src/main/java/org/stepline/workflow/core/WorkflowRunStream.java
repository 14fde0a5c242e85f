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

import org.stepline.workflow.event.WorkflowEvent;
import org.stepline.workflow.model.WorkflowRunResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Live view of a started run.
 * <p>
 * Subscribing to {@code events} starts the run if nothing subscribed to {@code result} yet.
 * The event flux completes once the run reaches success, failed or cancelled; a run that
 * suspends for human input keeps it open until a later resume settles the run.
 *
 * @param events the run's events, buffered until consumed
 * @param result the outcome of the start call
 */
public record WorkflowRunStream<O>(Flux<WorkflowEvent> events, Mono<WorkflowRunResult<O>> result) {
}
