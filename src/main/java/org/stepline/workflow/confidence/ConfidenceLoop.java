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

package org.stepline.workflow.confidence;

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.exception.WorkflowExecutionException;
import org.stepline.workflow.exception.WorkflowValidationException;
import org.stepline.workflow.step.IterativeLoopStep;
import org.stepline.workflow.step.PlainStep;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link IterativeLoopStep} that asks a {@link ConfidenceModel} for answers until
 * one reaches the confidence threshold or the attempts run out.
 * <p>
 * Running out of attempts is not an error: the outcome carries the best answer with
 * {@code thresholdMet = false}.
 */
@Slf4j
public final class ConfidenceLoop {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private ConfidenceLoop() {
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for confidence loops.
     */
    public static final class Builder {
        private final String id;
        private String description;
        private ConfidenceModel model;
        private double threshold = DEFAULT_THRESHOLD;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder model(ConfidenceModel model) {
            this.model = model;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public IterativeLoopStep<Object, ConfidenceOutcome> build() {
            Objects.requireNonNull(model, "model cannot be null for confidence loop " + id);
            if (threshold < 0 || threshold > 1) {
                throw new WorkflowValidationException(
                        "Confidence loop " + id + " requires a threshold between 0 and 1");
            }
            ConfidenceModel confidenceModel = model;
            double target = threshold;
            int attempts = maxAttempts;

            PlainStep<ConfidencePrompt, ConfidenceAnswer> attempt = PlainStep.<ConfidencePrompt, ConfidenceAnswer>builder(id + ":attempt")
                    .handler(args -> Mono.defer(() -> confidenceModel.generate(args.input()))
                            .switchIfEmpty(Mono.error(() -> new WorkflowExecutionException(
                                    "Confidence model returned no answer for " + id)))
                            .flatMap(this::checked)
                            .doOnNext(answer -> log.debug("Confidence answer: stepId={}, attempt={}, confidence={}",
                                    id, args.input().attempt(), answer.confidence())))
                    .build();

            return IterativeLoopStep.<Object, ConfidenceOutcome>builder(id)
                    .description(description)
                    .body(attempt)
                    .maxIterations(attempts)
                    .condition(state -> state.iteration() < attempts
                            && (state.iteration() == 0
                            || ((ConfidenceAnswer) state.lastOutput()).confidence() < target))
                    .nextInput(state -> new ConfidencePrompt(state.input(), state.iteration() + 1,
                            (ConfidenceAnswer) state.lastOutput()))
                    .collect(summary -> outcome(summary.results(), target))
                    .build();
        }

        private Mono<ConfidenceAnswer> checked(ConfidenceAnswer answer) {
            if (answer.confidence() < 0 || answer.confidence() > 1 || Double.isNaN(answer.confidence())) {
                return Mono.error(new WorkflowExecutionException("Confidence model returned confidence "
                        + answer.confidence() + " outside [0, 1] for " + id));
            }
            return Mono.just(answer);
        }

        private static ConfidenceOutcome outcome(List<Object> results, double threshold) {
            List<ConfidenceAnswer> answers = new ArrayList<>();
            results.forEach(result -> answers.add((ConfidenceAnswer) result));
            ConfidenceAnswer best = null;
            for (ConfidenceAnswer answer : answers) {
                if (best == null || answer.confidence() > best.confidence()) {
                    best = answer;
                }
            }
            if (best == null) {
                return new ConfidenceOutcome(null, 0, 0, false, answers);
            }
            return new ConfidenceOutcome(best.text(), best.confidence(), answers.size(),
                    best.confidence() >= threshold, answers);
        }
    }
}
