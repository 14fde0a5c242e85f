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

package org.stepline.workflow.schema;

import org.junit.jupiter.api.Test;
import org.stepline.workflow.exception.SchemaValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaValidationTest {

    private final Schema<String> nonBlank = value -> {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("expected a non-blank string");
        }
        return text.trim();
    };

    @Test
    void shouldPassValueThroughWithoutSchema() {
        Object value = new Object();

        assertThat(SchemaValidation.<Object>validate(null, value, "step a input")).isSameAs(value);
    }

    @Test
    void shouldReturnParsedValue() {
        assertThat(SchemaValidation.validate(nonBlank, "  hello ", "step a input")).isEqualTo("hello");
    }

    @Test
    void shouldWrapRejectionWithContext() {
        assertThatThrownBy(() -> SchemaValidation.validate(nonBlank, 42, "step a input"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("Schema validation failed for step a input: expected a non-blank string")
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .satisfies(error -> assertThat(((SchemaValidationException) error).getContext())
                        .isEqualTo("step a input"));
    }

    @Test
    void shouldHonourResultBasedSchemas() {
        Schema<Integer> positive = Schema.fromResult(value -> value instanceof Integer number && number > 0
                ? SchemaResult.success(number)
                : SchemaResult.failure(new IllegalArgumentException("expected a positive number")));

        assertThat(positive.safeParse(3).success()).isTrue();
        assertThat(positive.safeParse(-1).error()).hasMessage("expected a positive number");
        assertThatThrownBy(() -> SchemaValidation.validate(positive, -1, "workflow w output"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("workflow w output");
    }
}
