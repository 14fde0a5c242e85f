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

import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonSchemaTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void shouldConvertMapToRecord() {
        JacksonSchema<OrderLine> schema = JacksonSchema.of(OrderLine.class);

        OrderLine line = schema.parse(Map.of("sku", "A-1", "quantity", 2));

        assertThat(line).isEqualTo(new OrderLine("A-1", 2));
    }

    @Test
    void shouldReturnInstancesOfTargetTypeUnchanged() {
        OrderLine line = new OrderLine("A-1", 1);

        assertThat(JacksonSchema.of(OrderLine.class).parse(line)).isSameAs(line);
    }

    @Test
    void shouldRejectNull() {
        assertThatThrownBy(() -> JacksonSchema.of(OrderLine.class).parse(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("OrderLine");
    }

    @Test
    void shouldReportConstraintViolations() {
        JacksonSchema<OrderLine> schema = JacksonSchema.validated(OrderLine.class, new ObjectMapper(), validator);

        assertThatThrownBy(() -> schema.parse(Map.of("sku", "", "quantity", 0)))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("quantity")
                .hasMessageContaining("sku");
    }

    @Test
    void shouldFailSafeParseWithoutThrowing() {
        SchemaResult<OrderLine> result = JacksonSchema.of(OrderLine.class).safeParse(Map.of("quantity", "many"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isNotNull();
    }

    record OrderLine(@NotBlank String sku, @Min(1) int quantity) {
    }
}
