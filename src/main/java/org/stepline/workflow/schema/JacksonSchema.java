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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link Schema} backed by Jackson conversion and, optionally, Jakarta Bean Validation.
 * <p>
 * Values already of the target type are used as is; anything else (typically maps
 * decoded from JSON) is converted with {@link ObjectMapper#convertValue(Object, Class)}.
 * When a {@link Validator} is supplied, constraint violations reject the value.
 *
 * @param <T> the target type
 */
public final class JacksonSchema<T> implements Schema<T> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    private JacksonSchema(Class<T> type, ObjectMapper objectMapper, Validator validator) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.validator = validator;
    }

    public static <T> JacksonSchema<T> of(Class<T> type) {
        return new JacksonSchema<>(type, DEFAULT_MAPPER, null);
    }

    public static <T> JacksonSchema<T> of(Class<T> type, ObjectMapper objectMapper) {
        return new JacksonSchema<>(type, objectMapper, null);
    }

    public static <T> JacksonSchema<T> validated(Class<T> type, ObjectMapper objectMapper, Validator validator) {
        return new JacksonSchema<>(type, objectMapper, Objects.requireNonNull(validator, "validator cannot be null"));
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public T parse(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but received null");
        }
        T converted = type.isInstance(value) ? type.cast(value) : objectMapper.convertValue(value, type);
        if (validator != null) {
            Set<ConstraintViolation<T>> violations = validator.validate(converted);
            if (!violations.isEmpty()) {
                throw new ConstraintViolationException(describe(violations), violations);
            }
        }
        return converted;
    }

    private String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining(", "));
    }
}
