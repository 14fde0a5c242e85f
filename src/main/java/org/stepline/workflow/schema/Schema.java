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

import java.util.function.Function;

/**
 * Validate-or-reject contract consumed by steps and workflows.
 * <p>
 * Implementations convert a raw value into {@code T} or reject it. The engine always
 * calls {@link #safeParse(Object)}; the default implementation delegates to
 * {@link #parse(Object)} and captures any runtime exception as a failed result.
 *
 * @param <T> the validated type
 */
@FunctionalInterface
public interface Schema<T> {

    /**
     * Parses the value, throwing on rejection.
     */
    T parse(Object value);

    /**
     * Parses the value without throwing.
     */
    default SchemaResult<T> safeParse(Object value) {
        try {
            return SchemaResult.success(parse(value));
        } catch (RuntimeException e) {
            return SchemaResult.failure(e);
        }
    }

    /**
     * Adapts a non-throwing validator.
     */
    static <T> Schema<T> fromResult(Function<Object, SchemaResult<T>> validator) {
        return new Schema<>() {
            @Override
            public T parse(Object value) {
                SchemaResult<T> result = validator.apply(value);
                if (result.success()) {
                    return result.data();
                }
                Throwable error = result.error();
                if (error instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalArgumentException(error != null ? error.getMessage() : "value rejected", error);
            }

            @Override
            public SchemaResult<T> safeParse(Object value) {
                return validator.apply(value);
            }
        };
    }
}
