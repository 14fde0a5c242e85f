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

import org.stepline.workflow.exception.SchemaValidationException;

/**
 * Applies an optional {@link Schema} to a value.
 */
public final class SchemaValidation {

    private SchemaValidation() {
    }

    /**
     * Validates {@code value} with {@code schema}; a {@code null} schema accepts the value as is.
     *
     * @param context what is being validated, used in the error message
     * @throws SchemaValidationException when the schema rejects the value
     */
    @SuppressWarnings("unchecked")
    public static <T> T validate(Schema<T> schema, Object value, String context) {
        if (schema == null) {
            return (T) value;
        }
        SchemaResult<T> result = schema.safeParse(value);
        if (result == null) {
            throw new SchemaValidationException(context,
                    new IllegalStateException("Schema returned no result"));
        }
        if (!result.success()) {
            throw new SchemaValidationException(context, result.error());
        }
        return result.data();
    }
}
