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

/**
 * Outcome of {@link Schema#safeParse(Object)}.
 *
 * @param success whether the value was accepted
 * @param data the validated value when accepted
 * @param error the rejection cause otherwise
 * @param <T> the validated type
 */
public record SchemaResult<T>(boolean success, T data, Throwable error) {

    public static <T> SchemaResult<T> success(T data) {
        return new SchemaResult<>(true, data, null);
    }

    public static <T> SchemaResult<T> failure(Throwable error) {
        return new SchemaResult<>(false, null, error);
    }
}
