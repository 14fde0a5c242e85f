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

package org.stepline.workflow.human;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * One input requested from a human.
 *
 * @param id the field id, used as the key in the response
 * @param label the label shown to the human
 * @param type the field type
 * @param required whether a value is mandatory
 * @param placeholder placeholder text for text fields
 * @param options allowed values for select fields
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HumanFormField(
        String id,
        String label,
        FieldType type,
        boolean required,
        String placeholder,
        List<String> options
) {

    public HumanFormField {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        options = options != null ? List.copyOf(options) : null;
    }

    public static HumanFormField text(String id, String label, boolean required, String placeholder) {
        return new HumanFormField(id, label, FieldType.TEXT, required, placeholder, null);
    }

    public static HumanFormField text(String id, String label) {
        return text(id, label, false, null);
    }

    public static HumanFormField select(String id, String label, List<String> options, boolean required) {
        return new HumanFormField(id, label, FieldType.SELECT, required, null, options);
    }

    /**
     * Supported field types.
     */
    public enum FieldType {
        TEXT("text"),
        SELECT("select");

        private final String value;

        FieldType(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
