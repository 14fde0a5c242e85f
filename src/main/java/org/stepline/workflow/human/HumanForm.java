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

import java.util.ArrayList;
import java.util.List;

/**
 * Form describing what a human step asks for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HumanForm(String title, String description, List<HumanFormField> fields) {

    public HumanForm {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static HumanForm of(String title, HumanFormField... fields) {
        return new HumanForm(title, null, List.of(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link HumanForm}.
     */
    public static class Builder {
        private String title;
        private String description;
        private final List<HumanFormField> fields = new ArrayList<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder text(String id, String label, boolean required, String placeholder) {
            fields.add(HumanFormField.text(id, label, required, placeholder));
            return this;
        }

        public Builder select(String id, String label, List<String> options, boolean required) {
            fields.add(HumanFormField.select(id, label, options, required));
            return this;
        }

        public Builder field(HumanFormField field) {
            fields.add(field);
            return this;
        }

        public HumanForm build() {
            return new HumanForm(title, description, fields);
        }
    }
}
