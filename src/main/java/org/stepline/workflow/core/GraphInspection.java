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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Serializable view of a compiled {@link Graph}, including the steps of concurrent
 * sub-graph branches.
 */
public record GraphInspection(String entryId, List<Node> nodes, List<Edge> edges) {

    public GraphInspection {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(String id, String type, String kind, String description, String parallelGroupId,
                       String parallelBranchId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Edge(String from, String to, String kind, String branchId) {

        static Edge sequence(String from, String to) {
            return new Edge(from, to, "sequence", null);
        }

        static Edge branch(String from, String to, String branchId) {
            return new Edge(from, to, "branch", branchId);
        }

        static Edge parallel(String from, String to, String branchId) {
            return new Edge(from, to, "parallel", branchId);
        }
    }
}
