/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowsmith.workflow.generator;

import java.util.UUID;

/**
 * Produces node identifiers for a generated workflow. The generator passes the one-based ordinal
 * of each node in emission order; implementations must return a distinct id per ordinal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@FunctionalInterface
public interface NodeIdGenerator {

    String nextId(int ordinal);

    /**
     * Ids of the form {@code node-<n>-<8 hex chars>}, unique across runs.
     */
    static NodeIdGenerator randomSuffix() {
        return ordinal -> "node-" + ordinal + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Ids of the form {@code node-<n>}, identical across runs.
     */
    static NodeIdGenerator sequential() {
        return ordinal -> "node-" + ordinal;
    }
}
