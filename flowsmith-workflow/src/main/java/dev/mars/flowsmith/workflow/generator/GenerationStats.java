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

import java.util.List;

/**
 * Counters for one generation run. {@code connectionCount} counts edges, not source entries.
 */
public record GenerationStats(int nodeCount, int connectionCount, long elapsedMs, List<String> nodeTypes) {

    public GenerationStats {
        nodeTypes = List.copyOf(nodeTypes);
    }

    public static GenerationStats empty(long elapsedMs) {
        return new GenerationStats(0, 0, elapsedMs, List.of());
    }
}
