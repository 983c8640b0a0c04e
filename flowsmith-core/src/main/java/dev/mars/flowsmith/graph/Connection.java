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

package dev.mars.flowsmith.graph;

import java.util.Objects;

/**
 * Directed edge between two nodes, addressed by node name.
 *
 * @param fromNodeName source node
 * @param toNodeName   target node
 * @param outputPort   connection type of the source output, {@code main} for data flow
 * @param outputIndex  index of the source output; conditional nodes use 0 for true and 1 for false
 * @param inputIndex   index of the target input
 */
public record Connection(String fromNodeName, String toNodeName, String outputPort, int outputIndex, int inputIndex) {

    public static final String MAIN = "main";

    public Connection {
        Objects.requireNonNull(fromNodeName, "Source node name cannot be null");
        Objects.requireNonNull(toNodeName, "Target node name cannot be null");
        Objects.requireNonNull(outputPort, "Output port cannot be null");
        if (outputIndex < 0) {
            throw new IllegalArgumentException("Output index cannot be negative: " + outputIndex);
        }
        if (inputIndex < 0) {
            throw new IllegalArgumentException("Input index cannot be negative: " + inputIndex);
        }
    }

    public static Connection main(String fromNodeName, String toNodeName) {
        return new Connection(fromNodeName, toNodeName, MAIN, 0, 0);
    }
}
