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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Node/connection structure intended for import into the workflow runtime.
 * <p>
 * Connections are keyed by source node name, then by output port, then by output index, mirroring
 * the exported JSON shape. Connection endpoints are not checked here; that is the job of the
 * structural rules, which need to be able to see a broken graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowGraph {

    public static final String DEFAULT_EXECUTION_ORDER = "v1";

    private final String name;
    private final List<WorkflowNode> nodes;
    private final Map<String, Map<String, List<List<Connection>>>> connections;
    private final boolean active;
    private final Map<String, Object> settings;
    private final Map<String, Object> meta;
    private final List<String> tags;

    private WorkflowGraph(Builder builder) {
        this.name = builder.name;
        this.nodes = List.copyOf(builder.nodes);
        this.connections = freeze(builder.connections);
        this.active = builder.active;
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
        this.tags = List.copyOf(builder.tags);
    }

    public String getName() {
        return name;
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public Map<String, Map<String, List<List<Connection>>>> getConnections() {
        return connections;
    }

    public boolean isActive() {
        return active;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    public List<String> getTags() {
        return tags;
    }

    public Optional<WorkflowNode> findNode(String nodeName) {
        return nodes.stream().filter(node -> node.getName().equals(nodeName)).findFirst();
    }

    public Set<String> getNodeNames() {
        Set<String> names = new LinkedHashSet<>();
        nodes.forEach(node -> names.add(node.getName()));
        return names;
    }

    /**
     * @return every connection, in source order
     */
    public List<Connection> connectionList() {
        List<Connection> all = new ArrayList<>();
        connections.values().forEach(ports -> ports.values().forEach(outputs -> outputs.forEach(all::addAll)));
        return all;
    }

    public int connectionCount() {
        return connectionList().size();
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .name(name)
                .nodes(nodes)
                .active(active)
                .settings(settings)
                .meta(meta);
        tags.forEach(builder::tag);
        connections.forEach((source, ports) -> ports.forEach((port, outputs) -> {
            builder.declareOutputs(source, port, outputs.size());
            outputs.forEach(targets -> targets.forEach(builder::connect));
        }));
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Map<String, List<List<Connection>>>> freeze(
            Map<String, Map<String, List<List<Connection>>>> source) {
        Map<String, Map<String, List<List<Connection>>>> copy = new LinkedHashMap<>();
        source.forEach((nodeName, ports) -> {
            Map<String, List<List<Connection>>> portCopy = new LinkedHashMap<>();
            ports.forEach((port, outputs) -> {
                List<List<Connection>> outputCopy = new ArrayList<>();
                outputs.forEach(targets -> outputCopy.add(List.copyOf(targets)));
                portCopy.put(port, Collections.unmodifiableList(outputCopy));
            });
            copy.put(nodeName, Collections.unmodifiableMap(portCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) o;
        return active == that.active &&
               Objects.equals(name, that.name) &&
               nodes.equals(that.nodes) &&
               connections.equals(that.connections) &&
               settings.equals(that.settings) &&
               meta.equals(that.meta) &&
               tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nodes, connections, active, settings, meta, tags);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
               "name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               ", connections=" + connectionCount() +
               ", active=" + active +
               '}';
    }

    /**
     * Builder for WorkflowGraph.
     */
    public static class Builder {
        private String name;
        private final List<WorkflowNode> nodes = new ArrayList<>();
        private final Map<String, Map<String, List<List<Connection>>>> connections = new LinkedHashMap<>();
        private boolean active = false;
        private final Map<String, Object> settings = new LinkedHashMap<>(Map.of("executionOrder", DEFAULT_EXECUTION_ORDER));
        private final Map<String, Object> meta = new LinkedHashMap<>();
        private final List<String> tags = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(WorkflowNode node) {
            this.nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
            return this;
        }

        public Builder nodes(List<WorkflowNode> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        public Builder removeNode(String nodeName) {
            this.nodes.removeIf(node -> node.getName().equals(nodeName));
            return this;
        }

        /**
         * Connects output 0 of the source to input 0 of the target.
         */
        public Builder connect(String fromNodeName, String toNodeName) {
            return connect(Connection.main(fromNodeName, toNodeName));
        }

        public Builder connect(String fromNodeName, String toNodeName, int outputIndex) {
            return connect(new Connection(fromNodeName, toNodeName, Connection.MAIN, outputIndex, 0));
        }

        public Builder connect(Connection connection) {
            declareOutputs(connection.fromNodeName(), connection.outputPort(), connection.outputIndex() + 1);
            connections.get(connection.fromNodeName())
                    .get(connection.outputPort())
                    .get(connection.outputIndex())
                    .add(connection);
            return this;
        }

        /**
         * Ensures a source exposes at least {@code count} outputs on a port, adding empty ones as needed.
         */
        public Builder declareOutputs(String fromNodeName, String port, int count) {
            List<List<Connection>> outputs = connections
                    .computeIfAbsent(fromNodeName, key -> new LinkedHashMap<>())
                    .computeIfAbsent(port, key -> new ArrayList<>());
            while (outputs.size() < count) {
                outputs.add(new ArrayList<>());
            }
            return this;
        }

        public Builder removeConnection(String fromNodeName, String toNodeName) {
            Map<String, List<List<Connection>>> ports = connections.get(fromNodeName);
            if (ports != null) {
                ports.values().forEach(outputs ->
                        outputs.forEach(targets -> targets.removeIf(c -> c.toNodeName().equals(toNodeName))));
            }
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings.clear();
            this.settings.putAll(settings);
            return this;
        }

        public Builder meta(Map<String, Object> meta) {
            this.meta.clear();
            this.meta.putAll(meta);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(this);
        }
    }
}
