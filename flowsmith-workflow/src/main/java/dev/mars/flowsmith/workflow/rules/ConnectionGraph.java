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

package dev.mars.flowsmith.workflow.rules;

import dev.mars.flowsmith.graph.Connection;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Adjacency view over the connections of a workflow graph, keyed by node name.
 * Provides reachability and cycle detection for the structural and flow rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ConnectionGraph {

    private final Set<String> nodes;
    private final Map<String, Set<String>> edges;
    private final Map<String, Set<String>> reverseEdges;
    private final List<Connection> danglingConnections;

    private ConnectionGraph(Set<String> nodes, Map<String, Set<String>> edges,
                            Map<String, Set<String>> reverseEdges, List<Connection> danglingConnections) {
        this.nodes = nodes;
        this.edges = edges;
        this.reverseEdges = reverseEdges;
        this.danglingConnections = danglingConnections;
    }

    /**
     * Builds the adjacency maps. A connection whose source or target is not a node of the graph
     * is recorded as dangling and contributes no edge.
     */
    public static ConnectionGraph of(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        Set<String> nodes = new LinkedHashSet<>();
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Map<String, Set<String>> reverseEdges = new LinkedHashMap<>();
        for (WorkflowNode node : graph.getNodes()) {
            nodes.add(node.getName());
            edges.putIfAbsent(node.getName(), new LinkedHashSet<>());
            reverseEdges.putIfAbsent(node.getName(), new LinkedHashSet<>());
        }

        List<Connection> dangling = new ArrayList<>();
        for (Connection connection : graph.connectionList()) {
            String from = connection.fromNodeName();
            String to = connection.toNodeName();
            if (!nodes.contains(from) || !nodes.contains(to)) {
                dangling.add(connection);
                continue;
            }
            edges.get(from).add(to);
            reverseEdges.get(to).add(from);
        }
        return new ConnectionGraph(nodes, edges, reverseEdges, List.copyOf(dangling));
    }

    public Set<String> getNodes() {
        return Set.copyOf(nodes);
    }

    public Set<String> successors(String nodeName) {
        return Set.copyOf(edges.getOrDefault(nodeName, Set.of()));
    }

    public Set<String> predecessors(String nodeName) {
        return Set.copyOf(reverseEdges.getOrDefault(nodeName, Set.of()));
    }

    public boolean hasIncoming(String nodeName) {
        return !reverseEdges.getOrDefault(nodeName, Set.of()).isEmpty();
    }

    public boolean hasOutgoing(String nodeName) {
        return !edges.getOrDefault(nodeName, Set.of()).isEmpty();
    }

    /**
     * @return connections referencing a node name that does not exist
     */
    public List<Connection> getDanglingConnections() {
        return danglingConnections;
    }

    /**
     * Breadth-first traversal along forward edges.
     *
     * @return every node reachable from the start nodes, the start nodes included
     */
    public Set<String> reachableFrom(Collection<String> startNodes) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        for (String start : startNodes) {
            if (nodes.contains(start) && visited.add(start)) {
                queue.offer(start);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : edges.getOrDefault(current, Set.of())) {
                if (visited.add(next)) {
                    queue.offer(next);
                }
            }
        }
        return visited;
    }

    /**
     * Depth-first search driven by an explicit stack of frames, so graph depth is not bounded
     * by the thread stack. A back-edge to a node still on the path closes a cycle; its members
     * are the path entries from that node onward.
     *
     * @return the members of the first cycle found, in traversal order, or an empty list
     */
    public List<String> findCycle() {
        Set<String> visited = new HashSet<>();
        for (String node : nodes) {
            if (!visited.contains(node)) {
                List<String> cycle = findCycleFrom(node, visited);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    public boolean hasCycles() {
        return !findCycle().isEmpty();
    }

    private List<String> findCycleFrom(String root, Set<String> visited) {
        Deque<Frame> frames = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        frames.push(enter(root, visited, path, onPath));

        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (!frame.successors.hasNext()) {
                frames.pop();
                path.remove(path.size() - 1);
                onPath.remove(frame.node);
                continue;
            }
            String next = frame.successors.next();
            if (onPath.contains(next)) {
                return new ArrayList<>(path.subList(path.indexOf(next), path.size()));
            }
            if (!visited.contains(next)) {
                frames.push(enter(next, visited, path, onPath));
            }
        }
        return List.of();
    }

    private Frame enter(String node, Set<String> visited, List<String> path, Set<String> onPath) {
        visited.add(node);
        path.add(node);
        onPath.add(node);
        return new Frame(node, edges.getOrDefault(node, Set.of()).iterator());
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        private Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    @Override
    public String toString() {
        return "ConnectionGraph{" +
               "nodes=" + nodes +
               ", edges=" + edges +
               ", dangling=" + danglingConnections.size() +
               '}';
    }
}
