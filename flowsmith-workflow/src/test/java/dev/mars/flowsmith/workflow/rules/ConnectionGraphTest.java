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

import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConnectionGraph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class ConnectionGraphTest {

    private static WorkflowGraph cycle() {
        return WorkflowGraph.builder()
                .name("Cycle")
                .node(WorkflowFixtures.node("A", NodeType.SET, 250))
                .node(WorkflowFixtures.node("B", NodeType.SET, 500))
                .node(WorkflowFixtures.node("C", NodeType.SET, 750))
                .connect("A", "B")
                .connect("B", "C")
                .connect("C", "A")
                .build();
    }

    static WorkflowGraph longChain(int length) {
        WorkflowGraph.Builder builder = WorkflowGraph.builder()
                .name("Chain")
                .node(WorkflowFixtures.trigger("Start", 250));
        String previous = "Start";
        for (int i = 1; i <= length; i++) {
            String name = "Step " + i;
            builder.node(WorkflowFixtures.node(name, NodeType.SET, 250 + i * 250.0)).connect(previous, name);
            previous = name;
        }
        return builder.build();
    }

    @Test
    void testEmptyGraph() {
        ConnectionGraph graph = ConnectionGraph.of(WorkflowGraph.builder().name("Empty").build());

        assertTrue(graph.getNodes().isEmpty());
        assertFalse(graph.hasCycles());
        assertTrue(graph.reachableFrom(List.of("missing")).isEmpty());
    }

    @Test
    void testEdgesAndReverseEdges() {
        ConnectionGraph graph = ConnectionGraph.of(WorkflowFixtures.linearGraph());

        assertEquals(Set.of("Fetch"), graph.successors("Start"));
        assertEquals(Set.of("Start"), graph.predecessors("Fetch"));
        assertFalse(graph.hasIncoming("Start"));
        assertFalse(graph.hasOutgoing("Notify"));
        assertTrue(graph.getDanglingConnections().isEmpty());
    }

    @Test
    void testReachability() {
        ConnectionGraph graph = ConnectionGraph.of(WorkflowFixtures.linearGraph()
                .toBuilder()
                .node(WorkflowFixtures.node("Island", NodeType.SET, 1000))
                .build());

        assertEquals(Set.of("Start", "Fetch", "Notify"), graph.reachableFrom(List.of("Start")));
        assertEquals(Set.of("Fetch", "Notify"), graph.reachableFrom(List.of("Fetch")));
    }

    @Test
    void testLinearGraphHasNoCycle() {
        ConnectionGraph graph = ConnectionGraph.of(WorkflowFixtures.linearGraph());

        assertFalse(graph.hasCycles());
        assertTrue(graph.findCycle().isEmpty());
    }

    @Test
    void testCycleMembers() {
        List<String> members = ConnectionGraph.of(cycle()).findCycle();

        assertEquals(Set.of("A", "B", "C"), Set.copyOf(members));
        assertEquals(3, members.size());
    }

    @Test
    void testBackEdgeCreatesCycle() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().connect("Notify", "Fetch").build();

        List<String> members = ConnectionGraph.of(graph).findCycle();

        assertEquals(Set.of("Fetch", "Notify"), Set.copyOf(members));
    }

    @Test
    void testSelfLoop() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().connect("Fetch", "Fetch").build();

        assertEquals(List.of("Fetch"), ConnectionGraph.of(graph).findCycle());
    }

    @Test
    void testDanglingConnectionsAreExcludedFromEdges() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().connect("Notify", "Ghost").build();

        ConnectionGraph connections = ConnectionGraph.of(graph);

        assertEquals(1, connections.getDanglingConnections().size());
        assertEquals("Ghost", connections.getDanglingConnections().get(0).toNodeName());
        assertFalse(connections.hasOutgoing("Notify"));
    }

    @Test
    void testLongChainWithoutStackExhaustion() {
        ConnectionGraph graph = ConnectionGraph.of(longChain(20_000));

        assertFalse(graph.hasCycles());
        assertEquals(20_001, graph.reachableFrom(List.of("Start")).size());
    }

    @Test
    void testCycleAtEndOfLongChain() {
        WorkflowGraph chain = longChain(20_000).toBuilder().connect("Step 20000", "Step 19998").build();

        assertEquals(List.of("Step 19998", "Step 19999", "Step 20000"), ConnectionGraph.of(chain).findCycle());
    }
}
