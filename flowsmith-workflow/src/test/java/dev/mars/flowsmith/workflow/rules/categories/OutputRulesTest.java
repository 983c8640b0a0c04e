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

package dev.mars.flowsmith.workflow.rules.categories;

import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.Position;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowJsonCodec;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputRulesTest {

    private WorkflowJsonCodec codec;

    @BeforeEach
    void setUp() {
        codec = new WorkflowJsonCodec();
    }

    @Test
    void testLinearGraphIsExportable() {
        RuleContext context = RuleContext.ofGraph(WorkflowFixtures.linearGraph());
        OutputRules.create(codec).forEach(rule -> assertTrue(rule.evaluate(context).passed(), rule.getId()));
    }

    @Test
    void testMissingExportProperties() {
        WorkflowGraph graph = WorkflowGraph.builder().name("").build();

        RuleResult result = new OutputRules.ExportableRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(List.of("name", "nodes"), result.details().get("missingProperties"));
    }

    @Test
    void testNodeWithoutId() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(new WorkflowNode(" ", "Anonymous", NodeType.NO_OP.getTypeName(), 1, new Position(1000, 300),
                        Map.of()))
                .build();

        RuleResult result = new OutputRules.NodesHaveIdsRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(List.of("Anonymous"), result.details().get("nodesWithoutIds"));
    }

    @Test
    @DisplayName("Overlapping and negative positions are both reported")
    void testPositionIssues() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(WorkflowFixtures.node("Stacked", NodeType.SET, 500))
                .node(WorkflowFixtures.node("Offscreen", NodeType.SET, -250))
                .build();

        RuleResult result = new OutputRules.ValidPositionsRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(List.of(
                "Node 'Stacked': overlaps with node 'Fetch'",
                "Node 'Offscreen': has negative position coordinates"), result.details().get("issues"));
    }

    @Test
    void testConnectionFormatOfIfBranches() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(WorkflowFixtures.node("Check", NodeType.IF, 1000))
                .node(WorkflowFixtures.node("Yes", NodeType.NO_OP, 1250))
                .node(WorkflowFixtures.node("No", NodeType.NO_OP, 1500))
                .connect("Notify", "Check")
                .connect("Check", "Yes", 0)
                .connect("Check", "No", 1)
                .build();

        assertTrue(new OutputRules.ConnectionFormatRule(codec).evaluate(RuleContext.ofGraph(graph)).passed());
    }

    @Test
    void testUnserializableParameter() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(new WorkflowNode("id-odd", "Odd", NodeType.SET.getTypeName(), 3, new Position(1000, 300),
                        Map.of("handle", new Object())))
                .build();

        RuleResult result = new OutputRules.JsonSerializableRule(codec).evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertTrue(result.message().startsWith("Workflow cannot be serialized to JSON"));
        assertTrue(result.details().containsKey("error"));
    }

    @Test
    void testCodecRequired() {
        assertThrows(NullPointerException.class, () -> new OutputRules.JsonSerializableRule(null));
        assertThrows(NullPointerException.class, () -> new OutputRules.ConnectionFormatRule(null));
    }
}
