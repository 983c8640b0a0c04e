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

import dev.mars.flowsmith.contract.PromptConstraints;
import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.Position;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeRulesTest {

    private static WorkflowGraph withNode(WorkflowNode node) {
        return WorkflowFixtures.linearGraph().toBuilder().node(node).connect("Notify", node.getName()).build();
    }

    @Test
    void testLinearGraphPassesAll() {
        RuleContext context = RuleContext.ofGraph(WorkflowFixtures.linearGraph());
        NodeRules.create().forEach(rule -> assertTrue(rule.evaluate(context).passed(), rule.getId()));
    }

    @Test
    @DisplayName("An unrecognized type is reported but not treated as missing parameters")
    void testUnknownType() {
        WorkflowGraph graph = withNode(new WorkflowNode("id-x", "Custom", "acme.widget", 1, new Position(1000, 300),
                Map.of()));

        RuleResult types = new NodeRules.ValidTypesRule().evaluate(RuleContext.ofGraph(graph));
        RuleResult params = new NodeRules.RequiredParametersRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(types.passed());
        assertEquals(Map.of("Custom", "acme.widget"), types.details().get("unknownTypes"));
        assertTrue(params.passed());
    }

    @Test
    void testMissingRequiredParameters() {
        WorkflowGraph graph = withNode(new WorkflowNode("id-check", "Check", NodeType.IF.getTypeName(), 2,
                new Position(1000, 300), Map.of()));

        RuleResult result = new NodeRules.RequiredParametersRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(Map.of("Check", List.of("conditions")), result.details().get("missingParams"));
        assertEquals(List.of("Node 'Check' missing: conditions"), result.suggestions());
    }

    @Test
    void testVersionBelowOne() {
        WorkflowGraph graph = withNode(new WorkflowNode("id-old", "Old", NodeType.SET.getTypeName(), 0,
                new Position(1000, 300), Map.of()));

        RuleResult result = new NodeRules.ValidVersionRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertTrue(((Map<?, ?>) result.details().get("invalidVersions")).containsKey("Old"));
    }

    @Test
    void testPositionOutOfBounds() {
        WorkflowGraph graph = withNode(WorkflowFixtures.node("Far", NodeType.SET, 20000));

        RuleResult result = new NodeRules.ValidPositionsRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(List.of("Far"), result.details().get("outOfBounds"));
    }

    @Test
    void testEmptyAndDuplicateIds() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(new WorkflowNode("", "Blank", NodeType.SET.getTypeName(), 3, new Position(1000, 300), Map.of()))
                .node(new WorkflowNode("id-Fetch", "Copy", NodeType.SET.getTypeName(), 3, new Position(1250, 300),
                        Map.of()))
                .build();

        RuleResult result = new NodeRules.ValidIdsRule().evaluate(RuleContext.ofGraph(graph));

        assertFalse(result.passed());
        assertEquals(List.of("Blank"), result.details().get("emptyIds"));
        assertEquals(List.of("id-Fetch"), result.details().get("duplicateIds"));
    }

    @Nested
    @DisplayName("Contract type constraints")
    class TypeConstraints {

        private RuleResult evaluate(PromptConstraints constraints) {
            PromptContract contract = PromptContract.builder()
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .constraints(constraints)
                    .build();
            return new NodeRules.TypeConstraintsRule()
                    .evaluate(RuleContext.of(contract, WorkflowFixtures.linearGraph()));
        }

        @Test
        void testForbiddenType() {
            RuleResult result = evaluate(PromptConstraints.builder()
                    .forbiddenType(NodeType.SLACK.getTypeName())
                    .build());

            assertFalse(result.passed());
            assertEquals(List.of("Node 'Notify' uses forbidden type n8n-nodes-base.slack"),
                    result.details().get("violations"));
        }

        @Test
        @DisplayName("Triggers are exempt from the allowed set")
        void testAllowedTypesOnly() {
            RuleResult result = evaluate(PromptConstraints.builder()
                    .allowedType(NodeType.HTTP_REQUEST.getTypeName())
                    .build());

            assertFalse(result.passed());
            assertEquals(1, ((List<?>) result.details().get("violations")).size());
        }

        @Test
        void testEmptyConstraintsPass() {
            assertTrue(evaluate(PromptConstraints.empty()).passed());
        }

        @Test
        void testNoContractPasses() {
            RuleResult result = new NodeRules.TypeConstraintsRule()
                    .evaluate(RuleContext.ofGraph(WorkflowFixtures.linearGraph()));

            assertTrue(result.passed());
        }
    }
}
