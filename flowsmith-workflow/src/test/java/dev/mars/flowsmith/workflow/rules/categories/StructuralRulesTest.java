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
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import dev.mars.flowsmith.workflow.rules.EngineConfig;
import dev.mars.flowsmith.workflow.rules.EngineReport;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleEngine;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the structural rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class StructuralRulesTest {

    private static RuleResult evaluate(Rule rule, WorkflowGraph graph) {
        return rule.evaluate(RuleContext.ofGraph(graph));
    }

    private static List<String> failedRuleIds(WorkflowGraph graph) {
        EngineReport report = new RuleEngine(EngineConfig.defaults())
                .executeCategory(RuleCategory.STRUCTURAL, RuleContext.ofGraph(graph));
        return report.getFailures().stream().map(RuleResult::ruleId).collect(Collectors.toList());
    }

    @Test
    void testValidGraphPassesAll() {
        assertTrue(failedRuleIds(WorkflowFixtures.linearGraph()).isEmpty());
    }

    @Test
    void testEmptyGraphHasNoNodes() {
        RuleResult result = evaluate(new StructuralRules.HasNodesRule(), WorkflowGraph.builder().name("Empty").build());

        assertFalse(result.passed());
        assertEquals(0, result.details().get("nodeCount"));
    }

    @Test
    @DisplayName("A duplicated node name is listed by structural-unique-names")
    void testDuplicateNames() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder()
                .node(WorkflowFixtures.node("Fetch", NodeType.HTTP_REQUEST, 1000))
                .build();

        RuleResult result = evaluate(new StructuralRules.UniqueNodeNamesRule(), graph);

        assertFalse(result.passed());
        assertEquals(List.of("Fetch"), result.details().get("duplicates"));
        assertTrue(failedRuleIds(graph).contains("structural-unique-names"));
    }

    @Test
    @DisplayName("Removing the only connection into a node makes it an orphan")
    void testOrphanAfterRemovingConnection() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().removeConnection("Fetch", "Notify").build();

        RuleResult orphans = evaluate(new StructuralRules.NoOrphanNodesRule(), graph);
        RuleResult connected = evaluate(new StructuralRules.ConnectedWorkflowRule(), graph);

        assertFalse(orphans.passed());
        assertEquals(List.of("Notify"), orphans.details().get("orphanNodes"));
        assertFalse(connected.passed());
        assertEquals(List.of("Notify"), connected.details().get("unreachableNodes"));
        assertEquals(List.of("structural-no-orphans", "structural-connected"), failedRuleIds(graph));
    }

    @Test
    void testTriggerIsNeverAnOrphan() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .name("Only trigger")
                .node(WorkflowFixtures.trigger("Start", 250))
                .build();

        assertTrue(evaluate(new StructuralRules.NoOrphanNodesRule(), graph).passed());
    }

    @Test
    void testConnectionToMissingNode() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().connect("Notify", "Ghost").build();

        RuleResult result = evaluate(new StructuralRules.ValidConnectionsRule(), graph);

        assertFalse(result.passed());
        assertEquals(List.of("Target: Ghost"), result.details().get("invalidReferences"));
    }

    @Test
    void testConnectionFromMissingNode() {
        WorkflowGraph graph = WorkflowFixtures.linearGraph().toBuilder().connect("Ghost", "Fetch").build();

        RuleResult result = evaluate(new StructuralRules.ValidConnectionsRule(), graph);

        assertFalse(result.passed());
        assertEquals(List.of("Source: Ghost"), result.details().get("invalidReferences"));
    }

    @Test
    void testConnectedRequiresTrigger() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .name("No trigger")
                .node(WorkflowFixtures.node("Fetch", NodeType.HTTP_REQUEST, 250))
                .build();

        RuleResult result = evaluate(new StructuralRules.ConnectedWorkflowRule(), graph);

        assertFalse(result.passed());
        assertEquals("No trigger node found as entry point", result.message());
    }

    @Test
    @DisplayName("A cycle reachable from the trigger has no orphans")
    void testCycleIsNotOrphaned() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .name("Cycle")
                .node(WorkflowFixtures.trigger("Start", 0))
                .node(WorkflowFixtures.node("A", NodeType.SET, 250))
                .node(WorkflowFixtures.node("B", NodeType.SET, 500))
                .node(WorkflowFixtures.node("C", NodeType.SET, 750))
                .connect("Start", "A")
                .connect("A", "B")
                .connect("B", "C")
                .connect("C", "A")
                .build();

        assertTrue(evaluate(new StructuralRules.NoOrphanNodesRule(), graph).passed());
        assertTrue(evaluate(new StructuralRules.ConnectedWorkflowRule(), graph).passed());
    }

    @Test
    void testMissingGraph() {
        RuleResult result = new StructuralRules.HasNodesRule().evaluate(RuleContext.builder().build());

        assertFalse(result.passed());
        assertEquals("Workflow graph is required for this rule", result.message());
    }
}
