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

import dev.mars.flowsmith.graph.Connection;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.rules.AbstractRule;
import dev.mars.flowsmith.workflow.rules.ConnectionGraph;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import dev.mars.flowsmith.workflow.rules.RuleSeverity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Connectivity and naming checks over the generated graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class StructuralRules {

    private StructuralRules() {
    }

    public static List<Rule> create() {
        return List.of(
                new HasNodesRule(),
                new UniqueNodeNamesRule(),
                new NoOrphanNodesRule(),
                new ValidConnectionsRule(),
                new ConnectedWorkflowRule());
    }

    static List<String> triggerNames(WorkflowGraph graph) {
        return graph.getNodes().stream()
                .filter(WorkflowNode::isTrigger)
                .map(WorkflowNode::getName)
                .collect(Collectors.toList());
    }

    public static final class HasNodesRule extends AbstractRule {

        public HasNodesRule() {
            super("structural-has-nodes", "Workflow Has Nodes",
                    "Validates that the workflow contains at least one node",
                    RuleCategory.STRUCTURAL, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> graph.getNodes().isEmpty()
                    ? fail("Workflow has no nodes", Map.of("nodeCount", 0),
                           List.of("Add at least one node to the workflow"))
                    : pass("Workflow has " + graph.getNodes().size() + " nodes"));
        }
    }

    public static final class UniqueNodeNamesRule extends AbstractRule {

        public UniqueNodeNamesRule() {
            super("structural-unique-names", "Unique Node Names",
                    "Validates that all node names are unique",
                    RuleCategory.STRUCTURAL, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Set<String> seen = new HashSet<>();
                Set<String> duplicates = new LinkedHashSet<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (!seen.add(node.getName())) {
                        duplicates.add(node.getName());
                    }
                }
                if (duplicates.isEmpty()) {
                    return pass("All node names are unique");
                }
                return fail("Found " + duplicates.size() + " duplicate node names: " + duplicates,
                        Map.of("duplicates", List.copyOf(duplicates)),
                        duplicates.stream().map(name -> "Rename duplicate node: " + name).collect(Collectors.toList()));
            });
        }
    }

    public static final class NoOrphanNodesRule extends AbstractRule {

        public NoOrphanNodesRule() {
            super("structural-no-orphans", "No Orphan Nodes",
                    "Validates that every non-trigger node has an incoming connection",
                    RuleCategory.STRUCTURAL, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                ConnectionGraph connections = ConnectionGraph.of(graph);
                List<String> orphans = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (!node.isTrigger() && !connections.hasIncoming(node.getName())) {
                        orphans.add(node.getName());
                    }
                }
                if (orphans.isEmpty()) {
                    return pass("No orphan nodes found");
                }
                return fail("Found " + orphans.size() + " orphan nodes (no incoming connections): " + orphans,
                        Map.of("orphanNodes", orphans),
                        orphans.stream().map(name -> "Connect node '" + name + "' to the workflow flow")
                                .collect(Collectors.toList()));
            });
        }
    }

    public static final class ValidConnectionsRule extends AbstractRule {

        public ValidConnectionsRule() {
            super("structural-valid-connections", "Valid Connection References",
                    "Validates that all connections reference existing nodes",
                    RuleCategory.STRUCTURAL, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Set<String> names = graph.getNodeNames();
                Set<String> invalid = new LinkedHashSet<>();
                for (String source : graph.getConnections().keySet()) {
                    if (!names.contains(source)) {
                        invalid.add("Source: " + source);
                    }
                }
                for (Connection connection : graph.connectionList()) {
                    if (!names.contains(connection.toNodeName())) {
                        invalid.add("Target: " + connection.toNodeName());
                    }
                }
                if (invalid.isEmpty()) {
                    return pass("All connection references are valid");
                }
                return fail("Found " + invalid.size() + " invalid connection references",
                        Map.of("invalidReferences", List.copyOf(invalid)),
                        List.of("Ensure all connection references point to existing nodes"));
            });
        }
    }

    public static final class ConnectedWorkflowRule extends AbstractRule {

        public ConnectedWorkflowRule() {
            super("structural-connected", "Connected Workflow",
                    "Validates that every node is reachable from a trigger",
                    RuleCategory.STRUCTURAL, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                if (graph.getNodes().isEmpty()) {
                    return pass("Empty workflow, connectivity not checked");
                }
                List<String> triggers = triggerNames(graph);
                if (triggers.isEmpty()) {
                    return fail("No trigger node found as entry point", Map.of("entryNodes", List.of()),
                            List.of("Add a trigger node (Webhook, Schedule or Manual)"));
                }
                ConnectionGraph connections = ConnectionGraph.of(graph);
                Set<String> reachable = connections.reachableFrom(triggers);
                List<String> unreachable = graph.getNodeNames().stream()
                        .filter(name -> !reachable.contains(name))
                        .collect(Collectors.toList());
                if (unreachable.isEmpty()) {
                    return pass("All nodes are reachable from a trigger");
                }
                return fail("Found " + unreachable.size() + " unreachable nodes: " + unreachable,
                        Map.of("unreachableNodes", unreachable),
                        unreachable.stream().map(name -> "Connect node '" + name + "' to the main workflow flow")
                                .collect(Collectors.toList()));
            });
        }
    }
}
