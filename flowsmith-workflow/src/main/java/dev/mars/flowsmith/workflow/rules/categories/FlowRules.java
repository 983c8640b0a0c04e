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
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.rules.AbstractRule;
import dev.mars.flowsmith.workflow.rules.ConnectionGraph;
import dev.mars.flowsmith.workflow.rules.EngineConfig;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import dev.mars.flowsmith.workflow.rules.RuleSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Execution-flow checks: trigger count, cycles, dead ends, name and size limits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class FlowRules {

    public static final int MAX_NAME_LENGTH = 128;

    private FlowRules() {
    }

    public static List<Rule> create() {
        return create(EngineConfig.DEFAULT_MAX_NODES);
    }

    public static List<Rule> create(int maxNodes) {
        return List.of(
                new SingleTriggerRule(),
                new NoCyclesRule(),
                new NoDeadEndsRule(),
                new ValidNameRule(),
                new NodeLimitRule(maxNodes));
    }

    public static final class SingleTriggerRule extends AbstractRule {

        public SingleTriggerRule() {
            super("flow-single-trigger", "Single Trigger",
                    "Validates that the workflow has exactly one trigger node",
                    RuleCategory.FLOW, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                List<String> triggers = StructuralRules.triggerNames(graph);
                if (triggers.isEmpty()) {
                    return fail("No trigger node found", Map.of("triggerCount", 0),
                            List.of("Add a Webhook, Schedule or Manual trigger"));
                }
                if (triggers.size() > 1) {
                    return fail("Workflow has " + triggers.size() + " trigger nodes: " + triggers,
                            Map.of("triggerCount", triggers.size(), "triggers", triggers),
                            List.of("Keep a single trigger and remove the others"));
                }
                return pass("Workflow has a single trigger: " + triggers.get(0));
            });
        }
    }

    public static final class NoCyclesRule extends AbstractRule {

        public NoCyclesRule() {
            super("flow-no-cycles", "No Cycles",
                    "Validates that the connections contain no cycle",
                    RuleCategory.FLOW, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                List<String> cycle = ConnectionGraph.of(graph).findCycle();
                if (cycle.isEmpty()) {
                    return pass("No cycles detected");
                }
                return fail("Cycle detected between nodes: " + String.join(" -> ", cycle),
                        Map.of("cycleNodes", cycle),
                        List.of("Remove one of the connections forming the cycle"));
            });
        }
    }

    /**
     * Info level: a dead end is legal but usually means an unfinished branch.
     */
    public static final class NoDeadEndsRule extends AbstractRule {

        public NoDeadEndsRule() {
            super("flow-no-dead-ends", "No Dead Ends",
                    "Validates that every node either continues the flow or is a terminal type",
                    RuleCategory.FLOW, RuleSeverity.INFO);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                ConnectionGraph connections = ConnectionGraph.of(graph);
                List<String> deadEnds = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    boolean terminal = node.getNodeType().map(NodeType::isTerminal).orElse(false);
                    if (!terminal && !connections.hasOutgoing(node.getName())) {
                        deadEnds.add(node.getName());
                    }
                }
                if (deadEnds.isEmpty()) {
                    return pass("No dead ends found");
                }
                return fail("Found " + deadEnds.size() + " nodes without outgoing connections: " + deadEnds,
                        Map.of("deadEnds", deadEnds),
                        List.of("Connect the nodes to a following step or end the flow with a terminal node"));
            });
        }
    }

    public static final class ValidNameRule extends AbstractRule {

        public ValidNameRule() {
            super("flow-valid-name", "Valid Workflow Name",
                    "Validates that the workflow name is present and at most " + MAX_NAME_LENGTH + " characters",
                    RuleCategory.FLOW, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                String name = graph.getName();
                if (name == null || name.isBlank()) {
                    return fail("Workflow name is empty", Map.of(), List.of("Give the workflow a descriptive name"));
                }
                if (name.length() > MAX_NAME_LENGTH) {
                    return fail("Workflow name exceeds maximum length (" + MAX_NAME_LENGTH + " characters)",
                            Map.of("length", name.length()),
                            List.of("Shorten the workflow name to " + MAX_NAME_LENGTH + " characters or less"));
                }
                return pass("Workflow name is valid: \"" + name + "\"");
            });
        }
    }

    public static final class NodeLimitRule extends AbstractRule {

        private final int maxNodes;

        public NodeLimitRule(int maxNodes) {
            super("flow-node-limit", "Node Limit",
                    "Validates that the workflow does not exceed " + maxNodes + " nodes",
                    RuleCategory.FLOW, RuleSeverity.WARNING);
            if (maxNodes <= 0) {
                throw new IllegalArgumentException("Max nodes must be positive");
            }
            this.maxNodes = maxNodes;
        }

        public int getMaxNodes() {
            return maxNodes;
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                int nodeCount = graph.getNodes().size();
                if (nodeCount > maxNodes) {
                    return fail("Workflow exceeds node limit: " + nodeCount + "/" + maxNodes,
                            Map.of("nodeCount", nodeCount, "maxNodes", maxNodes),
                            List.of("Split the workflow into smaller sub-workflows"));
                }
                return pass("Node count within limit: " + nodeCount + "/" + maxNodes);
            });
        }
    }
}
