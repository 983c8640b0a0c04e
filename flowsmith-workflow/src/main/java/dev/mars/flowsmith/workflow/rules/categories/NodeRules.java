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
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.Position;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.rules.AbstractRule;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import dev.mars.flowsmith.workflow.rules.RuleSeverity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-node checks against the node type catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodeRules {

    public static final double MIN_COORDINATE = -10000;
    public static final double MAX_COORDINATE = 10000;

    private NodeRules() {
    }

    public static List<Rule> create() {
        return List.of(
                new ValidTypesRule(),
                new RequiredParametersRule(),
                new ValidVersionRule(),
                new ValidPositionsRule(),
                new ValidIdsRule(),
                new TypeConstraintsRule());
    }

    /**
     * The catalog is a subset of the runtime's node types, so an unknown type is only a warning.
     */
    public static final class ValidTypesRule extends AbstractRule {

        public ValidTypesRule() {
            super("node-valid-types", "Valid Node Types",
                    "Validates that node types are known to the node catalog",
                    RuleCategory.NODE, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Map<String, Object> unknown = new LinkedHashMap<>();
                List<String> suggestions = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (node.getNodeType().isEmpty()) {
                        unknown.put(node.getName(), node.getTypeName());
                        suggestions.add("Node '" + node.getName() + "' has unrecognized type: " + node.getTypeName());
                    }
                }
                if (unknown.isEmpty()) {
                    return pass("All node types are recognized");
                }
                return fail("Found " + unknown.size() + " nodes with unknown types",
                        Map.of("unknownTypes", unknown), suggestions);
            });
        }
    }

    public static final class RequiredParametersRule extends AbstractRule {

        public RequiredParametersRule() {
            super("node-required-params", "Required Parameters",
                    "Validates that the required parameters of each node type are present",
                    RuleCategory.NODE, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Map<String, Object> missingByNode = new LinkedHashMap<>();
                List<String> suggestions = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    // unknown types are reported by node-valid-types
                    Optional<NodeType> type = node.getNodeType();
                    if (type.isEmpty()) {
                        continue;
                    }
                    List<String> missing = new ArrayList<>();
                    for (String parameter : type.get().getRequiredParameters()) {
                        if (!node.getParameters().containsKey(parameter)) {
                            missing.add(parameter);
                        }
                    }
                    if (!missing.isEmpty()) {
                        missingByNode.put(node.getName(), missing);
                        suggestions.add("Node '" + node.getName() + "' missing: " + String.join(", ", missing));
                    }
                }
                if (missingByNode.isEmpty()) {
                    return pass("All required parameters are present");
                }
                return fail("Found " + missingByNode.size() + " nodes with missing required parameters",
                        Map.of("missingParams", missingByNode), suggestions);
            });
        }
    }

    public static final class ValidVersionRule extends AbstractRule {

        public ValidVersionRule() {
            super("node-valid-version", "Valid Node Version",
                    "Validates that node type versions are at least 1",
                    RuleCategory.NODE, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Map<String, Object> invalid = new LinkedHashMap<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (node.getTypeVersion() < 1) {
                        invalid.put(node.getName(), node.getTypeVersion());
                    }
                }
                if (invalid.isEmpty()) {
                    return pass("All node versions are valid");
                }
                List<String> suggestions = new ArrayList<>();
                invalid.forEach((name, version) ->
                        suggestions.add("Node '" + name + "' has invalid version: " + version));
                return fail("Found " + invalid.size() + " nodes with invalid versions",
                        Map.of("invalidVersions", invalid), suggestions);
            });
        }
    }

    public static final class ValidPositionsRule extends AbstractRule {

        public ValidPositionsRule() {
            super("node-valid-positions", "Valid Node Positions",
                    "Validates that node positions are within canvas bounds",
                    RuleCategory.NODE, RuleSeverity.INFO);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                List<String> outOfBounds = new ArrayList<>();
                List<String> suggestions = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    Position position = node.getPosition();
                    if (outOfBounds(position.x()) || outOfBounds(position.y())) {
                        outOfBounds.add(node.getName());
                        suggestions.add("Node '" + node.getName() + "' position (" + position.x() + ", "
                                + position.y() + ") is out of bounds");
                    }
                }
                if (outOfBounds.isEmpty()) {
                    return pass("All node positions are within bounds");
                }
                return fail("Found " + outOfBounds.size() + " nodes with out-of-bounds positions",
                        Map.of("outOfBounds", outOfBounds), suggestions);
            });
        }

        private static boolean outOfBounds(double coordinate) {
            return coordinate < MIN_COORDINATE || coordinate > MAX_COORDINATE;
        }
    }

    public static final class ValidIdsRule extends AbstractRule {

        public ValidIdsRule() {
            super("node-valid-ids", "Valid Node IDs",
                    "Validates that every node has a non-empty unique id",
                    RuleCategory.NODE, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Set<String> ids = new HashSet<>();
                List<String> emptyIds = new ArrayList<>();
                List<String> duplicateIds = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (node.getId().isBlank()) {
                        emptyIds.add(node.getName());
                    } else if (!ids.add(node.getId())) {
                        duplicateIds.add(node.getId());
                    }
                }
                if (emptyIds.isEmpty() && duplicateIds.isEmpty()) {
                    return pass("All node IDs are valid and unique");
                }
                List<String> suggestions = new ArrayList<>();
                emptyIds.forEach(name -> suggestions.add("Node '" + name + "' has empty ID"));
                duplicateIds.forEach(id -> suggestions.add("Duplicate node ID: " + id));
                return fail("Found nodes with invalid or duplicate IDs",
                        Map.of("emptyIds", emptyIds, "duplicateIds", duplicateIds), suggestions);
            });
        }
    }

    /**
     * Applies the contract's allowed and forbidden node types. Passes when no contract is given.
     */
    public static final class TypeConstraintsRule extends AbstractRule {

        public TypeConstraintsRule() {
            super("node-type-constraints", "Node Type Constraints",
                    "Validates node types against the contract's allowed and forbidden node lists",
                    RuleCategory.NODE, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                if (context.getPromptContract().isEmpty()) {
                    return pass("No contract constraints to apply");
                }
                PromptConstraints constraints = context.getPromptContract().get().getConstraints();
                List<String> violations = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    if (node.isTrigger()) {
                        continue;
                    }
                    if (constraints.getForbiddenTypes().contains(node.getTypeName())) {
                        violations.add("Node '" + node.getName() + "' uses forbidden type " + node.getTypeName());
                    } else if (!constraints.getAllowedTypes().isEmpty()
                            && !constraints.getAllowedTypes().contains(node.getTypeName())) {
                        violations.add("Node '" + node.getName() + "' uses type " + node.getTypeName()
                                + " outside the allowed set");
                    }
                }
                if (violations.isEmpty()) {
                    return pass("All node types satisfy the contract constraints");
                }
                return fail("Found " + violations.size() + " node type constraint violations",
                        Map.of("violations", violations),
                        List.of("Replace the offending nodes or relax @constraints"));
            });
        }
    }
}
