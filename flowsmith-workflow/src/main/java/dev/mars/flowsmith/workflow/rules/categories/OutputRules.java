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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowsmith.core.exceptions.WorkflowCodecException;
import dev.mars.flowsmith.graph.Position;
import dev.mars.flowsmith.graph.WorkflowJsonCodec;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.rules.AbstractRule;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import dev.mars.flowsmith.workflow.rules.RuleSeverity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Export-readiness checks. Connection shape and serialization are checked on the
 * JSON form produced by {@link WorkflowJsonCodec}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class OutputRules {

    private OutputRules() {
    }

    public static List<Rule> create() {
        return create(new WorkflowJsonCodec());
    }

    public static List<Rule> create(WorkflowJsonCodec codec) {
        return List.of(
                new ExportableRule(),
                new NodesHaveIdsRule(),
                new ValidPositionsRule(),
                new ConnectionFormatRule(codec),
                new JsonSerializableRule(codec));
    }

    public static final class ExportableRule extends AbstractRule {

        public ExportableRule() {
            super("output-exportable", "Exportable Workflow",
                    "Validates that the workflow has the minimum structure required for export",
                    RuleCategory.OUTPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                List<String> missing = new ArrayList<>();
                if (graph.getName() == null || graph.getName().isBlank()) {
                    missing.add("name");
                }
                if (graph.getNodes().isEmpty()) {
                    missing.add("nodes");
                }
                if (missing.isEmpty()) {
                    return pass("Workflow has all required export properties");
                }
                return fail("Workflow missing required export properties: " + missing,
                        Map.of("missingProperties", missing),
                        missing.stream().map(item -> "Add required property: " + item).collect(Collectors.toList()));
            });
        }
    }

    public static final class NodesHaveIdsRule extends AbstractRule {

        public NodesHaveIdsRule() {
            super("output-nodes-have-ids", "Nodes Have IDs",
                    "Validates that every node has an id for import",
                    RuleCategory.OUTPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                List<String> withoutIds = graph.getNodes().stream()
                        .filter(node -> node.getId().isBlank())
                        .map(WorkflowNode::getName)
                        .collect(Collectors.toList());
                if (withoutIds.isEmpty()) {
                    return pass("All nodes have IDs");
                }
                return fail("Found " + withoutIds.size() + " nodes without IDs",
                        Map.of("nodesWithoutIds", withoutIds),
                        List.of("Generate unique IDs for all nodes before export"));
            });
        }
    }

    /**
     * Flags overlapping and negative positions, which render badly in the editor.
     */
    public static final class ValidPositionsRule extends AbstractRule {

        public ValidPositionsRule() {
            super("output-valid-positions", "Valid Positions for Render",
                    "Validates that node positions render without overlap",
                    RuleCategory.OUTPUT, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                Map<Position, String> occupied = new HashMap<>();
                List<String> issues = new ArrayList<>();
                for (WorkflowNode node : graph.getNodes()) {
                    String other = occupied.putIfAbsent(node.getPosition(), node.getName());
                    if (other != null) {
                        issues.add("Node '" + node.getName() + "': overlaps with node '" + other + "'");
                    }
                    if (node.getPosition().isNegative()) {
                        issues.add("Node '" + node.getName() + "': has negative position coordinates");
                    }
                }
                if (issues.isEmpty()) {
                    return pass("All positions are valid for rendering");
                }
                return fail("Found " + issues.size() + " position issues", Map.of("issues", issues), issues);
            });
        }
    }

    public static final class ConnectionFormatRule extends AbstractRule {

        private final WorkflowJsonCodec codec;

        public ConnectionFormatRule(WorkflowJsonCodec codec) {
            super("output-valid-connection-format", "Valid Connection Format",
                    "Validates that exported connections have the {node, type, index} shape",
                    RuleCategory.OUTPUT, RuleSeverity.ERROR);
            this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                ObjectNode json = codec.toJson(graph);
                List<String> issues = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> sources = json.path("connections").fields();
                while (sources.hasNext()) {
                    Map.Entry<String, JsonNode> source = sources.next();
                    Iterator<Map.Entry<String, JsonNode>> ports = source.getValue().fields();
                    while (ports.hasNext()) {
                        Map.Entry<String, JsonNode> port = ports.next();
                        checkOutputs(source.getKey() + "." + port.getKey(), port.getValue(), issues);
                    }
                }
                if (issues.isEmpty()) {
                    return pass("All connections are in valid format");
                }
                return fail("Found " + issues.size() + " connection format issues", Map.of("issues", issues),
                        List.of("Ensure connections follow the format { node, type, index }"));
            });
        }

        private static void checkOutputs(String path, JsonNode outputs, List<String> issues) {
            if (!outputs.isArray()) {
                issues.add(path + ": outputs should be an array");
                return;
            }
            for (int i = 0; i < outputs.size(); i++) {
                JsonNode targets = outputs.get(i);
                String slot = path + "[" + i + "]";
                if (!targets.isArray()) {
                    issues.add(slot + ": should be an array");
                    continue;
                }
                for (JsonNode target : targets) {
                    if (!target.path("node").isTextual() || target.get("node").asText().isEmpty()) {
                        issues.add(slot + ": missing or invalid 'node' property");
                    }
                    if (!target.path("type").isTextual() || target.get("type").asText().isEmpty()) {
                        issues.add(slot + ": missing or invalid 'type' property");
                    }
                    if (!target.path("index").isInt() || target.get("index").asInt() < 0) {
                        issues.add(slot + ": missing or invalid 'index' property");
                    }
                }
            }
        }
    }

    /**
     * Serializes, parses back and serializes again; both texts must be identical.
     */
    public static final class JsonSerializableRule extends AbstractRule {

        private final WorkflowJsonCodec codec;

        public JsonSerializableRule(WorkflowJsonCodec codec) {
            super("output-json-serializable", "JSON Serializable",
                    "Validates that the workflow survives a JSON write and read cycle unchanged",
                    RuleCategory.OUTPUT, RuleSeverity.ERROR);
            this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withGraph(context, graph -> {
                try {
                    String json = codec.toJsonString(graph, false);
                    String reparsed = codec.toJsonString(codec.fromJsonString(json), false);
                    if (!json.equals(reparsed)) {
                        return fail("Workflow JSON changed after a serialization round trip",
                                Map.of("bytes", json.length()),
                                List.of("Use only JSON-compatible parameter values"));
                    }
                    return pass("Workflow serializes correctly (" + json.length() + " bytes)");
                } catch (WorkflowCodecException e) {
                    return fail("Workflow cannot be serialized to JSON: " + e.getMessage(),
                            Map.of("error", String.valueOf(e.getMessage())),
                            List.of("Remove non-serializable parameter values"));
                }
            });
        }
    }
}
