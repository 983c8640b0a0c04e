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

package dev.mars.flowsmith.workflow.generator;

import dev.mars.flowsmith.contract.PromptConstraints;
import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.graph.Connection;
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.Position;
import dev.mars.flowsmith.graph.StepClassifier;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowNode;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a {@link PromptContract} onto a workflow graph.
 * <p>
 * One trigger node is synthesized from the contract trigger, followed by one node per step in
 * step order. Nodes are chained on output 0; a conditional node exposes two outputs with only the
 * true branch wired, leaving the false branch for a later stage to complete. Every connection
 * targets a node created in the same run, so the result never carries a dangling reference.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowGenerator {

    private static final Logger logger = Logger.getLogger(WorkflowGenerator.class.getName());

    static final int MAX_NAME_LENGTH = 50;
    static final String DEFAULT_SCHEDULE = "0 * * * *";
    static final String GENERATED_BY = "flowsmith";

    public GenerationResult generate(PromptContract contract) {
        return generate(contract, GeneratorOptions.defaults());
    }

    public GenerationResult generate(PromptContract contract, GeneratorOptions options) {
        Objects.requireNonNull(contract, "Contract cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        long start = System.nanoTime();
        Diagnostics diagnostics = new Diagnostics();

        try {
            WorkflowGraph graph = build(contract, options, diagnostics);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            GenerationStats stats = new GenerationStats(graph.getNodes().size(), graph.connectionCount(), elapsedMs,
                    distinctTypes(graph));
            logger.info("Generated workflow '" + graph.getName() + "' with " + stats.nodeCount() + " nodes and "
                    + stats.connectionCount() + " connections (" + elapsedMs + "ms)");
            return new GenerationResult(graph, diagnostics.getErrors(), diagnostics.getWarnings(), stats);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Workflow generation failed", e);
            diagnostics.addError(DiagnosticKind.EXECUTION, "GENERATION_FAILED",
                    "Workflow generation failed: " + e.getMessage());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return new GenerationResult(null, diagnostics.getErrors(), diagnostics.getWarnings(),
                    GenerationStats.empty(elapsedMs));
        }
    }

    private WorkflowGraph build(PromptContract contract, GeneratorOptions options, Diagnostics diagnostics) {
        Set<String> usedNames = new HashSet<>();
        List<WorkflowNode> nodes = new ArrayList<>();

        WorkflowNode trigger = triggerNode(contract.getTrigger(), options, diagnostics);
        usedNames.add(trigger.getName());
        nodes.add(trigger);

        for (WorkflowStep step : contract.getSteps()) {
            NodeType type = resolveType(step);
            String id = options.getIdGenerator().nextId(nodes.size() + 1);
            String name = uniqueName(nodeName(step, type), usedNames);
            nodes.add(new WorkflowNode(id, name, type.getTypeName(), type.getVersion(), Position.ORIGIN,
                    NodeParameters.forStep(type, step, id)));
        }

        if (options.isAutoLayout()) {
            for (int i = 0; i < nodes.size(); i++) {
                double x = options.getStartX() + i * options.getHorizontalSpacing();
                nodes.set(i, nodes.get(i).withPosition(new Position(x, options.getStartY())));
            }
        }

        WorkflowGraph.Builder graph = WorkflowGraph.builder()
                .name(options.getWorkflowName())
                .nodes(nodes);
        for (int i = 0; i < nodes.size() - 1; i++) {
            WorkflowNode current = nodes.get(i);
            int outputs = current.getNodeType().map(NodeType::getOutputCount).orElse(1);
            graph.declareOutputs(current.getName(), Connection.MAIN, outputs);
            graph.connect(current.getName(), nodes.get(i + 1).getName());
        }
        if (options.isIncludeMetadata()) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("generatedBy", GENERATED_BY);
            meta.put("runtimeVersion", contract.getMeta().getRuntimeVersion());
            meta.put("generatedAt", Instant.now(options.getClock()).toString());
            graph.meta(meta);
        }
        options.getTags().forEach(graph::tag);

        checkConstraints(contract.getConstraints(), nodes, diagnostics);
        return graph.build();
    }

    /**
     * Free-form trigger options are copied into the parameters of every trigger kind, after the
     * defaults, so an option may override a default parameter.
     */
    private static WorkflowNode triggerNode(PromptTrigger trigger, GeneratorOptions options, Diagnostics diagnostics) {
        String id = options.getIdGenerator().nextId(1);
        Position position = new Position(options.getStartX(), options.getStartY());
        Map<String, Object> parameters = new LinkedHashMap<>();

        switch (trigger.getKind()) {
            case WEBHOOK:
                parameters.put("httpMethod", trigger.getMethod().orElse("POST"));
                parameters.put("path", trigger.getPath().orElseGet(() -> defaultWebhookPath(options, id)));
                parameters.put("responseMode", "onReceived");
                parameters.put("responseData", "allEntries");
                parameters.putAll(trigger.getOptions());
                return new WorkflowNode(id, "Webhook", NodeType.WEBHOOK.getTypeName(),
                        NodeType.WEBHOOK.getVersion(), position, parameters);
            case SCHEDULE:
                parameters.put("rule", Map.of("interval", List.of(NodeParameters.orderedMap(
                        "field", "cronExpression",
                        "expression", trigger.getSchedule().orElse(DEFAULT_SCHEDULE)))));
                parameters.putAll(trigger.getOptions());
                return new WorkflowNode(id, "Schedule Trigger", NodeType.SCHEDULE_TRIGGER.getTypeName(),
                        NodeType.SCHEDULE_TRIGGER.getVersion(), position, parameters);
            case CUSTOM:
                diagnostics.addWarning(DiagnosticKind.SEMANTIC, "CUSTOM_TRIGGER", "@trigger.type",
                        "Custom triggers have no node mapping; a manual trigger was generated instead");
                parameters.putAll(trigger.getOptions());
                return manualTrigger(id, position, parameters);
            case MANUAL:
            default:
                parameters.putAll(trigger.getOptions());
                return manualTrigger(id, position, parameters);
        }
    }

    private static WorkflowNode manualTrigger(String id, Position position, Map<String, Object> parameters) {
        return new WorkflowNode(id, "Manual Trigger", NodeType.MANUAL_TRIGGER.getTypeName(),
                NodeType.MANUAL_TRIGGER.getVersion(), position, parameters);
    }

    /**
     * Stable for a given workflow name and trigger id, so sequential ids give reproducible paths.
     */
    private static String defaultWebhookPath(GeneratorOptions options, String triggerId) {
        byte[] seed = (options.getWorkflowName() + ":" + triggerId).getBytes(StandardCharsets.UTF_8);
        return "/workflow/" + UUID.nameUUIDFromBytes(seed).toString().substring(0, 8);
    }

    static NodeType resolveType(WorkflowStep step) {
        return step.getInferredNodeType().orElseGet(() -> StepClassifier.classifyNode(step.getActionText()));
    }

    static String nodeName(WorkflowStep step, NodeType type) {
        String text = step.getActionText().trim();
        if (!text.isEmpty() && text.length() <= MAX_NAME_LENGTH) {
            return text;
        }
        return type.getDisplayName() + " " + step.getNumber();
    }

    static String uniqueName(String base, Set<String> usedNames) {
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate)) {
            candidate = base + " " + suffix++;
        }
        return candidate;
    }

    private static void checkConstraints(PromptConstraints constraints, List<WorkflowNode> nodes,
                                         Diagnostics diagnostics) {
        constraints.getMaxNodes().ifPresent(max -> {
            if (nodes.size() > max) {
                diagnostics.addWarning(DiagnosticKind.SEMANTIC, "MAX_NODES_EXCEEDED", "@constraints.max_nodes",
                        "Generated " + nodes.size() + " nodes but at most " + max + " are allowed");
            }
        });
        for (WorkflowNode node : nodes) {
            if (node.isTrigger()) {
                continue;
            }
            if (constraints.getForbiddenTypes().contains(node.getTypeName())) {
                diagnostics.addWarning(DiagnosticKind.SEMANTIC, "FORBIDDEN_NODE_TYPE", "@constraints.forbidden_nodes",
                        "Node '" + node.getName() + "' uses forbidden type " + node.getTypeName());
            } else if (!constraints.getAllowedTypes().isEmpty()
                    && !constraints.getAllowedTypes().contains(node.getTypeName())) {
                diagnostics.addWarning(DiagnosticKind.SEMANTIC, "NODE_TYPE_NOT_ALLOWED", "@constraints.allowed_nodes",
                        "Node '" + node.getName() + "' uses type " + node.getTypeName() + " outside the allowed set");
            }
        }
    }

    private static List<String> distinctTypes(WorkflowGraph graph) {
        Set<String> types = new LinkedHashSet<>();
        graph.getNodes().forEach(node -> types.add(node.getTypeName()));
        return new ArrayList<>(types);
    }
}
