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
import dev.mars.flowsmith.contract.TriggerKind;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.graph.Connection;
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowNode;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowGenerator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class WorkflowGeneratorTest {

    private WorkflowGenerator generator;
    private GeneratorOptions options;

    @BeforeEach
    void setUp() {
        generator = new WorkflowGenerator();
        options = GeneratorOptions.builder().idGenerator(NodeIdGenerator.sequential()).build();
    }

    private WorkflowGraph generate(PromptContract contract) {
        GenerationResult result = generator.generate(contract, options);
        assertTrue(result.isSuccess(), () -> "Generation failed: " + result.getErrors());
        return result.getWorkflow().orElseThrow();
    }

    private static PromptContract contractWithSteps(WorkflowStep... steps) {
        PromptContract.Builder builder = PromptContract.builder();
        for (WorkflowStep step : steps) {
            builder.step(step);
        }
        return builder.build();
    }

    private static List<String> names(WorkflowGraph graph) {
        return graph.getNodes().stream().map(WorkflowNode::getName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Webhook contract with two steps yields three nodes in a line")
    void testWebhookContract() {
        GenerationResult result = generator.generate(WorkflowFixtures.webhookContract(), options);

        assertTrue(result.isSuccess());
        assertTrue(result.getErrors().isEmpty());
        WorkflowGraph graph = result.getWorkflow().orElseThrow();
        assertEquals(List.of("Webhook", "Call http api", "Send slack message"), names(graph));
        assertEquals(NodeType.WEBHOOK.getTypeName(), graph.getNodes().get(0).getTypeName());
        assertEquals(NodeType.HTTP_REQUEST.getTypeName(), graph.getNodes().get(1).getTypeName());
        assertEquals(NodeType.SLACK.getTypeName(), graph.getNodes().get(2).getTypeName());
        assertEquals(2, graph.connectionCount());
        assertEquals(3, result.getStats().nodeCount());
        assertEquals(2, result.getStats().connectionCount());

        Map<String, Object> webhook = graph.getNodes().get(0).getParameters();
        assertEquals("/x", webhook.get("path"));
        assertEquals("POST", webhook.get("httpMethod"));
    }

    @Test
    @DisplayName("Every connection target is a generated node")
    void testNoDanglingConnections() {
        WorkflowGraph graph = generate(WorkflowFixtures.webhookContract());
        for (Connection connection : graph.connectionList()) {
            assertTrue(graph.findNode(connection.fromNodeName()).isPresent());
            assertTrue(graph.findNode(connection.toNodeName()).isPresent());
        }
    }

    @Test
    void testAutoLayout() {
        WorkflowGraph graph = generate(WorkflowFixtures.webhookContract());

        assertEquals(250, graph.getNodes().get(0).getPosition().x());
        assertEquals(500, graph.getNodes().get(1).getPosition().x());
        assertEquals(750, graph.getNodes().get(2).getPosition().x());
        graph.getNodes().forEach(node -> assertEquals(300, node.getPosition().y()));
    }

    @Test
    void testSequentialIds() {
        WorkflowGraph graph = generate(WorkflowFixtures.webhookContract());

        assertEquals(List.of("node-1", "node-2", "node-3"),
                graph.getNodes().stream().map(WorkflowNode::getId).collect(Collectors.toList()));
    }

    @Test
    void testRandomIdsAreUnique() {
        GenerationResult result = generator.generate(WorkflowFixtures.webhookContract());
        List<String> ids = result.getWorkflow().orElseThrow().getNodes().stream()
                .map(WorkflowNode::getId)
                .collect(Collectors.toList());

        assertEquals(3, ids.stream().distinct().count());
        ids.forEach(id -> assertTrue(id.matches("node-\\d+-[0-9a-f]{8}"), id));
    }

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        @DisplayName("Conditional node exposes a true branch and an empty false branch")
        void testConditionalOutputs() {
            WorkflowGraph graph = generate(contractWithSteps(
                    new WorkflowStep(1, "If amount > 100", NodeType.IF, "amount > 100"),
                    new WorkflowStep(2, "Store the order", NodeType.SET, null)));

            List<List<Connection>> outputs = graph.getConnections().get("If amount > 100").get(Connection.MAIN);
            assertEquals(2, outputs.size());
            assertEquals("Store the order", outputs.get(0).get(0).toNodeName());
            assertTrue(outputs.get(1).isEmpty());
        }

        @Test
        @DisplayName("Long action text is replaced by type name and step number")
        void testLongNameIsSynthesized() {
            String text = "Call the inventory api to fetch every product that changed since yesterday";
            WorkflowGraph graph = generate(contractWithSteps(new WorkflowStep(4, text, NodeType.HTTP_REQUEST, null)));

            assertEquals("HTTP Request 4", graph.getNodes().get(1).getName());
        }

        @Test
        void testDuplicateNamesAreDisambiguated() {
            WorkflowGraph graph = generate(contractWithSteps(
                    new WorkflowStep(1, "Send slack message", NodeType.SLACK, null),
                    new WorkflowStep(2, "Send slack message", NodeType.SLACK, null)));

            assertEquals(List.of("Manual Trigger", "Send slack message", "Send slack message 2"), names(graph));
        }

        @Test
        @DisplayName("Steps without an inferred type are classified again, falling back to set")
        void testTypeResolution() {
            WorkflowGraph graph = generate(contractWithSteps(
                    new WorkflowStep(1, "Send email to team", null, null),
                    new WorkflowStep(2, "Tidy up records", null, null)));

            assertEquals(NodeType.GMAIL.getTypeName(), graph.getNodes().get(1).getTypeName());
            assertEquals(NodeType.SET.getTypeName(), graph.getNodes().get(2).getTypeName());
        }

        @Test
        @DisplayName("Generated nodes carry the parameters their type requires")
        void testRequiredParametersPresent() {
            WorkflowGraph graph = generate(contractWithSteps(
                    new WorkflowStep(1, "Post order to api", NodeType.HTTP_REQUEST, null),
                    new WorkflowStep(2, "If total > 5", NodeType.IF, "total > 5"),
                    new WorkflowStep(3, "Run script", NodeType.CODE, null),
                    new WorkflowStep(4, "Query database", NodeType.POSTGRES, null),
                    new WorkflowStep(5, "Email the customer", NodeType.GMAIL, null)));

            for (WorkflowNode node : graph.getNodes()) {
                NodeType type = node.getNodeType().orElseThrow();
                for (String parameter : type.getRequiredParameters()) {
                    assertTrue(node.getParameters().containsKey(parameter), node.getName() + " lacks " + parameter);
                }
            }
            assertEquals("POST", graph.getNodes().get(1).getParameters().get("method"));
        }
    }

    @Nested
    @DisplayName("Triggers")
    class Triggers {

        @Test
        void testScheduleTrigger() {
            PromptContract contract = PromptContract.builder()
                    .trigger(PromptTrigger.builder().kind(TriggerKind.SCHEDULE).schedule("0 9 * * *").build())
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .build();

            WorkflowNode trigger = generate(contract).getNodes().get(0);

            assertEquals("Schedule Trigger", trigger.getName());
            assertTrue(trigger.getParameters().get("rule").toString().contains("0 9 * * *"));
        }

        @Test
        @DisplayName("Custom trigger becomes a manual trigger with a warning")
        void testCustomTrigger() {
            PromptContract contract = PromptContract.builder()
                    .trigger(PromptTrigger.builder().kind(TriggerKind.CUSTOM).build())
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .build();

            GenerationResult result = generator.generate(contract, options);

            assertTrue(result.isSuccess());
            assertEquals(NodeType.MANUAL_TRIGGER.getTypeName(),
                    result.getWorkflow().orElseThrow().getNodes().get(0).getTypeName());
            assertEquals(List.of("CUSTOM_TRIGGER"),
                    result.getWarnings().stream().map(Diagnostic::getCode).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Trigger options reach the parameters of every trigger kind")
        void testTriggerOptionsForEveryKind() {
            for (TriggerKind kind : TriggerKind.values()) {
                PromptContract contract = PromptContract.builder()
                        .trigger(PromptTrigger.builder().kind(kind).option("team", "finance").build())
                        .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                        .build();

                WorkflowNode trigger = generate(contract).getNodes().get(0);

                assertEquals("finance", trigger.getParameters().get("team"), kind.name());
            }
        }

        @Test
        void testScheduleKeepsRuleAlongsideOptions() {
            PromptContract contract = PromptContract.builder()
                    .trigger(PromptTrigger.builder().kind(TriggerKind.SCHEDULE).schedule("0 9 * * *")
                            .option("timezone", "UTC").build())
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .build();

            Map<String, Object> parameters = generate(contract).getNodes().get(0).getParameters();

            assertEquals(List.of("rule", "timezone"), List.copyOf(parameters.keySet()));
            assertEquals("UTC", parameters.get("timezone"));
        }

        @Test
        @DisplayName("Webhook without path gets a stable generated path")
        void testDefaultWebhookPath() {
            PromptContract contract = PromptContract.builder()
                    .trigger(PromptTrigger.builder().kind(TriggerKind.WEBHOOK).build())
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .build();

            Object first = generate(contract).getNodes().get(0).getParameters().get("path");
            Object second = generate(contract).getNodes().get(0).getParameters().get("path");

            assertTrue(first.toString().matches("/workflow/[0-9a-f]{8}"), first.toString());
            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Options and constraints")
    class OptionsAndConstraints {

        @Test
        void testMetadataUsesClock() {
            Clock clock = Clock.fixed(Instant.parse("2025-08-17T10:00:00Z"), ZoneOffset.UTC);
            options = options.toBuilder().clock(clock).tag("billing").build();

            WorkflowGraph graph = generate(WorkflowFixtures.webhookContract());

            assertEquals("flowsmith", graph.getMeta().get("generatedBy"));
            assertEquals("1.0.0", graph.getMeta().get("runtimeVersion"));
            assertEquals("2025-08-17T10:00:00Z", graph.getMeta().get("generatedAt"));
            assertEquals(List.of("billing"), graph.getTags());
        }

        @Test
        void testMetadataCanBeDisabled() {
            options = options.toBuilder().includeMetadata(false).workflowName("Orders").build();

            WorkflowGraph graph = generate(WorkflowFixtures.webhookContract());

            assertTrue(graph.getMeta().isEmpty());
            assertEquals("Orders", graph.getName());
        }

        @Test
        @DisplayName("Constraint hints surface as warnings without blocking generation")
        void testConstraintWarnings() {
            PromptContract contract = PromptContract.builder()
                    .trigger(PromptTrigger.builder().kind(TriggerKind.WEBHOOK).path("/x").build())
                    .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                    .step(new WorkflowStep(2, "Send slack message", NodeType.SLACK, null))
                    .constraints(PromptConstraints.builder()
                            .maxNodes(2)
                            .forbiddenType(NodeType.SLACK.getTypeName())
                            .build())
                    .build();

            GenerationResult result = generator.generate(contract, options);

            assertTrue(result.isSuccess());
            List<String> codes = result.getWarnings().stream().map(Diagnostic::getCode).collect(Collectors.toList());
            assertTrue(codes.contains("MAX_NODES_EXCEEDED"));
            assertTrue(codes.contains("FORBIDDEN_NODE_TYPE"));
        }

        @Test
        void testNullContractRejected() {
            assertThrows(NullPointerException.class, () -> generator.generate(null, options));
        }
    }
}
