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

package dev.mars.flowsmith.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowsmith.core.exceptions.WorkflowCodecException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts workflow graphs to and from the runtime's import JSON:
 * <pre>
 * { name, nodes: [{id, name, type, typeVersion, position: [x, y], parameters}],
 *   connections: { nodeName: { port: [[{node, type, index}]] } }, active, settings }
 * </pre>
 * Field names are fixed; external importers depend on them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowJsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public WorkflowJsonCodec() {
        this(new ObjectMapper());
    }

    public WorkflowJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public ObjectNode toJson(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", graph.getName());

        ArrayNode nodes = root.putArray("nodes");
        for (WorkflowNode node : graph.getNodes()) {
            ObjectNode json = nodes.addObject();
            json.put("id", node.getId());
            json.put("name", node.getName());
            json.put("type", node.getTypeName());
            putNumber(json, "typeVersion", node.getTypeVersion());
            ArrayNode position = json.putArray("position");
            addNumber(position, node.getPosition().x());
            addNumber(position, node.getPosition().y());
            json.set("parameters", objectMapper.valueToTree(node.getParameters()));
        }

        ObjectNode connections = root.putObject("connections");
        graph.getConnections().forEach((source, ports) -> {
            ObjectNode portsJson = connections.putObject(source);
            ports.forEach((port, outputs) -> {
                ArrayNode outputsJson = portsJson.putArray(port);
                for (List<Connection> targets : outputs) {
                    ArrayNode targetsJson = outputsJson.addArray();
                    for (Connection connection : targets) {
                        ObjectNode target = targetsJson.addObject();
                        target.put("node", connection.toNodeName());
                        target.put("type", connection.outputPort());
                        target.put("index", connection.inputIndex());
                    }
                }
            });
        });

        root.put("active", graph.isActive());
        root.set("settings", objectMapper.valueToTree(graph.getSettings()));
        if (!graph.getMeta().isEmpty()) {
            root.set("meta", objectMapper.valueToTree(graph.getMeta()));
        }
        if (!graph.getTags().isEmpty()) {
            root.set("tags", objectMapper.valueToTree(graph.getTags()));
        }
        return root;
    }

    public String toJsonString(WorkflowGraph graph, boolean pretty) throws WorkflowCodecException {
        try {
            ObjectNode json = toJson(graph);
            return pretty
                    ? objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(json)
                    : objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WorkflowCodecException("Failed to serialize workflow graph: " + e.getMessage(), null, e);
        }
    }

    public WorkflowGraph fromJsonString(String json) throws WorkflowCodecException {
        if (json == null || json.isBlank()) {
            throw new WorkflowCodecException("Workflow JSON cannot be empty");
        }
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new WorkflowCodecException("Invalid workflow JSON: " + e.getOriginalMessage(), null, e);
        }
    }

    public WorkflowGraph fromJson(JsonNode root) throws WorkflowCodecException {
        if (root == null || !root.isObject()) {
            throw new WorkflowCodecException("Workflow JSON must be an object", "$");
        }
        WorkflowGraph.Builder builder = WorkflowGraph.builder()
                .name(root.path("name").isTextual() ? root.get("name").asText() : null)
                .active(root.path("active").asBoolean(false));

        JsonNode nodes = root.get("nodes");
        if (nodes == null || !nodes.isArray()) {
            throw new WorkflowCodecException("Workflow JSON requires a 'nodes' array", "nodes");
        }
        for (int i = 0; i < nodes.size(); i++) {
            builder.node(readNode(nodes.get(i), "nodes[" + i + "]"));
        }

        JsonNode connections = root.get("connections");
        if (connections == null || !connections.isObject()) {
            throw new WorkflowCodecException("Workflow JSON requires a 'connections' object", "connections");
        }
        readConnections(connections, builder);

        if (root.has("settings")) {
            builder.settings(toMap(root.get("settings"), "settings"));
        }
        if (root.has("meta")) {
            builder.meta(toMap(root.get("meta"), "meta"));
        }
        JsonNode tags = root.get("tags");
        if (tags != null && tags.isArray()) {
            for (JsonNode tag : tags) {
                builder.tag(tag.isObject() ? tag.path("name").asText() : tag.asText());
            }
        }
        return builder.build();
    }

    private WorkflowNode readNode(JsonNode node, String path) throws WorkflowCodecException {
        if (!node.isObject()) {
            throw new WorkflowCodecException("Node must be an object", path);
        }
        if (!node.path("name").isTextual()) {
            throw new WorkflowCodecException("Node requires a textual 'name'", path + ".name");
        }
        if (!node.path("type").isTextual()) {
            throw new WorkflowCodecException("Node requires a textual 'type'", path + ".type");
        }
        Position position = Position.ORIGIN;
        JsonNode positionJson = node.get("position");
        if (positionJson != null) {
            if (!positionJson.isArray() || positionJson.size() != 2
                    || !positionJson.get(0).isNumber() || !positionJson.get(1).isNumber()) {
                throw new WorkflowCodecException("Node position must be [x, y]", path + ".position");
            }
            position = new Position(positionJson.get(0).asDouble(), positionJson.get(1).asDouble());
        }
        Map<String, Object> parameters = node.has("parameters")
                ? toMap(node.get("parameters"), path + ".parameters")
                : Map.of();
        return new WorkflowNode(
                node.path("id").asText(""),
                node.get("name").asText(),
                node.get("type").asText(),
                node.path("typeVersion").asDouble(1),
                position,
                parameters);
    }

    private void readConnections(JsonNode connections, WorkflowGraph.Builder builder) throws WorkflowCodecException {
        Iterator<Map.Entry<String, JsonNode>> sources = connections.fields();
        while (sources.hasNext()) {
            Map.Entry<String, JsonNode> source = sources.next();
            String sourcePath = "connections." + source.getKey();
            if (!source.getValue().isObject()) {
                throw new WorkflowCodecException("Connection entry must be an object", sourcePath);
            }
            Iterator<Map.Entry<String, JsonNode>> ports = source.getValue().fields();
            while (ports.hasNext()) {
                Map.Entry<String, JsonNode> port = ports.next();
                String portPath = sourcePath + "." + port.getKey();
                if (!port.getValue().isArray()) {
                    throw new WorkflowCodecException("Connection port must be an array of outputs", portPath);
                }
                builder.declareOutputs(source.getKey(), port.getKey(), port.getValue().size());
                for (int outputIndex = 0; outputIndex < port.getValue().size(); outputIndex++) {
                    JsonNode targets = port.getValue().get(outputIndex);
                    String outputPath = portPath + "[" + outputIndex + "]";
                    if (!targets.isArray()) {
                        throw new WorkflowCodecException("Connection output must be an array", outputPath);
                    }
                    for (JsonNode target : targets) {
                        if (!target.path("node").isTextual()) {
                            throw new WorkflowCodecException("Connection target requires a textual 'node'", outputPath);
                        }
                        int inputIndex = target.path("index").asInt(0);
                        if (inputIndex < 0) {
                            throw new WorkflowCodecException("Connection input index cannot be negative", outputPath);
                        }
                        builder.connect(new Connection(
                                source.getKey(),
                                target.get("node").asText(),
                                target.path("type").asText(port.getKey()),
                                outputIndex,
                                inputIndex));
                    }
                }
            }
        }
    }

    private Map<String, Object> toMap(JsonNode node, String path) throws WorkflowCodecException {
        if (!node.isObject()) {
            throw new WorkflowCodecException("Expected a JSON object", path);
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static void putNumber(ObjectNode json, String field, double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            json.put(field, (long) value);
        } else {
            json.put(field, value);
        }
    }

    private static void addNumber(ArrayNode json, double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            json.add((long) value);
        } else {
            json.add(value);
        }
    }
}
