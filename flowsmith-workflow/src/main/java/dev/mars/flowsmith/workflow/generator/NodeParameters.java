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

import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.graph.NodeType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default parameter blocks for generated step nodes. Every block carries the parameters the node
 * catalog marks as required for its type. Nested ids are derived from the node id so output is
 * reproducible whenever node ids are.
 */
final class NodeParameters {

    private static final Pattern HTTP_VERB = Pattern.compile("(?i)\\b(post|put|patch|delete)\\b");
    private static final String PLACEHOLDER_URL = "={{ $json.url || \"https://api.example.com\" }}";
    private static final String CODE_TEMPLATE = String.join("\n",
            "// Generated code placeholder",
            "const items = $input.all();",
            "for (const item of items) {",
            "  item.json.processed = true;",
            "}",
            "return items;");

    private NodeParameters() {
    }

    static Map<String, Object> forStep(NodeType type, WorkflowStep step, String nodeId) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        switch (type) {
            case HTTP_REQUEST:
                parameters.put("method", httpMethod(step.getActionText()));
                parameters.put("url", PLACEHOLDER_URL);
                parameters.put("options", Map.of());
                break;
            case IF:
                parameters.put("conditions", ifConditions(nodeId));
                parameters.put("options", Map.of());
                break;
            case SWITCH:
                parameters.put("mode", "rules");
                parameters.put("rules", Map.of("values", List.of(orderedMap(
                        "outputKey", "default",
                        "conditions", ifConditions(nodeId)))));
                break;
            case SET:
                parameters.put("mode", "manual");
                parameters.put("duplicateItem", false);
                parameters.put("assignments", Map.of("assignments", List.of(orderedMap(
                        "id", nodeId + "-assignment-1",
                        "name", "data",
                        "value", "={{ $json }}",
                        "type", "any"))));
                parameters.put("options", Map.of());
                break;
            case CODE:
                parameters.put("jsCode", CODE_TEMPLATE);
                break;
            case FUNCTION:
            case FUNCTION_ITEM:
                parameters.put("functionCode", CODE_TEMPLATE);
                break;
            case GMAIL:
                parameters.put("operation", "send");
                parameters.put("sendTo", "={{ $json.email || \"recipient@example.com\" }}");
                parameters.put("subject", "={{ $json.subject || \"Notification\" }}");
                parameters.put("message", "={{ $json.message || \"Hello\" }}");
                parameters.put("options", Map.of());
                break;
            case SLACK:
                parameters.put("operation", "sendMessage");
                parameters.put("channel", "={{ $json.channel || \"#general\" }}");
                parameters.put("text", "={{ $json.message || \"Notification\" }}");
                parameters.put("otherOptions", Map.of());
                break;
            case POSTGRES:
                parameters.put("operation", "executeQuery");
                parameters.put("query", "SELECT * FROM items LIMIT 100");
                parameters.put("options", Map.of());
                break;
            case GOOGLE_SHEETS:
                parameters.put("operation", "append");
                parameters.put("options", Map.of());
                break;
            case MERGE:
                parameters.put("mode", "append");
                break;
            case WAIT:
                parameters.put("resume", "timeInterval");
                parameters.put("amount", 1);
                parameters.put("unit", "minutes");
                break;
            case RESPOND_TO_WEBHOOK:
                parameters.put("respondWith", "allIncomingItems");
                parameters.put("options", Map.of());
                break;
            default:
                break;
        }
        return parameters;
    }

    static String httpMethod(String actionText) {
        Matcher matcher = HTTP_VERB.matcher(actionText);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : "GET";
    }

    private static Map<String, Object> ifConditions(String nodeId) {
        return orderedMap(
                "options", orderedMap("caseSensitive", true, "leftValue", ""),
                "conditions", List.of(orderedMap(
                        "id", nodeId + "-condition-1",
                        "leftValue", "={{ $json.condition }}",
                        "rightValue", "true",
                        "operator", orderedMap("type", "string", "operation", "equals"))),
                "combinator", "and");
    }

    /**
     * Insertion-ordered map from alternating keys and values, so JSON output keeps a stable field order.
     */
    static Map<String, Object> orderedMap(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
