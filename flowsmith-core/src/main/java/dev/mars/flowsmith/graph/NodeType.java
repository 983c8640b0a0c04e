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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of the node types the generator emits and the validators understand.
 * <p>
 * The catalog is a representative subset of the target runtime's nodes. Graphs may reference
 * type names outside it; those resolve to {@link Optional#empty()} from {@link #fromTypeName(String)}
 * and are preserved untouched.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum NodeType {
    MANUAL_TRIGGER("manualTrigger", "Manual Trigger", 1, NodeCategory.TRIGGER, false, List.of()),
    WEBHOOK("webhook", "Webhook", 2, NodeCategory.TRIGGER, false, List.of("httpMethod", "path")),
    SCHEDULE_TRIGGER("scheduleTrigger", "Schedule Trigger", 1, NodeCategory.TRIGGER, false, List.of("rule")),
    CRON("cron", "Cron", 1, NodeCategory.TRIGGER, false, List.of("triggerTimes")),
    HTTP_REQUEST("httpRequest", "HTTP Request", 4, NodeCategory.INTEGRATION, true, List.of("method", "url")),
    CODE("code", "Code", 2, NodeCategory.CORE, true, List.of("jsCode")),
    FUNCTION("function", "Function", 1, NodeCategory.CORE, true, List.of("functionCode")),
    FUNCTION_ITEM("functionItem", "Function Item", 1, NodeCategory.CORE, true, List.of("functionCode")),
    SET("set", "Set", 3, NodeCategory.DATA, true, List.of("assignments")),
    IF("if", "IF", 2, NodeCategory.FLOW, false, List.of("conditions")),
    SWITCH("switch", "Switch", 3, NodeCategory.FLOW, false, List.of("rules")),
    MERGE("merge", "Merge", 3, NodeCategory.FLOW, false, List.of("mode")),
    WAIT("wait", "Wait", 1, NodeCategory.FLOW, false, List.of("resume")),
    NO_OP("noOp", "No Operation", 1, NodeCategory.CORE, true, List.of()),
    GMAIL("gmail", "Gmail", 2, NodeCategory.INTEGRATION, true, List.of("sendTo", "subject", "message")),
    SLACK("slack", "Slack", 2, NodeCategory.INTEGRATION, true, List.of("channel", "text")),
    POSTGRES("postgres", "Postgres", 2, NodeCategory.DATA, true, List.of("operation", "query")),
    GOOGLE_SHEETS("googleSheets", "Google Sheets", 4, NodeCategory.DATA, true, List.of("operation")),
    RESPOND_TO_WEBHOOK("respondToWebhook", "Respond to Webhook", 1, NodeCategory.CORE, true, List.of("respondWith"));

    public static final String TYPE_PREFIX = "n8n-nodes-base.";

    private final String shortName;
    private final String displayName;
    private final int version;
    private final NodeCategory category;
    private final boolean terminal;
    private final List<String> requiredParameters;

    NodeType(String shortName, String displayName, int version, NodeCategory category,
             boolean terminal, List<String> requiredParameters) {
        this.shortName = shortName;
        this.displayName = displayName;
        this.version = version;
        this.category = category;
        this.terminal = terminal;
        this.requiredParameters = requiredParameters;
    }

    /**
     * @return the fully qualified runtime type, e.g. {@code n8n-nodes-base.httpRequest}
     */
    public String getTypeName() {
        return TYPE_PREFIX + shortName;
    }

    public String getShortName() {
        return shortName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getVersion() {
        return version;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public boolean isTrigger() {
        return category == NodeCategory.TRIGGER;
    }

    /**
     * Terminal types may legitimately end a flow without an outgoing connection.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public List<String> getRequiredParameters() {
        return requiredParameters;
    }

    /**
     * @return number of output ports the generator wires for this type
     */
    public int getOutputCount() {
        return this == IF ? 2 : 1;
    }

    /**
     * Resolves a type by its qualified or short name. Short names are matched ignoring case.
     */
    public static Optional<NodeType> fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return Optional.empty();
        }
        String name = typeName.trim();
        if (name.startsWith(TYPE_PREFIX)) {
            name = name.substring(TYPE_PREFIX.length());
        }
        for (NodeType type : values()) {
            if (type.shortName.equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Trigger detection that also accepts uncatalogued runtime triggers, which by convention
     * carry a {@code Trigger} suffix.
     */
    public static boolean isTriggerType(String typeName) {
        Optional<NodeType> known = fromTypeName(typeName);
        if (known.isPresent()) {
            return known.get().isTrigger();
        }
        return typeName != null && typeName.toLowerCase(Locale.ROOT).endsWith("trigger");
    }
}
