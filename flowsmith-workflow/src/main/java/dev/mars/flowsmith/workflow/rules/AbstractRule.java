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

package dev.mars.flowsmith.workflow.rules;

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.graph.WorkflowGraph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class holding a rule's descriptor and helpers for building results.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public abstract class AbstractRule implements Rule {

    private final String id;
    private final String name;
    private final String description;
    private final RuleCategory category;
    private final RuleSeverity severity;
    private final boolean enabled;

    protected AbstractRule(String id, String name, String description, RuleCategory category, RuleSeverity severity) {
        this(id, name, description, category, severity, true);
    }

    protected AbstractRule(String id, String name, String description, RuleCategory category,
                           RuleSeverity severity, boolean enabled) {
        this.id = Objects.requireNonNull(id, "Rule id cannot be null");
        this.name = Objects.requireNonNull(name, "Rule name cannot be null");
        this.description = description != null ? description : "";
        this.category = Objects.requireNonNull(category, "Rule category cannot be null");
        this.severity = Objects.requireNonNull(severity, "Rule severity cannot be null");
        this.enabled = enabled;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public RuleCategory getCategory() {
        return category;
    }

    @Override
    public RuleSeverity getSeverity() {
        return severity;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    protected RuleResult pass(String message) {
        return new RuleResult(id, name, category, true, severity, message, Map.of(), List.of());
    }

    protected RuleResult fail(String message) {
        return fail(message, Map.of(), List.of());
    }

    protected RuleResult fail(String message, Map<String, Object> details, List<String> suggestions) {
        return new RuleResult(id, name, category, false, severity, message, details, suggestions);
    }

    /**
     * Evaluates a graph check, failing when the context carries no graph.
     */
    protected RuleResult withGraph(RuleContext context, GraphCheck check) {
        return context.getWorkflowGraph()
                .map(check::apply)
                .orElseGet(() -> fail("Workflow graph is required for this rule"));
    }

    /**
     * Evaluates a contract check, failing when the context carries no contract.
     */
    protected RuleResult withContract(RuleContext context, ContractCheck check) {
        return context.getPromptContract()
                .map(check::apply)
                .orElseGet(() -> fail("Prompt contract is required for this rule"));
    }

    @FunctionalInterface
    protected interface GraphCheck {
        RuleResult apply(WorkflowGraph graph);
    }

    @FunctionalInterface
    protected interface ContractCheck {
        RuleResult apply(PromptContract contract);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "id='" + id + '\'' +
               ", category=" + category +
               ", severity=" + severity +
               ", enabled=" + enabled +
               '}';
    }
}
