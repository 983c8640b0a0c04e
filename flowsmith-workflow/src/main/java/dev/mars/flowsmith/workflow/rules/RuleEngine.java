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

import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.core.DiagnosticKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes the rules of a {@link RuleRegistry} against a {@link RuleContext} and aggregates
 * the results. The engine never throws on a failing or broken rule: every problem is
 * reported as data in the {@link EngineReport}. A rule that exhausts the thread stack is
 * reported the same way as one that throws a runtime exception.
 *
 * <p>Rules run in category order (input, structural, node, flow, output). Error-severity
 * failures become report errors; warning and info failures become warnings.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RuleEngine {

    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    public static final String RULE_EXECUTION_ERROR = "RULE_EXECUTION_ERROR";
    public static final String MAX_ERRORS_REACHED = "MAX_ERRORS_REACHED";

    private final RuleRegistry registry;
    private final EngineConfig config;

    public RuleEngine() {
        this(EngineConfig.defaults());
    }

    public RuleEngine(EngineConfig config) {
        this(RuleRegistry.withDefaultRules(config), config);
    }

    public RuleEngine(RuleRegistry registry, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry, "Rule registry cannot be null");
        this.config = Objects.requireNonNull(config, "Engine config cannot be null");
    }

    public void registerRule(Rule rule) {
        registry.register(rule);
    }

    public void registerRules(Collection<? extends Rule> rules) {
        registry.registerRules(rules);
    }

    public boolean unregisterRule(String ruleId) {
        return registry.unregister(ruleId);
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Runs every enabled rule of every enabled category.
     */
    public EngineReport execute(RuleContext context) {
        Objects.requireNonNull(context, "Rule context cannot be null");
        List<Rule> rules = new ArrayList<>();
        for (Rule rule : registry.orderedRules()) {
            if (config.isCategoryEnabled(rule.getCategory())) {
                rules.add(rule);
            }
        }
        return run(rules, context, "all");
    }

    /**
     * Runs the enabled rules of one category. The category runs even when it is not
     * part of the configured enabled set.
     */
    public EngineReport executeCategory(RuleCategory category, RuleContext context) {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(context, "Rule context cannot be null");
        return run(registry.rulesFor(category), context, category.getLabel());
    }

    private EngineReport run(List<Rule> rules, RuleContext context, String scope) {
        long start = System.currentTimeMillis();
        RuleContext effective = config.isStrictMode() && !context.isStrictMode()
                ? context.toBuilder().strictMode(true).build()
                : context;

        List<RuleResult> results = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();

        for (int index = 0; index < rules.size(); index++) {
            Rule rule = rules.get(index);
            if (!rule.isEnabled()) {
                logger.fine("Skipping disabled rule " + rule.getId());
                continue;
            }

            RuleResult result = evaluate(rule, effective);
            results.add(result);
            logger.fine("Rule " + rule.getId() + (result.passed() ? " passed" : " failed: " + result.message()));
            if (result.passed()) {
                continue;
            }

            if (result.severity() == RuleSeverity.ERROR) {
                errors.add(toDiagnostic(result));
                if (config.isFailFast()) {
                    logger.fine("Fail-fast stop after rule " + rule.getId());
                    break;
                }
                if (errors.size() >= config.getMaxErrors()) {
                    if (rules.subList(index + 1, rules.size()).stream().noneMatch(Rule::isEnabled)) {
                        break;
                    }
                    warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, DiagnosticKind.EXECUTION,
                            MAX_ERRORS_REACHED, -1, -1, null,
                            "Maximum errors (" + config.getMaxErrors() + ") reached, stopping rule execution"));
                    break;
                }
            } else {
                warnings.add(toDiagnostic(result));
            }
        }

        EngineReport report = new EngineReport(results, errors, warnings, System.currentTimeMillis() - start);
        logger.info("Rule engine run (" + scope + ") finished: " + report.getPassedRules() + "/"
                + report.getTotalRules() + " passed, " + errors.size() + " errors, "
                + warnings.size() + " warnings");
        return report;
    }

    private RuleResult evaluate(Rule rule, RuleContext context) {
        try {
            RuleResult result = rule.evaluate(context);
            if (result == null) {
                throw new IllegalStateException("Rule returned no result");
            }
            return result;
        } catch (RuntimeException | StackOverflowError e) {
            logger.log(Level.WARNING, "Rule " + rule.getId() + " threw an exception", e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new RuleResult(rule.getId(), rule.getName(), rule.getCategory(), false, RuleSeverity.ERROR,
                    "Rule execution failed: " + reason,
                    Map.of("code", RULE_EXECUTION_ERROR, "exception", e.getClass().getName()),
                    List.of());
        }
    }

    private static Diagnostic toDiagnostic(RuleResult result) {
        boolean executionError = RULE_EXECUTION_ERROR.equals(result.details().get("code"));
        Diagnostic.Severity severity = result.severity() == RuleSeverity.ERROR
                ? Diagnostic.Severity.ERROR
                : Diagnostic.Severity.WARNING;
        String message = result.message();
        if (!executionError && !result.suggestions().isEmpty()) {
            message = message + " (suggestions: " + String.join("; ", result.suggestions()) + ")";
        }
        return new Diagnostic(severity,
                executionError ? DiagnosticKind.EXECUTION : result.category().getDiagnosticKind(),
                executionError ? RULE_EXECUTION_ERROR : result.ruleId(),
                -1, -1, result.ruleId(), message);
    }

    @Override
    public String toString() {
        return "RuleEngine{" +
               "registry=" + registry +
               ", config=" + config +
               '}';
    }
}
