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

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.TriggerKind;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.workflow.rules.AbstractRule;
import dev.mars.flowsmith.workflow.rules.Rule;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import dev.mars.flowsmith.workflow.rules.RuleSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Completeness checks over the prompt contract. These run first because they need no graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class InputRules {

    public static final List<String> SUPPORTED_VERSIONS = List.of("1.0.0", "1.1.0", "1.2.0");

    private static final Pattern VERSION_FORMAT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private InputRules() {
    }

    public static List<Rule> create() {
        return List.of(
                new MetaExistsRule(),
                new VersionFormatRule(),
                new SupportedVersionRule(),
                new TriggerExistsRule(),
                new WorkflowExistsRule(),
                new StrictNoAmbiguityRule());
    }

    /**
     * Meta is optional outside strict mode, where the defaults apply.
     */
    public static final class MetaExistsRule extends AbstractRule {

        public MetaExistsRule() {
            super("input-meta-exists", "Meta Exists",
                    "Validates that the @meta section is declared when strict mode requires it",
                    RuleCategory.INPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withContract(context, contract -> {
                if (contract.isDeclared(ContractSection.META)) {
                    return pass("Meta section exists");
                }
                if (context.isStrictMode()) {
                    return fail("Missing @meta section in prompt", Map.of("section", "meta"),
                            List.of("Add an @meta section with runtime_version, output and strict"));
                }
                return pass("Meta section not declared, defaults apply");
            });
        }
    }

    public static final class VersionFormatRule extends AbstractRule {

        public VersionFormatRule() {
            super("input-version-format", "Runtime Version Format",
                    "Validates that the target runtime version has the form major.minor.patch",
                    RuleCategory.INPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            Optional<String> version = context.getTargetVersion();
            if (version.isEmpty()) {
                return fail("Runtime version not specified", Map.of(),
                        List.of("Specify runtime_version in the @meta section"));
            }
            if (!VERSION_FORMAT.matcher(version.get()).matches()) {
                return fail("Invalid runtime version format: " + version.get(),
                        Map.of("providedVersion", version.get()),
                        List.of("Use the form major.minor.patch, for example 1.0.0"));
            }
            return pass("Runtime version " + version.get() + " is well formed");
        }
    }

    public static final class SupportedVersionRule extends AbstractRule {

        public SupportedVersionRule() {
            super("input-supported-version", "Supported Runtime Version",
                    "Validates that the target runtime version is one of the supported versions",
                    RuleCategory.INPUT, RuleSeverity.WARNING);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            Optional<String> version = context.getTargetVersion();
            if (version.isEmpty()) {
                return fail("Runtime version not specified", Map.of(),
                        List.of("Specify runtime_version in the @meta section"));
            }
            if (!SUPPORTED_VERSIONS.contains(version.get())) {
                return fail("Unsupported runtime version: " + version.get(),
                        Map.of("providedVersion", version.get(), "supportedVersions", SUPPORTED_VERSIONS),
                        List.of("Use one of the supported versions: " + String.join(", ", SUPPORTED_VERSIONS)));
            }
            return pass("Runtime version " + version.get() + " is supported");
        }
    }

    public static final class TriggerExistsRule extends AbstractRule {

        public TriggerExistsRule() {
            super("input-trigger-exists", "Trigger Exists",
                    "Validates that a trigger with a recognized kind is declared",
                    RuleCategory.INPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withContract(context, contract -> {
                if (!contract.isDeclared(ContractSection.TRIGGER)) {
                    return fail("Missing @trigger section in prompt", Map.of("section", "trigger"),
                            List.of("Add an @trigger section with a type (webhook, schedule or manual)"));
                }
                return pass("Trigger section exists (" + contract.getTrigger().getKind().getLabel() + ")");
            });
        }
    }

    public static final class WorkflowExistsRule extends AbstractRule {

        public WorkflowExistsRule() {
            super("input-workflow-exists", "Workflow Steps Exist",
                    "Validates that workflow steps are defined",
                    RuleCategory.INPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            return withContract(context, contract -> {
                if (!contract.isDeclared(ContractSection.WORKFLOW)) {
                    return fail("Missing @workflow section or empty workflow", Map.of("section", "workflow"),
                            List.of("Add an @workflow section with numbered steps"));
                }
                return pass("Found " + contract.getSteps().size() + " workflow steps");
            });
        }
    }

    public static final class StrictNoAmbiguityRule extends AbstractRule {

        public StrictNoAmbiguityRule() {
            super("input-strict-no-ambiguity", "Strict Mode No Ambiguity",
                    "In strict mode, rejects ambiguous triggers and steps",
                    RuleCategory.INPUT, RuleSeverity.ERROR);
        }

        @Override
        public RuleResult evaluate(RuleContext context) {
            if (!context.isStrictMode()) {
                return pass("Not in strict mode, ambiguity not checked");
            }
            return withContract(context, contract -> {
                List<String> ambiguities = new ArrayList<>();
                for (WorkflowStep step : contract.getSteps()) {
                    if (step.getInferredNodeType().isEmpty() && step.getActionText().isBlank()) {
                        ambiguities.add("Step " + step.getNumber() + ": no clear action or node type");
                    }
                }
                PromptTrigger trigger = contract.getTrigger();
                if (trigger.getKind() == TriggerKind.WEBHOOK && trigger.getPath().isEmpty()) {
                    ambiguities.add("Webhook trigger without path");
                }
                if (ambiguities.isEmpty()) {
                    return pass("No ambiguities found in strict mode");
                }
                return fail("Strict mode: " + ambiguities.size() + " ambiguities found",
                        Map.of("ambiguities", ambiguities),
                        ambiguities.stream().map(item -> "Resolve: " + item).collect(Collectors.toList()));
            });
        }
    }
}
