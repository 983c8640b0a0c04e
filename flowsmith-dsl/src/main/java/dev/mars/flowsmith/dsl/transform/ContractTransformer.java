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

package dev.mars.flowsmith.dsl.transform;

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.contract.PromptAssumptions;
import dev.mars.flowsmith.contract.PromptConstraints;
import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.PromptMeta;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.CompilerOptions;
import dev.mars.flowsmith.dsl.ast.DocumentNode;
import dev.mars.flowsmith.dsl.ast.SectionNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Walks a parsed document and produces a {@link PromptContract}.
 * <p>
 * Each section is handed to its extractor. A missing {@code @trigger} or an empty
 * {@code @workflow} is a completeness error and no contract is produced; a missing {@code @meta}
 * is an error only in strict mode. Missing {@code @constraints} and {@code @assumptions} are
 * reported as warnings and default to empty records.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ContractTransformer {

    private static final Logger logger = Logger.getLogger(ContractTransformer.class.getName());

    private final SectionExtractor<PromptMeta> metaExtractor = new MetaExtractor();
    private final SectionExtractor<PromptTrigger> triggerExtractor = new TriggerExtractor();
    private final SectionExtractor<List<WorkflowStep>> workflowExtractor = new WorkflowExtractor();
    private final SectionExtractor<PromptConstraints> constraintsExtractor = new ConstraintsExtractor();
    private final SectionExtractor<PromptAssumptions> assumptionsExtractor = new AssumptionsExtractor();

    public TransformResult transformToContract(DocumentNode ast, CompilerOptions options) {
        Objects.requireNonNull(ast, "AST cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        Diagnostics diagnostics = new Diagnostics(options.getMaxErrors());
        PromptContract.Builder contract = PromptContract.builder();

        Optional<SectionNode> meta = ast.section(ContractSection.META);
        if (meta.isPresent()) {
            contract.meta(metaExtractor.extract(meta.get(), diagnostics)).declared(ContractSection.META);
        } else if (options.isStrictMode()) {
            missing(ContractSection.META, "MISSING_META", diagnostics);
        }

        Optional<SectionNode> trigger = ast.section(ContractSection.TRIGGER);
        if (trigger.isPresent()) {
            contract.trigger(triggerExtractor.extract(trigger.get(), diagnostics)).declared(ContractSection.TRIGGER);
        } else {
            missing(ContractSection.TRIGGER, "MISSING_TRIGGER", diagnostics);
        }

        Optional<SectionNode> workflow = ast.section(ContractSection.WORKFLOW);
        List<WorkflowStep> steps = List.of();
        if (workflow.isPresent()) {
            steps = workflowExtractor.extract(workflow.get(), diagnostics);
            contract.declared(ContractSection.WORKFLOW);
            if (steps.isEmpty()) {
                diagnostics.addError(DiagnosticKind.COMPLETENESS, "MISSING_WORKFLOW",
                        workflow.get().span().startLine(), workflow.get().span().startColumn(),
                        ContractSection.WORKFLOW.getMarker(),
                        "Section " + ContractSection.WORKFLOW.getMarker() + " contains no steps");
            }
        } else {
            missing(ContractSection.WORKFLOW, "MISSING_WORKFLOW", diagnostics);
        }

        Optional<SectionNode> constraints = ast.section(ContractSection.CONSTRAINTS);
        if (constraints.isPresent()) {
            contract.constraints(constraintsExtractor.extract(constraints.get(), diagnostics))
                    .declared(ContractSection.CONSTRAINTS);
        } else {
            defaulted(ContractSection.CONSTRAINTS, diagnostics);
        }

        Optional<SectionNode> assumptions = ast.section(ContractSection.ASSUMPTIONS);
        if (assumptions.isPresent()) {
            contract.assumptions(assumptionsExtractor.extract(assumptions.get(), diagnostics))
                    .declared(ContractSection.ASSUMPTIONS);
        } else {
            defaulted(ContractSection.ASSUMPTIONS, diagnostics);
        }

        if (!diagnostics.isValid()) {
            logger.fine("Contract not produced: " + diagnostics);
            return new TransformResult(null, diagnostics.getErrors(), diagnostics.getWarnings());
        }
        PromptContract built = contract.steps(steps).build();
        return new TransformResult(built, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    private static void missing(ContractSection section, String code, Diagnostics diagnostics) {
        diagnostics.addError(DiagnosticKind.COMPLETENESS, code, section.getMarker(),
                "Missing required section " + section.getMarker());
    }

    private static void defaulted(ContractSection section, Diagnostics diagnostics) {
        diagnostics.addWarning(DiagnosticKind.COMPLETENESS, "MISSING_SECTION", section.getMarker(),
                "Section " + section.getMarker() + " not found; using defaults");
    }
}
