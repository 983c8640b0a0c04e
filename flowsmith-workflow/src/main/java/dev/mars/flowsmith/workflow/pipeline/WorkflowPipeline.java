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

package dev.mars.flowsmith.workflow.pipeline;

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.dsl.CompileResult;
import dev.mars.flowsmith.dsl.CompilerOptions;
import dev.mars.flowsmith.dsl.DslCompiler;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.graph.WorkflowJsonCodec;
import dev.mars.flowsmith.workflow.config.FlowsmithConfiguration;
import dev.mars.flowsmith.workflow.generator.GenerationResult;
import dev.mars.flowsmith.workflow.generator.GeneratorOptions;
import dev.mars.flowsmith.workflow.generator.WorkflowGenerator;
import dev.mars.flowsmith.workflow.observability.WorkflowMetrics;
import dev.mars.flowsmith.workflow.rules.EngineReport;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleEngine;
import dev.mars.flowsmith.workflow.rules.RuleResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Facade running DSL text through compilation, workflow generation and rule validation.
 *
 * <p>The optional schema validator and suggestion provider are external collaborators.
 * When either throws, the failure is logged and reported as a warning; the run itself
 * continues with what the core produced.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowPipeline {

    private static final Logger logger = Logger.getLogger(WorkflowPipeline.class.getName());

    public static final String SCHEMA_INVALID = "SCHEMA_INVALID";
    public static final String SCHEMA_VALIDATOR_FAILED = "SCHEMA_VALIDATOR_FAILED";
    public static final String SUGGESTION_FAILED = "SUGGESTION_FAILED";

    private final DslCompiler compiler;
    private final CompilerOptions compilerOptions;
    private final WorkflowGenerator generator;
    private final GeneratorOptions generatorOptions;
    private final RuleEngine ruleEngine;
    private final WorkflowJsonCodec codec;
    private final GraphSchemaValidator schemaValidator;
    private final SuggestionProvider suggestionProvider;
    private final boolean metricsEnabled;

    private WorkflowPipeline(Builder builder) {
        this.compiler = builder.compiler;
        this.compilerOptions = builder.compilerOptions;
        this.generator = builder.generator;
        this.generatorOptions = builder.generatorOptions;
        this.ruleEngine = builder.ruleEngine;
        this.codec = builder.codec;
        this.schemaValidator = builder.schemaValidator;
        this.suggestionProvider = builder.suggestionProvider;
        this.metricsEnabled = builder.metricsEnabled;
    }

    /**
     * Builds a pipeline whose stages are configured from the given configuration.
     */
    public static WorkflowPipeline fromConfiguration(FlowsmithConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        logger.fine("Creating pipeline from " + configuration);
        return builder()
                .compilerOptions(configuration.toCompilerOptions())
                .generatorOptions(configuration.toGeneratorOptions())
                .ruleEngine(new RuleEngine(configuration.toEngineConfig()))
                .metricsEnabled(configuration.isMetricsEnabled())
                .build();
    }

    /**
     * Compiles the text, generates a workflow from the contract and validates both.
     */
    public PipelineResult run(String text) {
        Objects.requireNonNull(text, "DSL text cannot be null");
        long start = System.currentTimeMillis();
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();

        CompileResult compiled = compiler.compile(text, compilerOptions);
        if (metricsEnabled) {
            WorkflowMetrics.getInstance().recordCompile(compilerOptions.getMode().name(), compiled.isSuccess(),
                    compiled.getElapsedMs());
        }
        Optional<PromptContract> contract = compiled.getContract();
        if (contract.isEmpty()) {
            logger.info("Pipeline stopped after compilation with " + compiled.getErrors().size() + " errors");
            return new PipelineResult(compiled, null, null, errors, warnings, null, elapsed(start));
        }

        GenerationResult generated = generate(contract.get());
        Optional<WorkflowGraph> workflow = generated.getWorkflow();
        if (workflow.isEmpty()) {
            logger.info("Pipeline stopped after generation with " + generated.getErrors().size() + " errors");
            return new PipelineResult(compiled, generated, null, errors, warnings, null, elapsed(start));
        }

        EngineReport report = validate(RuleContext.builder()
                .promptContract(contract.get())
                .workflowGraph(workflow.get())
                .strictMode(compilerOptions.isStrictMode())
                .build());

        checkSchema(workflow.get(), errors, warnings);
        String suggestion = suggest(contract.get(), workflow.get(), warnings);

        PipelineResult result = new PipelineResult(compiled, generated, report, errors, warnings, suggestion,
                elapsed(start));
        logger.info("Pipeline finished: success=" + result.isSuccess() + ", errors=" + result.getErrors().size()
                + ", warnings=" + result.getWarnings().size() + " (" + result.getElapsedMs() + "ms)");
        return result;
    }

    public GenerationResult generate(PromptContract contract) {
        GenerationResult generated = generator.generate(contract, generatorOptions);
        if (metricsEnabled) {
            WorkflowMetrics.getInstance().recordGeneration(contract.getTrigger().getKind().getLabel(),
                    generated.isSuccess(), generated.getStats().nodeCount());
        }
        return generated;
    }

    public EngineReport validate(RuleContext context) {
        return record(ruleEngine.execute(context));
    }

    public EngineReport validateCategory(RuleCategory category, RuleContext context) {
        return record(ruleEngine.executeCategory(category, context));
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    private EngineReport record(EngineReport report) {
        if (metricsEnabled) {
            WorkflowMetrics metrics = WorkflowMetrics.getInstance();
            for (RuleCategory category : RuleCategory.values()) {
                List<RuleResult> results = report.getResults().stream()
                        .filter(result -> result.category() == category)
                        .collect(Collectors.toList());
                if (results.isEmpty()) {
                    continue;
                }
                int failed = (int) results.stream().filter(result -> !result.passed()).count();
                int blocking = (int) results.stream().filter(RuleResult::isBlocking).count();
                metrics.recordRules(category.getLabel(), results.size(), failed, blocking);
            }
            metrics.recordValidation(report.isSuccess(), report.getElapsedMs());
        }
        return report;
    }

    private void checkSchema(WorkflowGraph workflow, List<Diagnostic> errors, List<Diagnostic> warnings) {
        if (schemaValidator == null) {
            return;
        }
        try {
            SchemaValidationResult result = schemaValidator.validate(codec.toJson(workflow));
            if (result != null && !result.valid()) {
                for (String error : result.errors()) {
                    errors.add(new Diagnostic(Diagnostic.Severity.ERROR, DiagnosticKind.STRUCTURAL, SCHEMA_INVALID,
                            -1, -1, null, "Schema validation failed: " + error));
                }
                if (result.errors().isEmpty()) {
                    errors.add(new Diagnostic(Diagnostic.Severity.ERROR, DiagnosticKind.STRUCTURAL, SCHEMA_INVALID,
                            -1, -1, null, "Schema validation failed"));
                }
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Schema validator failed, skipping schema validation", e);
            warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, DiagnosticKind.EXECUTION,
                    SCHEMA_VALIDATOR_FAILED, -1, -1, null,
                    "Schema validation skipped: " + e.getMessage()));
        }
    }

    private String suggest(PromptContract contract, WorkflowGraph workflow, List<Diagnostic> warnings) {
        if (suggestionProvider == null) {
            return null;
        }
        try {
            Optional<String> suggestion = suggestionProvider.suggest(contract, workflow);
            return suggestion != null ? suggestion.orElse(null) : null;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Suggestion provider failed, continuing without suggestions", e);
            warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, DiagnosticKind.EXECUTION,
                    SUGGESTION_FAILED, -1, -1, null,
                    "Suggestions unavailable: " + e.getMessage()));
            return null;
        }
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for WorkflowPipeline. Every collaborator has a default; the schema validator
     * and the suggestion provider default to none.
     */
    public static class Builder {
        private DslCompiler compiler = new DslCompiler();
        private CompilerOptions compilerOptions = CompilerOptions.defaults();
        private WorkflowGenerator generator = new WorkflowGenerator();
        private GeneratorOptions generatorOptions = GeneratorOptions.defaults();
        private RuleEngine ruleEngine;
        private WorkflowJsonCodec codec = new WorkflowJsonCodec();
        private GraphSchemaValidator schemaValidator;
        private SuggestionProvider suggestionProvider;
        private boolean metricsEnabled = true;

        public Builder compiler(DslCompiler compiler) {
            this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
            return this;
        }

        public Builder compilerOptions(CompilerOptions compilerOptions) {
            this.compilerOptions = Objects.requireNonNull(compilerOptions, "Compiler options cannot be null");
            return this;
        }

        public Builder generator(WorkflowGenerator generator) {
            this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
            return this;
        }

        public Builder generatorOptions(GeneratorOptions generatorOptions) {
            this.generatorOptions = Objects.requireNonNull(generatorOptions, "Generator options cannot be null");
            return this;
        }

        public Builder ruleEngine(RuleEngine ruleEngine) {
            this.ruleEngine = Objects.requireNonNull(ruleEngine, "Rule engine cannot be null");
            return this;
        }

        public Builder codec(WorkflowJsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
            return this;
        }

        public Builder schemaValidator(GraphSchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        public Builder suggestionProvider(SuggestionProvider suggestionProvider) {
            this.suggestionProvider = suggestionProvider;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public WorkflowPipeline build() {
            if (ruleEngine == null) {
                ruleEngine = new RuleEngine();
            }
            return new WorkflowPipeline(this);
        }
    }
}
