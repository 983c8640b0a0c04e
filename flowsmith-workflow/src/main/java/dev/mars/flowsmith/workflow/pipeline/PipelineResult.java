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
import dev.mars.flowsmith.dsl.CompileResult;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.workflow.generator.GenerationResult;
import dev.mars.flowsmith.workflow.rules.EngineReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a full compile, generate and validate run. Later stages are absent when
 * an earlier stage failed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PipelineResult {

    private final CompileResult compileResult;
    private final GenerationResult generationResult;
    private final EngineReport engineReport;
    private final List<Diagnostic> pipelineErrors;
    private final List<Diagnostic> pipelineWarnings;
    private final String suggestion;
    private final long elapsedMs;

    PipelineResult(CompileResult compileResult, GenerationResult generationResult, EngineReport engineReport,
                   List<Diagnostic> pipelineErrors, List<Diagnostic> pipelineWarnings, String suggestion,
                   long elapsedMs) {
        this.compileResult = Objects.requireNonNull(compileResult, "Compile result cannot be null");
        this.generationResult = generationResult;
        this.engineReport = engineReport;
        this.pipelineErrors = List.copyOf(pipelineErrors);
        this.pipelineWarnings = List.copyOf(pipelineWarnings);
        this.suggestion = suggestion;
        this.elapsedMs = elapsedMs;
    }

    /**
     * True when every stage ran and none of them reported an error.
     */
    public boolean isSuccess() {
        return compileResult.isSuccess()
                && generationResult != null && generationResult.isSuccess()
                && engineReport != null && engineReport.isSuccess()
                && pipelineErrors.isEmpty();
    }

    public CompileResult getCompileResult() {
        return compileResult;
    }

    public Optional<GenerationResult> getGenerationResult() {
        return Optional.ofNullable(generationResult);
    }

    public Optional<EngineReport> getEngineReport() {
        return Optional.ofNullable(engineReport);
    }

    public Optional<PromptContract> getContract() {
        return compileResult.getContract();
    }

    public Optional<WorkflowGraph> getWorkflow() {
        return generationResult != null ? generationResult.getWorkflow() : Optional.empty();
    }

    public Optional<String> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    /**
     * @return errors of every stage, in stage order
     */
    public List<Diagnostic> getErrors() {
        List<Diagnostic> all = new ArrayList<>(compileResult.getErrors());
        if (generationResult != null) {
            all.addAll(generationResult.getErrors());
        }
        if (engineReport != null) {
            all.addAll(engineReport.getErrors());
        }
        all.addAll(pipelineErrors);
        return all;
    }

    /**
     * @return warnings of every stage, in stage order
     */
    public List<Diagnostic> getWarnings() {
        List<Diagnostic> all = new ArrayList<>(compileResult.getWarnings());
        if (generationResult != null) {
            all.addAll(generationResult.getWarnings());
        }
        if (engineReport != null) {
            all.addAll(engineReport.getWarnings());
        }
        all.addAll(pipelineWarnings);
        return all;
    }

    @Override
    public String toString() {
        return "PipelineResult{" +
               "success=" + isSuccess() +
               ", errors=" + getErrors().size() +
               ", warnings=" + getWarnings().size() +
               ", elapsedMs=" + elapsedMs +
               '}';
    }
}
