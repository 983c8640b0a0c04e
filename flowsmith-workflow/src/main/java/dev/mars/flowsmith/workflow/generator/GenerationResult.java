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

import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.graph.WorkflowGraph;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of generating a workflow graph from a contract.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class GenerationResult {

    private final WorkflowGraph workflow;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final GenerationStats stats;

    public GenerationResult(WorkflowGraph workflow, List<Diagnostic> errors, List<Diagnostic> warnings,
                            GenerationStats stats) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.workflow = this.errors.isEmpty() ? workflow : null;
        this.stats = stats;
    }

    public boolean isSuccess() {
        return workflow != null;
    }

    public Optional<WorkflowGraph> getWorkflow() {
        return Optional.ofNullable(workflow);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public GenerationStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "GenerationResult{" +
               "success=" + isSuccess() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               ", stats=" + stats +
               '}';
    }
}
