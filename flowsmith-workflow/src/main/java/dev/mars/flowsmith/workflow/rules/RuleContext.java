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

import java.util.Optional;

/**
 * Read-only input to a rule run: the contract and/or generated graph under validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class RuleContext {

    private final PromptContract promptContract;
    private final WorkflowGraph workflowGraph;
    private final String targetVersion;
    private final boolean strictMode;

    private RuleContext(Builder builder) {
        this.promptContract = builder.promptContract;
        this.workflowGraph = builder.workflowGraph;
        this.targetVersion = builder.targetVersion;
        this.strictMode = builder.strictMode;
    }

    public static RuleContext of(PromptContract contract, WorkflowGraph graph) {
        return builder().promptContract(contract).workflowGraph(graph).build();
    }

    public static RuleContext ofGraph(WorkflowGraph graph) {
        return builder().workflowGraph(graph).build();
    }

    public Optional<PromptContract> getPromptContract() {
        return Optional.ofNullable(promptContract);
    }

    public Optional<WorkflowGraph> getWorkflowGraph() {
        return Optional.ofNullable(workflowGraph);
    }

    /**
     * @return the explicit target runtime version, else the one declared by the contract
     */
    public Optional<String> getTargetVersion() {
        if (targetVersion != null) {
            return Optional.of(targetVersion);
        }
        return getPromptContract().map(contract -> contract.getMeta().getRuntimeVersion());
    }

    /**
     * Strict when requested explicitly or when the contract itself was declared strict.
     */
    public boolean isStrictMode() {
        return strictMode || getPromptContract().map(contract -> contract.getMeta().isStrict()).orElse(false);
    }

    public Builder toBuilder() {
        return builder()
                .promptContract(promptContract)
                .workflowGraph(workflowGraph)
                .targetVersion(targetVersion)
                .strictMode(strictMode);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RuleContext{" +
               "hasContract=" + (promptContract != null) +
               ", graph=" + (workflowGraph != null ? workflowGraph.getName() : null) +
               ", targetVersion=" + getTargetVersion().orElse(null) +
               ", strictMode=" + isStrictMode() +
               '}';
    }

    /**
     * Builder for RuleContext.
     */
    public static class Builder {
        private PromptContract promptContract;
        private WorkflowGraph workflowGraph;
        private String targetVersion;
        private boolean strictMode;

        public Builder promptContract(PromptContract promptContract) {
            this.promptContract = promptContract;
            return this;
        }

        public Builder workflowGraph(WorkflowGraph workflowGraph) {
            this.workflowGraph = workflowGraph;
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public RuleContext build() {
            return new RuleContext(this);
        }
    }
}
