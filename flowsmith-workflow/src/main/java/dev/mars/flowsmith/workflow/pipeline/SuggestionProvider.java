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
import dev.mars.flowsmith.graph.WorkflowGraph;

import java.util.Optional;

/**
 * Port for an optional language-model service that comments on a generated workflow.
 * The pipeline works without one.
 */
@FunctionalInterface
public interface SuggestionProvider {

    /**
     * @return free-text advice for the workflow, or empty when the provider has none
     */
    Optional<String> suggest(PromptContract contract, WorkflowGraph workflow);
}
