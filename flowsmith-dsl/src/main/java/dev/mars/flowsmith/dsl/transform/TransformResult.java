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

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.core.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link ContractTransformer#transformToContract}. A contract is present only when no
 * error was reported.
 */
public record TransformResult(PromptContract promptContract, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public TransformResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public Optional<PromptContract> contract() {
        return Optional.ofNullable(promptContract);
    }

    public boolean isSuccess() {
        return promptContract != null && errors.isEmpty();
    }
}
