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

package dev.mars.flowsmith.dsl;

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.core.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of compiling a prompt document: the contract when compilation succeeded, plus every
 * error and warning raised by the lexer, AST builder and transformer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class CompileResult {

    private final PromptContract contract;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final long elapsedMs;

    public CompileResult(PromptContract contract, List<Diagnostic> errors, List<Diagnostic> warnings, long elapsedMs) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.contract = this.errors.isEmpty() ? contract : null;
        this.elapsedMs = elapsedMs;
    }

    public boolean isSuccess() {
        return contract != null;
    }

    public Optional<PromptContract> getContract() {
        return Optional.ofNullable(contract);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return "CompileResult{" +
               "success=" + isSuccess() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               ", elapsedMs=" + elapsedMs +
               '}';
    }
}
