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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Aggregated outcome of a rule engine run. A run succeeds when no error-severity rule failed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class EngineReport {

    private final List<RuleResult> results;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final long elapsedMs;

    public EngineReport(List<RuleResult> results, List<Diagnostic> errors, List<Diagnostic> warnings, long elapsedMs) {
        this.results = List.copyOf(results);
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.elapsedMs = elapsedMs;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public int getTotalRules() {
        return results.size();
    }

    public int getPassedRules() {
        return (int) results.stream().filter(RuleResult::passed).count();
    }

    public int getFailedRules() {
        return getTotalRules() - getPassedRules();
    }

    public List<RuleResult> getResults() {
        return results;
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

    public List<RuleResult> getFailures() {
        return results.stream().filter(result -> !result.passed()).collect(Collectors.toList());
    }

    public List<RuleResult> getFailures(RuleCategory category) {
        return results.stream()
                .filter(result -> !result.passed() && result.category() == category)
                .collect(Collectors.toList());
    }

    public Optional<RuleResult> findResult(String ruleId) {
        return results.stream().filter(result -> result.ruleId().equals(ruleId)).findFirst();
    }

    @Override
    public String toString() {
        return "EngineReport{" +
               "success=" + isSuccess() +
               ", totalRules=" + getTotalRules() +
               ", passedRules=" + getPassedRules() +
               ", failedRules=" + getFailedRules() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               ", elapsedMs=" + elapsedMs +
               '}';
    }
}
