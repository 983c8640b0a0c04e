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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating one rule. {@code details} carries structured data about a failure
 * (for example the offending node names); {@code suggestions} are human-readable fixes.
 */
public record RuleResult(String ruleId, String ruleName, RuleCategory category, boolean passed,
                         RuleSeverity severity, String message, Map<String, Object> details,
                         List<String> suggestions) {

    public RuleResult {
        Objects.requireNonNull(ruleId, "Rule id cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /**
     * @return true when this is a failure that blocks the run
     */
    public boolean isBlocking() {
        return !passed && severity == RuleSeverity.ERROR;
    }
}
