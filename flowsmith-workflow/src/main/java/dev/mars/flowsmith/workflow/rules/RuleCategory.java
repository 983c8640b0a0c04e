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

import dev.mars.flowsmith.core.DiagnosticKind;

import java.util.Locale;
import java.util.Optional;

/**
 * Rule categories in execution order. Cheap contract checks run before graph checks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum RuleCategory {
    INPUT("input", DiagnosticKind.COMPLETENESS),
    STRUCTURAL("structural", DiagnosticKind.STRUCTURAL),
    NODE("node", DiagnosticKind.SEMANTIC),
    FLOW("flow", DiagnosticKind.STRUCTURAL),
    OUTPUT("output", DiagnosticKind.SEMANTIC);

    private final String label;
    private final DiagnosticKind diagnosticKind;

    RuleCategory(String label, DiagnosticKind diagnosticKind) {
        this.label = label;
        this.diagnosticKind = diagnosticKind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the diagnostic kind used when a rule of this category fails
     */
    public DiagnosticKind getDiagnosticKind() {
        return diagnosticKind;
    }

    public static Optional<RuleCategory> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        for (RuleCategory category : values()) {
            if (category.label.equals(value)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
