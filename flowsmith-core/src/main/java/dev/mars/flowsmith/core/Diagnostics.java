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

package dev.mars.flowsmith.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the errors and warnings of one pipeline run.
 * <p>
 * Once the error ceiling is reached further errors are dropped and a single
 * {@code TOO_MANY_ERRORS} warning is recorded. Not thread-safe; each run owns its own instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class Diagnostics {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final int maxErrors;
    private boolean truncated;

    public Diagnostics() {
        this(UNLIMITED);
    }

    public Diagnostics(int maxErrors) {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
        this.maxErrors = maxErrors > 0 ? maxErrors : UNLIMITED;
    }

    public void addError(DiagnosticKind kind, String code, String message) {
        addError(kind, code, -1, -1, null, message);
    }

    public void addError(DiagnosticKind kind, String code, String fieldPath, String message) {
        addError(kind, code, -1, -1, fieldPath, message);
    }

    public void addError(DiagnosticKind kind, String code, int lineNumber, int column, String fieldPath, String message) {
        add(new Diagnostic(Diagnostic.Severity.ERROR, kind, code, lineNumber, column, fieldPath, message));
    }

    public void addWarning(DiagnosticKind kind, String code, String message) {
        addWarning(kind, code, -1, -1, null, message);
    }

    public void addWarning(DiagnosticKind kind, String code, String fieldPath, String message) {
        addWarning(kind, code, -1, -1, fieldPath, message);
    }

    public void addWarning(DiagnosticKind kind, String code, int lineNumber, int column, String fieldPath, String message) {
        add(new Diagnostic(Diagnostic.Severity.WARNING, kind, code, lineNumber, column, fieldPath, message));
    }

    public void add(Diagnostic diagnostic) {
        if (diagnostic.getSeverity() == Diagnostic.Severity.WARNING) {
            warnings.add(diagnostic);
            return;
        }
        if (errors.size() < maxErrors) {
            errors.add(diagnostic);
        } else if (!truncated) {
            truncated = true;
            warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, DiagnosticKind.EXECUTION, "TOO_MANY_ERRORS",
                    -1, -1, null, "Maximum error limit (" + maxErrors + ") reached; further errors omitted"));
        }
    }

    public void addAll(List<Diagnostic> diagnostics) {
        diagnostics.forEach(this::add);
    }

    public void merge(Diagnostics other) {
        addAll(other.errors);
        addAll(other.warnings);
    }

    public List<Diagnostic> getErrors() {
        return List.copyOf(errors);
    }

    public List<Diagnostic> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isTruncated() {
        return truncated;
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Diagnostics{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }
}
