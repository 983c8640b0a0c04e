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

import java.util.Objects;

/**
 * A single error or warning produced while compiling, generating or validating a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class Diagnostic {

    public enum Severity {
        ERROR, WARNING
    }

    private final Severity severity;
    private final DiagnosticKind kind;
    private final String code;
    private final int lineNumber;
    private final int column;
    private final String fieldPath;
    private final String message;

    public Diagnostic(Severity severity, DiagnosticKind kind, String code, int lineNumber, int column,
                      String fieldPath, String message) {
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.code = Objects.requireNonNull(code, "Code cannot be null");
        this.lineNumber = lineNumber;
        this.column = column;
        this.fieldPath = fieldPath;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public Severity getSeverity() {
        return severity;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return 1-based source line, or -1 when the problem has no source position
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumn() {
        return column;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return lineNumber == that.lineNumber &&
               column == that.column &&
               severity == that.severity &&
               kind == that.kind &&
               code.equals(that.code) &&
               Objects.equals(fieldPath, that.fieldPath) &&
               message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, kind, code, lineNumber, column, fieldPath, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name()).append(' ').append(code);

        if (lineNumber > 0) {
            sb.append(" (line ").append(lineNumber);
            if (column > 0) {
                sb.append(", column ").append(column);
            }
            sb.append(")");
        }

        if (fieldPath != null) {
            sb.append(" [").append(fieldPath).append("]");
        }

        sb.append(": ").append(message);

        return sb.toString();
    }
}
