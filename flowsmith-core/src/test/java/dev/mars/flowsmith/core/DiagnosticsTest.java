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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    @Test
    void testErrorsAndWarningsAreSeparated() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.addError(DiagnosticKind.SYNTAX, "BAD", 3, 7, "@trigger", "broken");
        diagnostics.addWarning(DiagnosticKind.SEMANTIC, "ODD", "odd");

        assertFalse(diagnostics.isValid());
        assertTrue(diagnostics.hasWarnings());
        Diagnostic error = diagnostics.getErrors().get(0);
        assertEquals(Diagnostic.Severity.ERROR, error.getSeverity());
        assertEquals(3, error.getLineNumber());
        assertEquals(7, error.getColumn());
        assertEquals("@trigger", error.getFieldPath());
    }

    @Test
    void testErrorCapAddsSingleWarning() {
        Diagnostics diagnostics = new Diagnostics(2);
        for (int i = 0; i < 5; i++) {
            diagnostics.addError(DiagnosticKind.STRUCTURAL, "E" + i, "error " + i);
        }
        diagnostics.addWarning(DiagnosticKind.STRUCTURAL, "W", "still recorded");

        assertEquals(2, diagnostics.getErrorCount());
        assertTrue(diagnostics.isTruncated());
        assertEquals(2, diagnostics.getWarningCount());
        assertEquals("TOO_MANY_ERRORS", diagnostics.getWarnings().get(0).getCode());
    }

    @Test
    void testNonPositiveCapMeansUnlimited() {
        Diagnostics diagnostics = new Diagnostics(0);
        for (int i = 0; i < 500; i++) {
            diagnostics.addError(DiagnosticKind.SYNTAX, "E", "error");
        }
        assertEquals(500, diagnostics.getErrorCount());
        assertFalse(diagnostics.isTruncated());
    }

    @Test
    void testMergeKeepsOrder() {
        Diagnostics first = new Diagnostics();
        first.addError(DiagnosticKind.SYNTAX, "A", "a");
        Diagnostics second = new Diagnostics();
        second.addError(DiagnosticKind.SEMANTIC, "B", "b");
        second.addWarning(DiagnosticKind.SEMANTIC, "C", "c");

        first.merge(second);
        assertEquals("A", first.getErrors().get(0).getCode());
        assertEquals("B", first.getErrors().get(1).getCode());
        assertEquals("C", first.getWarnings().get(0).getCode());
    }

    @Test
    void testListsAreSnapshots() {
        Diagnostics diagnostics = new Diagnostics();
        assertThrows(UnsupportedOperationException.class,
                () -> diagnostics.getErrors().add(null));
    }
}
