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

package dev.mars.flowsmith.dsl.ast;

import dev.mars.flowsmith.dsl.lexer.Token;

/**
 * Source range covered by an AST node. Lines and columns are 1-based; the end column is exclusive.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {

    public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

    public static SourceSpan of(Token first, Token last) {
        return new SourceSpan(first.line(), first.column(), last.line(), last.endColumn());
    }

    public static SourceSpan line(int lineNumber, int startColumn, int endColumn) {
        return new SourceSpan(lineNumber, startColumn, lineNumber, endColumn);
    }

    /**
     * @return the smallest span covering both spans
     */
    public SourceSpan union(SourceSpan other) {
        if (this == NONE) {
            return other;
        }
        if (other == NONE) {
            return this;
        }
        boolean thisStartsFirst = startLine < other.startLine
                || (startLine == other.startLine && startColumn <= other.startColumn);
        boolean thisEndsLast = endLine > other.endLine
                || (endLine == other.endLine && endColumn >= other.endColumn);
        return new SourceSpan(
                thisStartsFirst ? startLine : other.startLine,
                thisStartsFirst ? startColumn : other.startColumn,
                thisEndsLast ? endLine : other.endLine,
                thisEndsLast ? endColumn : other.endColumn);
    }
}
