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

package dev.mars.flowsmith.dsl.lexer;

/**
 * Kinds of token produced by {@link DslLexer}.
 */
public enum TokenKind {
    SECTION_MARKER,
    FIELD_NAME,
    LIST_ITEM,
    NUMBERED_ITEM,
    STRING_LITERAL,
    NUMBER_LITERAL,
    BOOLEAN_LITERAL,
    ARROW,
    CONDITIONAL,
    COMMENT,
    IDENTIFIER,
    INDENT,
    NEWLINE,
    EOF;

    /**
     * Structural tokens open a new construct and end any value being captured.
     */
    public boolean isStructural() {
        return this == SECTION_MARKER || this == FIELD_NAME || this == LIST_ITEM
                || this == NUMBERED_ITEM || this == EOF;
    }

    public boolean isLiteral() {
        return this == STRING_LITERAL || this == NUMBER_LITERAL || this == BOOLEAN_LITERAL;
    }
}
