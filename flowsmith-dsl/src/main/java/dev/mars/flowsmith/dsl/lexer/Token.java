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

import java.util.Objects;

/**
 * A lexical token with its source position.
 *
 * @param kind   token kind
 * @param text   token value; quotes are stripped from strings, the colon from field names and the
 *               dot from step numbers
 * @param line   1-based line
 * @param column 1-based column of the first source character
 * @param length number of source characters the token spans
 */
public record Token(TokenKind kind, String text, int line, int column, int length) {

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
    }

    /**
     * @return column just past the last source character
     */
    public int endColumn() {
        return column + length;
    }

    /**
     * @return true when {@code next} starts exactly where this token ends on the same line
     */
    public boolean touches(Token next) {
        return next.line == line && next.column == endColumn();
    }
}
