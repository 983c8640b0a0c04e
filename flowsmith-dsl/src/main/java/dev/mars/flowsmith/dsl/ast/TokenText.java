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

import java.util.List;

/**
 * Rebuilds value text from tokens. Tokens that touch in the source are joined without a space,
 * so {@code 1.0.0} or {@code https://host/path} come back as written.
 */
final class TokenText {

    private TokenText() {
    }

    static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && !previous.touches(token)) {
                sb.append(' ');
            }
            sb.append(render(token));
            previous = token;
        }
        return sb.toString();
    }

    private static String render(Token token) {
        switch (token.kind()) {
            case FIELD_NAME:
                return token.text() + ":";
            case NUMBERED_ITEM:
                return token.text() + ".";
            default:
                return token.text();
        }
    }
}
