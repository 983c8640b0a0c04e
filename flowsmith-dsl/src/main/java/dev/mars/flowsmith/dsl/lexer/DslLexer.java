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

import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.CompilerOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts prompt text into a flat, position-tagged token stream.
 * <p>
 * Lines are scanned left to right. At each column the token patterns are tried in a fixed priority
 * order. Section markers, field names and item markers are only recognized as the first token of a
 * line (a field name may also follow a list marker), which keeps URLs, times and e-mail addresses in
 * values intact. A field's colon need not be followed by a space, but {@code name://} is a URL scheme
 * rather than a field. Characters no pattern accepts are skipped with a warning; the lexer never fails.
 * <p>
 * Instances are stateless and may be shared between threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DslLexer {

    private static final Logger logger = Logger.getLogger(DslLexer.class.getName());

    private static final Pattern SECTION_MARKER = Pattern.compile("@([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern FIELD_NAME = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*:(?!//)");
    private static final Pattern LIST_ITEM = Pattern.compile("-(?=\\s|$)");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("(\\d+)\\.(?=\\s|$)");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"([^\"]*)\"|'([^']*)'");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("-?\\d+(?:\\.\\d+)?(?=[\\s,;)]|$)");
    private static final Pattern BOOLEAN_LITERAL = Pattern.compile("(?i)(true|false|verdadero|falso)(?=[\\s,;)]|$)");
    private static final Pattern ARROW = Pattern.compile("->");
    private static final Pattern CONDITIONAL = Pattern.compile("(?i)(si|cuando|if|when)\\b");
    private static final Pattern COMMENT = Pattern.compile("#.*");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern WORD = Pattern.compile("[^\\s\\[\\]{}]+");

    public TokenizeResult tokenize(String text, CompilerOptions options) {
        Objects.requireNonNull(text, "Text cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        Diagnostics diagnostics = new Diagnostics(options.getMaxErrors());
        List<Token> tokens = new ArrayList<>();
        String[] lines = text.split("\r\n|\r|\n", -1);

        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i], i + 1, options, tokens, diagnostics);
            if (i < lines.length - 1) {
                tokens.add(new Token(TokenKind.NEWLINE, "\n", i + 1, lines[i].length() + 1, 1));
            }
        }
        String lastLine = lines[lines.length - 1];
        tokens.add(new Token(TokenKind.EOF, "", lines.length, lastLine.length() + 1, 0));

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Tokenized " + lines.length + " lines into " + tokens.size() + " tokens");
        }
        return new TokenizeResult(tokens, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    private void scanLine(String line, int lineNumber, CompilerOptions options,
                          List<Token> tokens, Diagnostics diagnostics) {
        int col = 0;
        int length = line.length();
        while (col < length && Character.isWhitespace(line.charAt(col))) {
            col++;
        }
        if (col == length) {
            return;
        }
        if (col > 0) {
            tokens.add(new Token(TokenKind.INDENT, line.substring(0, col), lineNumber, 1, col));
        }

        boolean lineStart = true;
        boolean afterListMarker = false;
        boolean afterFieldName = false;

        while (col < length) {
            char ch = line.charAt(col);
            if (Character.isWhitespace(ch)) {
                col++;
                continue;
            }

            Matcher m;
            Token token = null;
            boolean precededBySpace = afterFieldName || col == 0 || Character.isWhitespace(line.charAt(col - 1));

            if (lineStart && (m = match(SECTION_MARKER, line, col)) != null) {
                token = token(TokenKind.SECTION_MARKER, "@" + m.group(1).toLowerCase(Locale.ROOT), lineNumber, col, m);
            } else if ((lineStart || afterListMarker) && (m = match(FIELD_NAME, line, col)) != null) {
                token = token(TokenKind.FIELD_NAME, m.group(1), lineNumber, col, m);
            } else if (lineStart && (m = match(LIST_ITEM, line, col)) != null) {
                token = token(TokenKind.LIST_ITEM, "-", lineNumber, col, m);
            } else if (lineStart && (m = match(NUMBERED_ITEM, line, col)) != null) {
                token = token(TokenKind.NUMBERED_ITEM, m.group(1), lineNumber, col, m);
            } else if (precededBySpace && (m = match(STRING_LITERAL, line, col)) != null) {
                String value = m.group(1) != null ? m.group(1) : m.group(2);
                token = token(TokenKind.STRING_LITERAL, value, lineNumber, col, m);
            } else if ((m = match(NUMBER_LITERAL, line, col)) != null) {
                token = token(TokenKind.NUMBER_LITERAL, m.group(), lineNumber, col, m);
            } else if ((m = match(BOOLEAN_LITERAL, line, col)) != null) {
                token = token(TokenKind.BOOLEAN_LITERAL, m.group(1), lineNumber, col, m);
            } else if ((m = match(ARROW, line, col)) != null) {
                token = token(TokenKind.ARROW, "->", lineNumber, col, m);
            } else if ((m = match(CONDITIONAL, line, col)) != null) {
                token = token(TokenKind.CONDITIONAL, m.group(1), lineNumber, col, m);
            } else if (isCommentStart(line, col, lineStart) && (m = match(COMMENT, line, col)) != null) {
                if (!options.isIgnoreComments()) {
                    tokens.add(token(TokenKind.COMMENT, m.group().substring(1).trim(), lineNumber, col, m));
                }
                col = m.end();
                continue;
            } else if ((m = match(IDENTIFIER, line, col)) != null) {
                token = token(TokenKind.IDENTIFIER, m.group(), lineNumber, col, m);
            } else if ((m = match(WORD, line, col)) != null) {
                token = token(TokenKind.IDENTIFIER, m.group(), lineNumber, col, m);
            }

            if (token == null) {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "UNRECOGNIZED_CHARACTER", lineNumber, col + 1, null,
                        "Skipping unrecognized character '" + ch + "'");
                col++;
                continue;
            }

            tokens.add(token);
            lineStart = false;
            afterListMarker = token.kind() == TokenKind.LIST_ITEM;
            afterFieldName = token.kind() == TokenKind.FIELD_NAME;
            col += token.length();
        }
    }

    private static boolean isCommentStart(String line, int col, boolean lineStart) {
        if (line.charAt(col) != '#') {
            return false;
        }
        if (lineStart) {
            return true;
        }
        boolean spaceBefore = Character.isWhitespace(line.charAt(col - 1));
        boolean spaceAfter = col + 1 >= line.length() || Character.isWhitespace(line.charAt(col + 1));
        return spaceBefore && spaceAfter;
    }

    private static Matcher match(Pattern pattern, String line, int col) {
        Matcher matcher = pattern.matcher(line);
        matcher.region(col, line.length());
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        return matcher.lookingAt() && matcher.end() > col ? matcher : null;
    }

    private static Token token(TokenKind kind, String text, int lineNumber, int col, Matcher m) {
        return new Token(kind, text, lineNumber, col + 1, m.end() - col);
    }
}
