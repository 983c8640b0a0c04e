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

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.CompilerOptions;
import dev.mars.flowsmith.dsl.lexer.Token;
import dev.mars.flowsmith.dsl.lexer.TokenKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Groups a token stream into a Document / Section / Field, Step, List tree.
 * <p>
 * A single current-section cursor is kept: a section marker closes the open section and opens the
 * next, and every field, step or list until the following marker attaches to it. Entries never
 * cross a section boundary. Malformed input is recovered from with warnings: stray text and content
 * before the first section are dropped, unknown sections are skipped, and a repeated section is
 * merged into the first occurrence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AstBuilder {

    private static final Logger logger = Logger.getLogger(AstBuilder.class.getName());

    public ParseResult parseToAst(List<Token> tokens, CompilerOptions options) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        Diagnostics diagnostics = new Diagnostics(options.getMaxErrors());
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
            diagnostics.addError(DiagnosticKind.EXECUTION, "INVALID_TOKEN_STREAM",
                    "Token stream must be terminated by an EOF token");
            return new ParseResult(null, diagnostics.getErrors(), diagnostics.getWarnings());
        }

        DocumentNode document = new TreeBuilder(tokens, diagnostics).build();
        logger.fine("Built document with " + document.sections().size() + " sections");
        return new ParseResult(document, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    /**
     * Cursor over one token stream. One instance per parse.
     */
    private static final class TreeBuilder {

        private final List<Token> tokens;
        private final Diagnostics diagnostics;
        private final Map<ContractSection, SectionAccumulator> sections = new LinkedHashMap<>();
        private SectionAccumulator current;
        private boolean skippingUnknownSection;
        private int pos;

        TreeBuilder(List<Token> tokens, Diagnostics diagnostics) {
            this.tokens = tokens;
            this.diagnostics = diagnostics;
        }

        DocumentNode build() {
            while (peek().kind() != TokenKind.EOF) {
                Token token = peek();
                switch (token.kind()) {
                    case NEWLINE:
                    case COMMENT:
                    case INDENT:
                        pos++;
                        break;
                    case SECTION_MARKER:
                        openSection();
                        break;
                    case FIELD_NAME:
                        attach(parseField(), token);
                        break;
                    case NUMBERED_ITEM:
                        attach(parseStep(), token);
                        break;
                    case LIST_ITEM:
                        attach(parseList(), token);
                        break;
                    default:
                        skipStrayLine();
                        break;
                }
            }

            List<SectionNode> built = new ArrayList<>();
            sections.values().forEach(acc -> built.add(new SectionNode(acc.section, acc.entries, acc.span)));
            SourceSpan span = SourceSpan.of(tokens.get(0), tokens.get(tokens.size() - 1));
            return new DocumentNode(built, span);
        }

        private void openSection() {
            Token marker = next();
            Optional<ContractSection> section = ContractSection.fromKeyword(marker.text());
            if (section.isPresent()) {
                SectionAccumulator existing = sections.get(section.get());
                if (existing != null) {
                    diagnostics.addWarning(DiagnosticKind.SYNTAX, "DUPLICATE_SECTION", marker.line(), marker.column(),
                            marker.text(), "Section " + marker.text() + " appears more than once; entries are merged");
                    current = existing;
                } else {
                    current = new SectionAccumulator(section.get(), SourceSpan.of(marker, marker));
                    sections.put(section.get(), current);
                }
                skippingUnknownSection = false;
            } else {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "UNKNOWN_SECTION", marker.line(), marker.column(),
                        marker.text(), "Unknown section " + marker.text() + " ignored");
                current = null;
                skippingUnknownSection = true;
            }

            List<Token> rest = restOfLine();
            if (!rest.isEmpty()) {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT", marker.line(), rest.get(0).column(),
                        marker.text(), "Ignoring text after section marker: " + TokenText.join(rest));
            }
        }

        private void attach(SectionEntry entry, Token start) {
            if (current != null) {
                current.add(entry);
            } else if (!skippingUnknownSection) {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT", start.line(), start.column(), null,
                        "Content before the first section is ignored");
            }
        }

        private void skipStrayLine() {
            Token start = peek();
            List<Token> stray = restOfLine();
            if (skippingUnknownSection) {
                return;
            }
            String where = current == null ? "before the first section" : "in " + current.section.getMarker();
            diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT", start.line(), start.column(),
                    current == null ? null : current.section.getMarker(),
                    "Ignoring unstructured text " + where + ": " + TokenText.join(stray));
        }

        private FieldNode parseField() {
            Token name = next();
            List<Token> value = captureValue();
            Token last = value.isEmpty() ? name : value.get(value.size() - 1);
            return new FieldNode(name.text(), toLiteral(value), SourceSpan.of(name, last));
        }

        private StepNode parseStep() {
            Token marker = next();
            List<Token> value = captureValue();
            Token last = value.isEmpty() ? marker : value.get(value.size() - 1);
            int number = parseStepNumber(marker);
            return new StepNode(number, TokenText.join(value), stepParts(value), SourceSpan.of(marker, last));
        }

        private ListNode parseList() {
            List<ListItemNode> items = new ArrayList<>();
            Token first = peek();
            Token last = first;
            while (peek().kind() == TokenKind.LIST_ITEM) {
                Token marker = next();
                if (peek().kind() == TokenKind.FIELD_NAME) {
                    FieldNode field = parseField();
                    String text = field.scalar().map(v -> field.name() + ": " + v).orElse(field.name() + ":");
                    items.add(ListItemNode.ofField(text, field, SourceSpan.of(marker, marker).union(field.span())));
                } else {
                    List<Token> value = captureValue();
                    Token end = value.isEmpty() ? marker : value.get(value.size() - 1);
                    items.add(ListItemNode.ofText(TokenText.join(value), SourceSpan.of(marker, end)));
                }
                last = tokens.get(pos - 1);
                if (!continuesList()) {
                    break;
                }
            }
            return new ListNode(items, SourceSpan.of(first, last));
        }

        /**
         * Moves past a line break when the next line is another list item.
         */
        private boolean continuesList() {
            if (peek().kind() != TokenKind.NEWLINE) {
                return false;
            }
            int look = pos + 1;
            if (tokens.get(look).kind() == TokenKind.INDENT) {
                look++;
            }
            if (tokens.get(look).kind() == TokenKind.LIST_ITEM) {
                pos = look;
                return true;
            }
            return false;
        }

        /**
         * Collects value tokens up to the end of the line, folding in indented continuation lines
         * that do not start a new construct.
         */
        private List<Token> captureValue() {
            List<Token> value = new ArrayList<>();
            while (true) {
                Token token = peek();
                if (token.kind() == TokenKind.NEWLINE) {
                    int look = pos + 1;
                    if (tokens.get(look).kind() == TokenKind.INDENT && isContinuation(tokens.get(look + 1))) {
                        pos = look + 1;
                        continue;
                    }
                    return value;
                }
                if (token.kind().isStructural()) {
                    return value;
                }
                if (token.kind() != TokenKind.COMMENT && token.kind() != TokenKind.INDENT) {
                    value.add(token);
                }
                pos++;
            }
        }

        private static boolean isContinuation(Token token) {
            return !token.kind().isStructural()
                    && token.kind() != TokenKind.NEWLINE
                    && token.kind() != TokenKind.COMMENT;
        }

        private List<StepPart> stepParts(List<Token> value) {
            int conditional = indexOf(value, TokenKind.CONDITIONAL);
            int arrow = indexOf(value, TokenKind.ARROW);
            List<StepPart> parts = new ArrayList<>();

            if (conditional >= 0) {
                int end = arrow > conditional ? arrow : value.size();
                List<Token> expression = value.subList(conditional + 1, end);
                Token keyword = value.get(conditional);
                Token last = expression.isEmpty() ? keyword : expression.get(expression.size() - 1);
                SourceSpan expressionSpan = expression.isEmpty()
                        ? SourceSpan.line(keyword.line(), keyword.endColumn(), keyword.endColumn())
                        : SourceSpan.of(expression.get(0), last);
                parts.add(new ConditionNode(keyword.text(),
                        new ExpressionNode(TokenText.join(expression), expressionSpan),
                        SourceSpan.of(keyword, last)));
            }
            if (arrow >= 0 && arrow < value.size() - 1) {
                int end = conditional > arrow ? conditional : value.size();
                List<Token> target = value.subList(arrow + 1, end);
                if (!target.isEmpty()) {
                    parts.add(new ReferenceNode(TokenText.join(target),
                            SourceSpan.of(target.get(0), target.get(target.size() - 1))));
                }
            }
            return parts;
        }

        private int parseStepNumber(Token marker) {
            try {
                return Integer.parseInt(marker.text());
            } catch (NumberFormatException e) {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "INVALID_VALUE", marker.line(), marker.column(),
                        ContractSection.WORKFLOW.getMarker(), "Step number " + marker.text() + " is out of range");
                return Integer.MAX_VALUE;
            }
        }

        private static LiteralNode toLiteral(List<Token> value) {
            if (value.isEmpty()) {
                return null;
            }
            SourceSpan span = SourceSpan.of(value.get(0), value.get(value.size() - 1));
            if (value.size() == 1) {
                Token token = value.get(0);
                switch (token.kind()) {
                    case STRING_LITERAL:
                        return new LiteralNode(LiteralKind.STRING, token.text(), span);
                    case NUMBER_LITERAL:
                        return new LiteralNode(LiteralKind.NUMBER, token.text(), span);
                    case BOOLEAN_LITERAL:
                        return new LiteralNode(LiteralKind.BOOLEAN, token.text(), span);
                    default:
                        break;
                }
            }
            return new LiteralNode(LiteralKind.TEXT, TokenText.join(value), span);
        }

        private static int indexOf(List<Token> value, TokenKind kind) {
            for (int i = 0; i < value.size(); i++) {
                if (value.get(i).kind() == kind) {
                    return i;
                }
            }
            return -1;
        }

        private List<Token> restOfLine() {
            List<Token> rest = new ArrayList<>();
            while (peek().kind() != TokenKind.NEWLINE && peek().kind() != TokenKind.EOF) {
                Token token = next();
                if (token.kind() != TokenKind.COMMENT && token.kind() != TokenKind.INDENT) {
                    rest.add(token);
                }
            }
            return rest;
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            return tokens.get(pos++);
        }
    }

    private static final class SectionAccumulator {
        private final ContractSection section;
        private final List<SectionEntry> entries = new ArrayList<>();
        private SourceSpan span;

        SectionAccumulator(ContractSection section, SourceSpan span) {
            this.section = section;
            this.span = span;
        }

        void add(SectionEntry entry) {
            entries.add(entry);
            span = span.union(entry.span());
        }
    }
}
