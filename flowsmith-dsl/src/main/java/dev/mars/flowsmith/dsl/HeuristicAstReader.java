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

package dev.mars.flowsmith.dsl;

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.ConditionNode;
import dev.mars.flowsmith.dsl.ast.DocumentNode;
import dev.mars.flowsmith.dsl.ast.ExpressionNode;
import dev.mars.flowsmith.dsl.ast.FieldNode;
import dev.mars.flowsmith.dsl.ast.ListItemNode;
import dev.mars.flowsmith.dsl.ast.ListNode;
import dev.mars.flowsmith.dsl.ast.LiteralKind;
import dev.mars.flowsmith.dsl.ast.LiteralNode;
import dev.mars.flowsmith.dsl.ast.ParseResult;
import dev.mars.flowsmith.dsl.ast.ReferenceNode;
import dev.mars.flowsmith.dsl.ast.SectionEntry;
import dev.mars.flowsmith.dsl.ast.SectionNode;
import dev.mars.flowsmith.dsl.ast.SourceSpan;
import dev.mars.flowsmith.dsl.ast.StepNode;
import dev.mars.flowsmith.dsl.ast.StepPart;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fast, line-oriented reader that builds the same document tree as the lexer and AST builder
 * using one regular expression per line shape.
 * <p>
 * It does not fold continuation lines, strip trailing comments or report token positions finer
 * than a line, so it is offered only as an explicitly selected {@link CompileMode#HEURISTIC}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class HeuristicAstReader {

    private static final Pattern SECTION = Pattern.compile("^\\s*@([A-Za-z_][A-Za-z0-9_]*)\\s*$");
    private static final Pattern FIELD = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*:(?!//)\\s*(.*)$");
    private static final Pattern STEP = Pattern.compile("^\\s*(\\d{1,9})\\.(?:\\s+(.*))?$");
    private static final Pattern ITEM = Pattern.compile("^\\s*-(?:\\s+(.*))?$");
    private static final Pattern ITEM_FIELD = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*:(?!//)\\s*(.*)$");
    private static final Pattern COMMENT = Pattern.compile("^\\s*#");
    private static final Pattern CONDITION = Pattern.compile("(?i)\\b(si|cuando|if|when)\\b\\s*(.*?)\\s*(?:->|$)");
    private static final Pattern ARROW = Pattern.compile("->\\s*(.+)$");
    private static final Pattern QUOTED = Pattern.compile("^\"([^\"]*)\"$|^'([^']*)'$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");
    private static final Pattern BOOLEAN = Pattern.compile("(?i)^(true|false|verdadero|falso)$");

    public ParseResult read(String text, CompilerOptions options) {
        Objects.requireNonNull(text, "Text cannot be null");
        Diagnostics diagnostics = new Diagnostics(options.getMaxErrors());
        Map<ContractSection, List<SectionEntry>> sections = new LinkedHashMap<>();
        Map<ContractSection, Integer> sectionLines = new LinkedHashMap<>();
        List<SectionEntry> current = null;
        boolean skipping = false;
        List<ListItemNode> pendingItems = new ArrayList<>();

        String[] lines = text.split("\r\n|\r|\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            SourceSpan span = SourceSpan.line(lineNumber, 1, line.length() + 1);
            Matcher m;

            if (!pendingItems.isEmpty() && (m = ITEM.matcher(line)).matches()) {
                pendingItems.add(item(m.group(1), span));
                continue;
            }
            flushItems(pendingItems, current);

            if (line.isBlank() || COMMENT.matcher(line).find()) {
                continue;
            }
            if ((m = SECTION.matcher(line)).matches()) {
                Optional<ContractSection> section = ContractSection.fromKeyword(m.group(1));
                if (section.isPresent()) {
                    current = sections.computeIfAbsent(section.get(), key -> new ArrayList<>());
                    sectionLines.putIfAbsent(section.get(), lineNumber);
                    skipping = false;
                } else {
                    diagnostics.addWarning(DiagnosticKind.SYNTAX, "UNKNOWN_SECTION", lineNumber, 1,
                            "@" + m.group(1), "Unknown section @" + m.group(1) + " ignored");
                    current = null;
                    skipping = true;
                }
                continue;
            }
            if (current == null) {
                if (!skipping) {
                    diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT", lineNumber, 1, null,
                            "Content before the first section is ignored");
                }
                continue;
            }
            if ((m = STEP.matcher(line)).matches()) {
                current.add(step(Integer.parseInt(m.group(1)), clean(m.group(2)), span));
            } else if ((m = ITEM.matcher(line)).matches()) {
                pendingItems.add(item(m.group(1), span));
            } else if ((m = FIELD.matcher(line)).matches()) {
                current.add(new FieldNode(m.group(1), literal(clean(m.group(2)), span), span));
            } else {
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT", lineNumber, 1, null,
                        "Ignoring unstructured text: " + line.trim());
            }
        }
        flushItems(pendingItems, current);

        List<SectionNode> built = new ArrayList<>();
        sections.forEach((section, entries) -> {
            int line = sectionLines.get(section);
            built.add(new SectionNode(section, entries, SourceSpan.line(line, 1, 1)));
        });
        DocumentNode document = new DocumentNode(built, new SourceSpan(1, 1, lines.length, 1));
        return new ParseResult(document, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    private static void flushItems(List<ListItemNode> pendingItems, List<SectionEntry> current) {
        if (pendingItems.isEmpty()) {
            return;
        }
        if (current != null) {
            SourceSpan span = pendingItems.get(0).span().union(pendingItems.get(pendingItems.size() - 1).span());
            current.add(new ListNode(pendingItems, span));
        }
        pendingItems.clear();
    }

    private static StepNode step(int number, String text, SourceSpan span) {
        List<StepPart> parts = new ArrayList<>();
        Matcher condition = CONDITION.matcher(text);
        if (condition.find()) {
            parts.add(new ConditionNode(condition.group(1), new ExpressionNode(condition.group(2), span), span));
        }
        Matcher arrow = ARROW.matcher(text);
        if (arrow.find()) {
            parts.add(new ReferenceNode(arrow.group(1).trim(), span));
        }
        return new StepNode(number, text, parts, span);
    }

    private static ListItemNode item(String raw, SourceSpan span) {
        String text = clean(raw);
        Matcher field = ITEM_FIELD.matcher(text);
        if (field.matches()) {
            String value = clean(field.group(2));
            FieldNode node = new FieldNode(field.group(1), literal(value, span), span);
            return ListItemNode.ofField(value.isEmpty() ? field.group(1) + ":" : field.group(1) + ": " + value, node, span);
        }
        return ListItemNode.ofText(text, span);
    }

    private static LiteralNode literal(String value, SourceSpan span) {
        if (value.isEmpty()) {
            return null;
        }
        Matcher quoted = QUOTED.matcher(value);
        if (quoted.matches()) {
            return new LiteralNode(LiteralKind.STRING, quoted.group(1) != null ? quoted.group(1) : quoted.group(2), span);
        }
        if (NUMBER.matcher(value).matches()) {
            return new LiteralNode(LiteralKind.NUMBER, value, span);
        }
        if (BOOLEAN.matcher(value).matches()) {
            return new LiteralNode(LiteralKind.BOOLEAN, value, span);
        }
        return new LiteralNode(LiteralKind.TEXT, value, span);
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }
}
