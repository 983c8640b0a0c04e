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

package dev.mars.flowsmith.dsl.transform;

import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.FieldNode;
import dev.mars.flowsmith.dsl.ast.ListItemNode;
import dev.mars.flowsmith.dsl.ast.ListNode;
import dev.mars.flowsmith.dsl.ast.SectionEntry;
import dev.mars.flowsmith.dsl.ast.SectionNode;
import dev.mars.flowsmith.dsl.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared helpers for reading section entries: key/value pairs from fields and {@code - key: value}
 * items, free-text items, and value parsing.
 */
final class SectionEntries {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*(-?\\d{1,9})(?!\\d)");

    private SectionEntries() {
    }

    /**
     * A key/value pair. {@code key} is normalized (lower case, dashes and spaces as underscores);
     * {@code text} is the entry as written, used when the pair is kept verbatim.
     */
    record Entry(String key, String value, String text, SourceSpan span) {

        boolean hasValue() {
            return value != null && !value.isBlank();
        }
    }

    record FreeItem(String text, SourceSpan span) {
    }

    static List<Entry> entries(SectionNode section) {
        List<Entry> entries = new ArrayList<>();
        for (SectionEntry entry : section.entries()) {
            if (entry instanceof FieldNode) {
                entries.add(toEntry((FieldNode) entry));
            } else if (entry instanceof ListNode) {
                for (ListItemNode item : ((ListNode) entry).items()) {
                    item.asField().ifPresent(field -> entries.add(toEntry(field)));
                }
            }
        }
        return entries;
    }

    static List<FreeItem> freeItems(SectionNode section) {
        List<FreeItem> items = new ArrayList<>();
        for (SectionEntry entry : section.entries()) {
            if (entry instanceof ListNode) {
                for (ListItemNode item : ((ListNode) entry).items()) {
                    if (item.asField().isEmpty()) {
                        items.add(new FreeItem(item.text(), item.span()));
                    }
                }
            }
        }
        return items;
    }

    static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    static boolean matches(Entry entry, String... aliases) {
        return Arrays.asList(aliases).contains(entry.key());
    }

    static Optional<Integer> parseInteger(Entry entry, String fieldPath, Diagnostics diagnostics) {
        if (entry.hasValue()) {
            Matcher matcher = LEADING_INTEGER.matcher(entry.value());
            if (matcher.find()) {
                return Optional.of(Integer.parseInt(matcher.group(1)));
            }
        }
        warnInvalid(entry, fieldPath, "an integer", diagnostics);
        return Optional.empty();
    }

    /**
     * Parses a boolean flag. A key written with no value counts as {@code true}.
     */
    static Optional<Boolean> parseBoolean(Entry entry, String fieldPath, Diagnostics diagnostics) {
        if (!entry.hasValue()) {
            return Optional.of(Boolean.TRUE);
        }
        switch (entry.value().trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "si":
            case "sí":
            case "verdadero":
            case "1":
                return Optional.of(Boolean.TRUE);
            case "false":
            case "no":
            case "falso":
            case "0":
                return Optional.of(Boolean.FALSE);
            default:
                warnInvalid(entry, fieldPath, "true or false", diagnostics);
                return Optional.empty();
        }
    }

    static List<String> parseList(Entry entry) {
        if (!entry.hasValue()) {
            return List.of();
        }
        return Arrays.stream(entry.value().split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toList());
    }

    static void warnInvalid(Entry entry, String fieldPath, String expected, Diagnostics diagnostics) {
        diagnostics.addWarning(DiagnosticKind.SEMANTIC, "INVALID_VALUE",
                entry.span().startLine(), entry.span().startColumn(), fieldPath,
                "Expected " + expected + " for '" + entry.key() + "' but found '"
                        + (entry.value() == null ? "" : entry.value()) + "'");
    }

    static void warnUnknown(Entry entry, String sectionMarker, Diagnostics diagnostics) {
        diagnostics.addWarning(DiagnosticKind.SEMANTIC, "UNKNOWN_FIELD",
                entry.span().startLine(), entry.span().startColumn(), sectionMarker + "." + entry.key(),
                "Unknown field '" + entry.key() + "' in " + sectionMarker + " ignored");
    }

    static void warnFreeItems(SectionNode section, Diagnostics diagnostics) {
        for (FreeItem item : freeItems(section)) {
            diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT",
                    item.span().startLine(), item.span().startColumn(), section.section().getMarker(),
                    "List item '" + item.text() + "' has no meaning in " + section.section().getMarker());
        }
    }

    private static Entry toEntry(FieldNode field) {
        String value = field.scalar().orElse(null);
        String text = value == null ? field.name() + ":" : field.name() + ": " + value;
        return new Entry(normalizeKey(field.name()), value, text, field.span());
    }
}
