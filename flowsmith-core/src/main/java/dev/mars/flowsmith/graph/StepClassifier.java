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

package dev.mars.flowsmith.graph;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword heuristics mapping free step text onto a node type.
 * <p>
 * Families are tried in order and the first match wins. The primary families are used when a
 * prompt is compiled; the generator additionally consults the extended families for steps the
 * compiler left unclassified. Keywords cover English and Spanish.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class StepClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern CONDITIONAL = Pattern.compile("\\b(si|cuando|if|when)\\b", FLAGS);

    private static final List<KeywordFamily> PRIMARY = List.of(
            family(NodeType.HTTP_REQUEST, "https?", "api", "request", "llamar", "fetch", "endpoint", "url"),
            family(NodeType.GMAIL, "e-?mail", "correo", "gmail", "mail"),
            family(NodeType.SLACK, "slack", "notify", "notificar", "notification", "message", "mensaje", "chat"),
            family(NodeType.IF, "filter", "filtrar", "condition", "condici[oó]n", "if", "si", "when", "cuando"),
            family(NodeType.SET, "transform", "transformar", "map", "mapear", "set", "convert", "convertir", "asignar"),
            family(NodeType.CODE, "code", "c[oó]digo", "javascript", "script", "python"),
            family(NodeType.POSTGRES, "database", "postgres(?:ql)?", "sql", "db", "base de datos"));

    private static final List<KeywordFamily> EXTENDED = List.of(
            family(NodeType.SWITCH, "switch", "casos", "route", "router", "seg[uú]n"),
            family(NodeType.GOOGLE_SHEETS, "sheet", "spreadsheet", "hoja de c[aá]lculo"),
            family(NodeType.MERGE, "merge", "combinar", "combine", "unir", "join"),
            family(NodeType.WAIT, "wait", "esperar", "delay", "pausa", "sleep"),
            family(NodeType.RESPOND_TO_WEBHOOK, "respond", "responder", "reply", "retornar", "return"));

    private StepClassifier() {
    }

    /**
     * Classifies step text against the primary keyword families.
     */
    public static Optional<NodeType> classifyStep(String text) {
        return match(PRIMARY, text);
    }

    /**
     * Classifies text for node synthesis: primary families, then extended ones, then {@link NodeType#SET}.
     */
    public static NodeType classifyNode(String text) {
        return match(PRIMARY, text)
                .or(() -> match(EXTENDED, text))
                .orElse(NodeType.SET);
    }

    /**
     * @return true when the text contains a conditional keyword ({@code if}, {@code when}, {@code si}, {@code cuando})
     */
    public static boolean isConditional(String text) {
        return text != null && CONDITIONAL.matcher(text).find();
    }

    private static Optional<NodeType> match(List<KeywordFamily> families, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (KeywordFamily family : families) {
            if (family.pattern().matcher(text).find()) {
                return Optional.of(family.type());
            }
        }
        return Optional.empty();
    }

    private static KeywordFamily family(NodeType type, String... keywords) {
        String alternatives = String.join("|", keywords);
        return new KeywordFamily(type, Pattern.compile("\\b(?:" + alternatives + ")s?\\b", FLAGS));
    }

    private record KeywordFamily(NodeType type, Pattern pattern) {
    }
}
