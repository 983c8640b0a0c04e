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

import dev.mars.flowsmith.contract.PromptConstraints;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.SectionNode;
import dev.mars.flowsmith.graph.NodeType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static dev.mars.flowsmith.dsl.transform.SectionEntries.Entry;
import static dev.mars.flowsmith.dsl.transform.SectionEntries.FreeItem;

/**
 * Reads {@code @constraints}. Anything not understood is kept as a custom rule, in source order.
 */
final class ConstraintsExtractor implements SectionExtractor<PromptConstraints> {

    private static final String SECTION = "@constraints";

    @Override
    public PromptConstraints extract(SectionNode section, Diagnostics diagnostics) {
        PromptConstraints.Builder constraints = PromptConstraints.builder();
        List<Sourced> custom = new ArrayList<>();

        for (Entry entry : SectionEntries.entries(section)) {
            if (SectionEntries.matches(entry, "max_nodes", "maxnodes", "maximo", "max_nodos", "maximo_nodos")) {
                SectionEntries.parseInteger(entry, SECTION + ".max_nodes", diagnostics).ifPresent(constraints::maxNodes);
            } else if (SectionEntries.matches(entry, "timeout", "timeout_seconds", "tiempo_limite")) {
                SectionEntries.parseInteger(entry, SECTION + ".timeout", diagnostics).ifPresent(constraints::timeoutSeconds);
            } else if (SectionEntries.matches(entry, "require_credentials", "requires_credentials", "requiere_credenciales")) {
                SectionEntries.parseBoolean(entry, SECTION + ".require_credentials", diagnostics)
                        .ifPresent(constraints::requireCredentials);
            } else if (SectionEntries.matches(entry, "allowed_nodes", "allowed_types", "nodos_permitidos")) {
                SectionEntries.parseList(entry).forEach(type -> constraints.allowedType(qualify(type)));
            } else if (SectionEntries.matches(entry, "forbidden_nodes", "forbidden_types", "nodos_prohibidos")) {
                SectionEntries.parseList(entry).forEach(type -> constraints.forbiddenType(qualify(type)));
            } else {
                custom.add(new Sourced(entry.text(), entry.span().startLine(), entry.span().startColumn()));
            }
        }
        for (FreeItem item : SectionEntries.freeItems(section)) {
            if (!item.text().isBlank()) {
                custom.add(new Sourced(item.text(), item.span().startLine(), item.span().startColumn()));
            }
        }
        custom.sort(Comparator.comparingInt(Sourced::line).thenComparingInt(Sourced::column));
        custom.forEach(rule -> constraints.customRule(rule.text()));
        return constraints.build();
    }

    /**
     * Catalogued types are stored by their qualified runtime name; others are kept as written.
     */
    static String qualify(String typeName) {
        return NodeType.fromTypeName(typeName).map(NodeType::getTypeName).orElse(typeName);
    }

    private record Sourced(String text, int line, int column) {
    }
}
