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

import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.TriggerKind;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.SectionNode;

import java.util.Locale;
import java.util.Set;

import static dev.mars.flowsmith.dsl.transform.SectionEntries.Entry;

/**
 * Reads {@code @trigger}. Unrecognized fields are carried through as trigger options.
 */
final class TriggerExtractor implements SectionExtractor<PromptTrigger> {

    private static final String SECTION = "@trigger";
    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    @Override
    public PromptTrigger extract(SectionNode section, Diagnostics diagnostics) {
        PromptTrigger.Builder trigger = PromptTrigger.builder();
        boolean kindGiven = false;

        for (Entry entry : SectionEntries.entries(section)) {
            if (SectionEntries.matches(entry, "type", "tipo", "kind")) {
                kindGiven = true;
                if (!TriggerKind.isRecognized(entry.value())) {
                    diagnostics.addWarning(DiagnosticKind.SEMANTIC, "INVALID_TRIGGER_TYPE",
                            entry.span().startLine(), entry.span().startColumn(), SECTION + ".type",
                            "Unrecognized trigger type '" + (entry.value() == null ? "" : entry.value())
                                    + "'; defaulting to manual");
                }
                trigger.kind(TriggerKind.fromText(entry.value()));
            } else if (SectionEntries.matches(entry, "method", "metodo", "http_method")) {
                String method = entry.hasValue() ? entry.value().trim().toUpperCase(Locale.ROOT) : "";
                if (HTTP_METHODS.contains(method)) {
                    trigger.method(method);
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".method", "an HTTP method", diagnostics);
                }
            } else if (SectionEntries.matches(entry, "path", "endpoint", "ruta")) {
                if (entry.hasValue()) {
                    trigger.path(entry.value().trim());
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".path", "a path", diagnostics);
                }
            } else if (SectionEntries.matches(entry, "schedule", "cron", "horario", "expression")) {
                if (entry.hasValue()) {
                    trigger.schedule(entry.value().trim());
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".schedule", "a cron expression", diagnostics);
                }
            } else {
                trigger.option(entry.key(), entry.value() == null ? "" : entry.value());
            }
        }

        if (!kindGiven) {
            diagnostics.addWarning(DiagnosticKind.COMPLETENESS, "INVALID_TRIGGER_TYPE",
                    section.span().startLine(), section.span().startColumn(), SECTION + ".type",
                    "No trigger type given; defaulting to manual");
        }
        SectionEntries.warnFreeItems(section, diagnostics);
        return trigger.build();
    }
}
