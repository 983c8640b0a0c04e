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

import dev.mars.flowsmith.contract.ErrorPolicy;
import dev.mars.flowsmith.contract.PromptAssumptions;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.SectionNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static dev.mars.flowsmith.dsl.transform.SectionEntries.Entry;
import static dev.mars.flowsmith.dsl.transform.SectionEntries.FreeItem;

/**
 * Reads {@code @assumptions}. Anything not understood is kept as a custom assumption.
 */
final class AssumptionsExtractor implements SectionExtractor<PromptAssumptions> {

    private static final String SECTION = "@assumptions";

    @Override
    public PromptAssumptions extract(SectionNode section, Diagnostics diagnostics) {
        PromptAssumptions.Builder assumptions = PromptAssumptions.builder();
        List<Sourced> custom = new ArrayList<>();

        for (Entry entry : SectionEntries.entries(section)) {
            if (SectionEntries.matches(entry, "error_handling", "errorhandling", "on_error", "manejo_errores")) {
                ErrorPolicy policy = ErrorPolicy.fromLabel(entry.value()).orElse(null);
                if (policy != null) {
                    assumptions.defaultErrorPolicy(policy);
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".error_handling", "stop, continue or retry", diagnostics);
                }
            } else if (SectionEntries.matches(entry, "retries", "default_retries", "reintentos")) {
                SectionEntries.parseInteger(entry, SECTION + ".retries", diagnostics).ifPresent(assumptions::defaultRetries);
            } else if (SectionEntries.matches(entry, "credentials_exist", "assume_credentials", "credenciales")) {
                SectionEntries.parseBoolean(entry, SECTION + ".credentials_exist", diagnostics)
                        .ifPresent(assumptions::assumeCredentials);
            } else if (SectionEntries.matches(entry, "env_vars", "environment", "variables_entorno")) {
                SectionEntries.parseList(entry).forEach(assumptions::envVar);
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
        custom.forEach(text -> assumptions.custom(text.text()));
        return assumptions.build();
    }

    private record Sourced(String text, int line, int column) {
    }
}
