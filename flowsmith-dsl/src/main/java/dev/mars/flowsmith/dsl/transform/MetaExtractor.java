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

import dev.mars.flowsmith.contract.OutputFormat;
import dev.mars.flowsmith.contract.PromptMeta;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.SectionNode;

import static dev.mars.flowsmith.dsl.transform.SectionEntries.Entry;

/**
 * Reads {@code @meta}: target runtime version, output format and strict flag.
 */
final class MetaExtractor implements SectionExtractor<PromptMeta> {

    private static final String SECTION = "@meta";

    @Override
    public PromptMeta extract(SectionNode section, Diagnostics diagnostics) {
        String version = PromptMeta.DEFAULT_RUNTIME_VERSION;
        OutputFormat format = OutputFormat.JSON;
        boolean strict = false;

        for (Entry entry : SectionEntries.entries(section)) {
            if (SectionEntries.matches(entry, "n8n_version", "n8nversion", "version", "runtime_version", "target_version")) {
                if (entry.hasValue()) {
                    version = entry.value().trim();
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".version", "a version", diagnostics);
                }
            } else if (SectionEntries.matches(entry, "output_type", "outputtype", "output", "format", "salida", "formato")) {
                OutputFormat parsed = OutputFormat.fromLabel(entry.value()).orElse(null);
                if (parsed != null) {
                    format = parsed;
                } else {
                    SectionEntries.warnInvalid(entry, SECTION + ".output", "json, yaml or pretty-json", diagnostics);
                }
            } else if (SectionEntries.matches(entry, "strict", "strict_mode", "estricto")) {
                strict = SectionEntries.parseBoolean(entry, SECTION + ".strict", diagnostics).orElse(false);
            } else {
                SectionEntries.warnUnknown(entry, SECTION, diagnostics);
            }
        }
        SectionEntries.warnFreeItems(section, diagnostics);
        return new PromptMeta(version, format, strict);
    }
}
