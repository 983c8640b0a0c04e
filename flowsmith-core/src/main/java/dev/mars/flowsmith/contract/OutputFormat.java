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

package dev.mars.flowsmith.contract;

import java.util.Locale;
import java.util.Optional;

/**
 * Serialization format requested by a prompt for the exported workflow.
 */
public enum OutputFormat {
    JSON("json"),
    YAML("yaml"),
    PRETTY_JSON("pretty-json");

    private final String label;

    OutputFormat(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<OutputFormat> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (OutputFormat format : values()) {
            if (format.label.equals(value)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
