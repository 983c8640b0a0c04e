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
 * The five sections of a prompt document, in their canonical order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum ContractSection {
    META("meta"),
    TRIGGER("trigger"),
    WORKFLOW("workflow"),
    CONSTRAINTS("constraints"),
    ASSUMPTIONS("assumptions");

    private final String keyword;

    ContractSection(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * @return the marker as written in a document, e.g. {@code @trigger}
     */
    public String getMarker() {
        return "@" + keyword;
    }

    /**
     * Resolves a section from its keyword or marker, ignoring case.
     */
    public static Optional<ContractSection> fromKeyword(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("@")) {
            key = key.substring(1);
        }
        for (ContractSection section : values()) {
            if (section.keyword.equals(key)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
