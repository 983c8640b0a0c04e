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
 * Default behaviour assumed for a node that fails at run time.
 */
public enum ErrorPolicy {
    STOP("stop"),
    CONTINUE("continue"),
    RETRY("retry");

    private final String label;

    ErrorPolicy(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ErrorPolicy> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        for (ErrorPolicy policy : values()) {
            if (policy.label.equals(value)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
