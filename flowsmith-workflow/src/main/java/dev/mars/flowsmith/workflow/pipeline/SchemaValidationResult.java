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

package dev.mars.flowsmith.workflow.pipeline;

import java.util.List;

/**
 * Outcome of a schema check. Errors are formatted as {@code fieldPath: message}.
 */
public record SchemaValidationResult(boolean valid, List<String> errors) {

    public SchemaValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static SchemaValidationResult success() {
        return new SchemaValidationResult(true, List.of());
    }

    public static SchemaValidationResult failure(List<String> errors) {
        return new SchemaValidationResult(false, errors);
    }
}
