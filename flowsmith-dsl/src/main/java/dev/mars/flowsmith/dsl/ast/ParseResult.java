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

package dev.mars.flowsmith.dsl.ast;

import dev.mars.flowsmith.core.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link AstBuilder#parseToAst}. The builder recovers from malformed input, so a document
 * is present unless the token stream itself was unusable.
 */
public record ParseResult(DocumentNode document, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ParseResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public Optional<DocumentNode> ast() {
        return Optional.ofNullable(document);
    }

    public boolean isSuccess() {
        return document != null && errors.isEmpty();
    }
}
