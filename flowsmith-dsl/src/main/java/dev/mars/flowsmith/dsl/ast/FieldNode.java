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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code key: value} entry. A field written without a value has no literal.
 */
public record FieldNode(String name, LiteralNode literal, SourceSpan span) implements SectionEntry {

    public FieldNode {
        Objects.requireNonNull(name, "Field name cannot be null");
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.FIELD;
    }

    @Override
    public List<LiteralNode> children() {
        return literal == null ? List.of() : List.of(literal);
    }

    @Override
    public Optional<String> scalar() {
        return literal == null ? Optional.empty() : Optional.of(literal.text());
    }
}
