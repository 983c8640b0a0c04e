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
 * One {@code - item} line. An item written as {@code - key: value} carries a field; otherwise its
 * text is held as a literal.
 */
public record ListItemNode(String text, FieldNode field, LiteralNode literal, SourceSpan span) implements AstNode {

    public ListItemNode {
        Objects.requireNonNull(text, "Item text cannot be null");
    }

    public static ListItemNode ofField(String text, FieldNode field, SourceSpan span) {
        return new ListItemNode(text, field, null, span);
    }

    public static ListItemNode ofText(String text, SourceSpan span) {
        return new ListItemNode(text, null, text.isEmpty() ? null : new LiteralNode(LiteralKind.TEXT, text, span), span);
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.LIST_ITEM;
    }

    @Override
    public List<? extends AstNode> children() {
        if (field != null) {
            return List.of(field);
        }
        return literal == null ? List.of() : List.of(literal);
    }

    @Override
    public Optional<String> scalar() {
        return Optional.of(text);
    }

    public Optional<FieldNode> asField() {
        return Optional.ofNullable(field);
    }
}
