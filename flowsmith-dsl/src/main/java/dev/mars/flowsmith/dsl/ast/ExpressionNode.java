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

import java.util.Objects;
import java.util.Optional;

/**
 * Free-form expression text, such as the test of a condition.
 */
public record ExpressionNode(String text, SourceSpan span) implements AstNode {

    public ExpressionNode {
        Objects.requireNonNull(text, "Expression text cannot be null");
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.EXPRESSION;
    }

    @Override
    public Optional<String> scalar() {
        return Optional.of(text);
    }
}
