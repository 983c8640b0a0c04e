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
 * A conditional clause inside a step, e.g. {@code if amount > 100}.
 *
 * @param keyword    the conditional keyword as written ({@code if}, {@code when}, {@code si}, {@code cuando})
 * @param expression the text following the keyword, up to an arrow or the end of the step
 */
public record ConditionNode(String keyword, ExpressionNode expression, SourceSpan span) implements StepPart {

    public ConditionNode {
        Objects.requireNonNull(keyword, "Keyword cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.CONDITION;
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(expression);
    }

    /**
     * @return keyword and expression as one clause
     */
    @Override
    public Optional<String> scalar() {
        return Optional.of(expression.text().isEmpty() ? keyword : keyword + " " + expression.text());
    }
}
