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
 * A numbered workflow step. Indented continuation lines are folded into its text.
 */
public record StepNode(int number, String text, List<StepPart> parts, SourceSpan span) implements SectionEntry {

    public StepNode {
        Objects.requireNonNull(text, "Step text cannot be null");
        parts = List.copyOf(parts);
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.STEP;
    }

    @Override
    public List<StepPart> children() {
        return parts;
    }

    @Override
    public Optional<String> scalar() {
        return Optional.of(text);
    }

    public Optional<ConditionNode> condition() {
        return parts.stream()
                .filter(ConditionNode.class::isInstance)
                .map(ConditionNode.class::cast)
                .findFirst();
    }

    public Optional<ReferenceNode> reference() {
        return parts.stream()
                .filter(ReferenceNode.class::isInstance)
                .map(ReferenceNode.class::cast)
                .findFirst();
    }
}
