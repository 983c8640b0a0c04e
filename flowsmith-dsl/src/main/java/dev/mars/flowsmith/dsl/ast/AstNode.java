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
import java.util.Optional;

/**
 * Node of the prompt syntax tree. Nodes are immutable records; a {@link DocumentNode} owns its
 * whole subtree and no node is shared between trees.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public sealed interface AstNode
        permits DocumentNode, SectionNode, SectionEntry, ListItemNode, StepPart, LiteralNode, ExpressionNode {

    AstNodeKind kind();

    SourceSpan span();

    /**
     * @return child nodes in source order
     */
    default List<? extends AstNode> children() {
        return List.of();
    }

    /**
     * @return the node's scalar text, if it carries one
     */
    default Optional<String> scalar() {
        return Optional.empty();
    }
}
