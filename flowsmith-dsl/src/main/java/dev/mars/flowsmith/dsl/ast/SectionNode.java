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

import dev.mars.flowsmith.contract.ContractSection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code @section} and the fields, steps and lists written under it.
 */
public record SectionNode(ContractSection section, List<SectionEntry> entries, SourceSpan span) implements AstNode {

    public SectionNode {
        Objects.requireNonNull(section, "Section cannot be null");
        entries = List.copyOf(entries);
    }

    @Override
    public AstNodeKind kind() {
        return AstNodeKind.SECTION;
    }

    @Override
    public List<SectionEntry> children() {
        return entries;
    }

    @Override
    public Optional<String> scalar() {
        return Optional.of(section.getKeyword());
    }
}
