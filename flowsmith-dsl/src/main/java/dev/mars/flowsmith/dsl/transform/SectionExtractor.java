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

package dev.mars.flowsmith.dsl.transform;

import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.SectionNode;

/**
 * Turns the entries of one section into its contract record. Implementations hold no state;
 * problems are reported to the supplied diagnostics.
 *
 * @param <T> the contract record produced
 */
@FunctionalInterface
interface SectionExtractor<T> {

    T extract(SectionNode section, Diagnostics diagnostics);
}
