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

package dev.mars.flowsmith.workflow.rules;

/**
 * A single named check over a {@link RuleContext}.
 * <p>
 * Implementations are stateless: {@link #evaluate(RuleContext)} is a pure function of its context
 * and reports failure as a {@link RuleResult}. An exception thrown from {@code evaluate} is treated
 * by the engine as a defect in the rule, not as a validation failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Rule {

    String getId();

    String getName();

    String getDescription();

    RuleCategory getCategory();

    RuleSeverity getSeverity();

    boolean isEnabled();

    RuleResult evaluate(RuleContext context);
}
