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

import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.core.DiagnosticKind;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.FieldNode;
import dev.mars.flowsmith.dsl.ast.ListItemNode;
import dev.mars.flowsmith.dsl.ast.ListNode;
import dev.mars.flowsmith.dsl.ast.SectionEntry;
import dev.mars.flowsmith.dsl.ast.SectionNode;
import dev.mars.flowsmith.dsl.ast.SourceSpan;
import dev.mars.flowsmith.dsl.ast.StepNode;
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.graph.StepClassifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code @workflow} into ordered steps and classifies each step's action text.
 * <p>
 * Steps keep their written numbers and source order. Bulleted items are accepted as steps and
 * numbered after the highest number seen so far.
 */
final class WorkflowExtractor implements SectionExtractor<List<WorkflowStep>> {

    private static final String SECTION = "@workflow";

    @Override
    public List<WorkflowStep> extract(SectionNode section, Diagnostics diagnostics) {
        List<WorkflowStep> steps = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        int highest = 0;

        for (SectionEntry entry : section.entries()) {
            if (entry instanceof StepNode) {
                StepNode step = (StepNode) entry;
                String condition = step.condition().flatMap(c -> c.scalar()).orElse(null);
                steps.add(toStep(step.number(), step.text(), condition, step.span(), seen, diagnostics));
                highest = Math.max(highest, step.number());
            } else if (entry instanceof ListNode) {
                for (ListItemNode item : ((ListNode) entry).items()) {
                    int number = highest == Integer.MAX_VALUE ? highest : highest + 1;
                    steps.add(toStep(number, item.text(), null, item.span(), seen, diagnostics));
                    highest = number;
                }
            } else if (entry instanceof FieldNode) {
                FieldNode field = (FieldNode) entry;
                diagnostics.addWarning(DiagnosticKind.SYNTAX, "STRAY_CONTENT",
                        field.span().startLine(), field.span().startColumn(), SECTION,
                        "Field '" + field.name() + "' has no meaning in " + SECTION + "; write steps as 'N. action'");
            }
        }
        return steps;
    }

    private static WorkflowStep toStep(int number, String rawText, String condition, SourceSpan span,
                                       Set<Integer> seen, Diagnostics diagnostics) {
        String text = rawText.trim();
        if (text.isEmpty()) {
            diagnostics.addWarning(DiagnosticKind.SEMANTIC, "EMPTY_STEP", span.startLine(), span.startColumn(),
                    SECTION + "." + number, "Step " + number + " has no action text");
        }
        if (!seen.add(number)) {
            diagnostics.addWarning(DiagnosticKind.SEMANTIC, "DUPLICATE_STEP", span.startLine(), span.startColumn(),
                    SECTION + "." + number, "Step number " + number + " is used more than once");
        }
        NodeType inferred = StepClassifier.classifyStep(text).orElse(null);
        String conditionText = condition;
        if (conditionText == null && StepClassifier.isConditional(text)) {
            conditionText = text;
        }
        return new WorkflowStep(number, text, inferred, conditionText);
    }
}
