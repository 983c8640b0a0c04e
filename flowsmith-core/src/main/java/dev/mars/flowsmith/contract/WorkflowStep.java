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

package dev.mars.flowsmith.contract;

import dev.mars.flowsmith.graph.NodeType;

import java.util.Objects;
import java.util.Optional;

/**
 * One numbered step of the {@code @workflow} section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowStep {

    private final int number;
    private final String actionText;
    private final NodeType inferredNodeType;
    private final String conditionText;

    public WorkflowStep(int number, String actionText, NodeType inferredNodeType, String conditionText) {
        this.number = number;
        this.actionText = Objects.requireNonNull(actionText, "Action text cannot be null");
        this.inferredNodeType = inferredNodeType;
        this.conditionText = conditionText;
    }

    public int getNumber() {
        return number;
    }

    public String getActionText() {
        return actionText;
    }

    public Optional<NodeType> getInferredNodeType() {
        return Optional.ofNullable(inferredNodeType);
    }

    /**
     * @return the condition guarding this step, present only for conditional steps
     */
    public Optional<String> getConditionText() {
        return Optional.ofNullable(conditionText);
    }

    public boolean isConditional() {
        return conditionText != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return number == that.number &&
               actionText.equals(that.actionText) &&
               inferredNodeType == that.inferredNodeType &&
               Objects.equals(conditionText, that.conditionText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, actionText, inferredNodeType, conditionText);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
               "number=" + number +
               ", actionText='" + actionText + '\'' +
               ", inferredNodeType=" + inferredNodeType +
               ", conditionText='" + conditionText + '\'' +
               '}';
    }
}
