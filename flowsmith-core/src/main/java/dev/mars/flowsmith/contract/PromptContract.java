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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, validated record extracted from a prompt document. Immutable once built.
 * <p>
 * A contract always carries a trigger (manual when none was described) and at least one step.
 * Constraints and assumptions default to empty records when their section was not written.
 * The trigger and workflow sections count as declared only when the builder is told so; meta,
 * constraints and assumptions are also declared by non-default content.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PromptContract {

    private final PromptMeta meta;
    private final PromptTrigger trigger;
    private final List<WorkflowStep> steps;
    private final PromptConstraints constraints;
    private final PromptAssumptions assumptions;
    private final Set<ContractSection> declaredSections;

    private PromptContract(Builder builder) {
        this.meta = Objects.requireNonNull(builder.meta, "Meta cannot be null");
        this.trigger = Objects.requireNonNull(builder.trigger, "Trigger cannot be null");
        if (builder.steps.isEmpty()) {
            throw new IllegalArgumentException("A prompt contract requires at least one workflow step");
        }
        this.steps = List.copyOf(builder.steps);
        this.constraints = Objects.requireNonNull(builder.constraints, "Constraints cannot be null");
        this.assumptions = Objects.requireNonNull(builder.assumptions, "Assumptions cannot be null");

        EnumSet<ContractSection> sections = EnumSet.noneOf(ContractSection.class);
        sections.addAll(builder.declaredSections);
        if (!meta.equals(PromptMeta.defaults())) {
            sections.add(ContractSection.META);
        }
        if (!constraints.isEmpty()) {
            sections.add(ContractSection.CONSTRAINTS);
        }
        if (!assumptions.isEmpty()) {
            sections.add(ContractSection.ASSUMPTIONS);
        }
        this.declaredSections = Collections.unmodifiableSet(sections);
    }

    public PromptMeta getMeta() {
        return meta;
    }

    public PromptTrigger getTrigger() {
        return trigger;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public PromptConstraints getConstraints() {
        return constraints;
    }

    public PromptAssumptions getAssumptions() {
        return assumptions;
    }

    /**
     * @return the sections that were written in the source document (or implied by non-default content)
     */
    public Set<ContractSection> getDeclaredSections() {
        return declaredSections;
    }

    public boolean isDeclared(ContractSection section) {
        return declaredSections.contains(section);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptContract that = (PromptContract) o;
        return meta.equals(that.meta) &&
               trigger.equals(that.trigger) &&
               steps.equals(that.steps) &&
               constraints.equals(that.constraints) &&
               assumptions.equals(that.assumptions) &&
               declaredSections.equals(that.declaredSections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(meta, trigger, steps, constraints, assumptions, declaredSections);
    }

    @Override
    public String toString() {
        return "PromptContract{" +
               "meta=" + meta +
               ", trigger=" + trigger +
               ", steps=" + steps +
               ", constraints=" + constraints +
               ", assumptions=" + assumptions +
               ", declaredSections=" + declaredSections +
               '}';
    }

    /**
     * Builder for PromptContract.
     */
    public static class Builder {
        private PromptMeta meta = PromptMeta.defaults();
        private PromptTrigger trigger = PromptTrigger.manual();
        private final List<WorkflowStep> steps = new ArrayList<>();
        private PromptConstraints constraints = PromptConstraints.empty();
        private PromptAssumptions assumptions = PromptAssumptions.empty();
        private final Set<ContractSection> declaredSections = EnumSet.noneOf(ContractSection.class);

        public Builder meta(PromptMeta meta) {
            this.meta = meta;
            return this;
        }

        public Builder trigger(PromptTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            steps.forEach(this::step);
            return this;
        }

        public Builder constraints(PromptConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder assumptions(PromptAssumptions assumptions) {
            this.assumptions = assumptions;
            return this;
        }

        public Builder declared(ContractSection section) {
            this.declaredSections.add(section);
            return this;
        }

        public PromptContract build() {
            return new PromptContract(this);
        }
    }
}
