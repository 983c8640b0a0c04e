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

package dev.mars.flowsmith.workflow.generator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Options controlling how a contract is turned into a workflow graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class GeneratorOptions {

    public static final String DEFAULT_WORKFLOW_NAME = "Generated Workflow";
    public static final double DEFAULT_START_X = 250;
    public static final double DEFAULT_START_Y = 300;
    public static final double DEFAULT_HORIZONTAL_SPACING = 250;

    private final String workflowName;
    private final boolean autoLayout;
    private final double startX;
    private final double startY;
    private final double horizontalSpacing;
    private final boolean includeMetadata;
    private final List<String> tags;
    private final NodeIdGenerator idGenerator;
    private final Clock clock;

    private GeneratorOptions(Builder builder) {
        this.workflowName = builder.workflowName;
        this.autoLayout = builder.autoLayout;
        this.startX = builder.startX;
        this.startY = builder.startY;
        this.horizontalSpacing = builder.horizontalSpacing;
        this.includeMetadata = builder.includeMetadata;
        this.tags = List.copyOf(builder.tags);
        this.idGenerator = builder.idGenerator;
        this.clock = builder.clock;
    }

    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public boolean isAutoLayout() {
        return autoLayout;
    }

    public double getStartX() {
        return startX;
    }

    public double getStartY() {
        return startY;
    }

    public double getHorizontalSpacing() {
        return horizontalSpacing;
    }

    public boolean isIncludeMetadata() {
        return includeMetadata;
    }

    public List<String> getTags() {
        return tags;
    }

    public NodeIdGenerator getIdGenerator() {
        return idGenerator;
    }

    public Clock getClock() {
        return clock;
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .workflowName(workflowName)
                .autoLayout(autoLayout)
                .startX(startX)
                .startY(startY)
                .horizontalSpacing(horizontalSpacing)
                .includeMetadata(includeMetadata)
                .idGenerator(idGenerator)
                .clock(clock);
        tags.forEach(builder::tag);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
               "workflowName='" + workflowName + '\'' +
               ", autoLayout=" + autoLayout +
               ", start=(" + startX + ", " + startY + ")" +
               ", horizontalSpacing=" + horizontalSpacing +
               ", includeMetadata=" + includeMetadata +
               ", tags=" + tags +
               '}';
    }

    /**
     * Builder for GeneratorOptions.
     */
    public static class Builder {
        private String workflowName = DEFAULT_WORKFLOW_NAME;
        private boolean autoLayout = true;
        private double startX = DEFAULT_START_X;
        private double startY = DEFAULT_START_Y;
        private double horizontalSpacing = DEFAULT_HORIZONTAL_SPACING;
        private boolean includeMetadata = true;
        private final List<String> tags = new ArrayList<>();
        private NodeIdGenerator idGenerator = NodeIdGenerator.randomSuffix();
        private Clock clock = Clock.systemUTC();

        public Builder workflowName(String workflowName) {
            this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
            return this;
        }

        public Builder autoLayout(boolean autoLayout) {
            this.autoLayout = autoLayout;
            return this;
        }

        public Builder startX(double startX) {
            this.startX = startX;
            return this;
        }

        public Builder startY(double startY) {
            this.startY = startY;
            return this;
        }

        public Builder horizontalSpacing(double horizontalSpacing) {
            if (horizontalSpacing <= 0) {
                throw new IllegalArgumentException("Horizontal spacing must be positive");
            }
            this.horizontalSpacing = horizontalSpacing;
            return this;
        }

        public Builder includeMetadata(boolean includeMetadata) {
            this.includeMetadata = includeMetadata;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "Tag cannot be null"));
            return this;
        }

        public Builder idGenerator(NodeIdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "Id generator cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(this);
        }
    }
}
