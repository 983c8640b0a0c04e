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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for a {@link RuleEngine}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class EngineConfig {

    public static final int DEFAULT_MAX_ERRORS = 100;
    public static final int DEFAULT_MAX_NODES = 100;

    private final Set<RuleCategory> enabledCategories;
    private final boolean strictMode;
    private final boolean failFast;
    private final int maxErrors;
    private final int maxNodes;

    private EngineConfig(Builder builder) {
        this.enabledCategories = builder.enabledCategories.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(builder.enabledCategories));
        this.strictMode = builder.strictMode;
        this.failFast = builder.failFast;
        this.maxErrors = builder.maxErrors;
        this.maxNodes = builder.maxNodes;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public Set<RuleCategory> getEnabledCategories() {
        return enabledCategories;
    }

    public boolean isCategoryEnabled(RuleCategory category) {
        return enabledCategories.contains(category);
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public boolean isFailFast() {
        return failFast;
    }

    /**
     * @return number of error-severity failures after which the engine stops
     */
    public int getMaxErrors() {
        return maxErrors;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
               "enabledCategories=" + enabledCategories +
               ", strictMode=" + strictMode +
               ", failFast=" + failFast +
               ", maxErrors=" + maxErrors +
               ", maxNodes=" + maxNodes +
               '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static class Builder {
        private final Set<RuleCategory> enabledCategories = EnumSet.allOf(RuleCategory.class);
        private boolean strictMode = false;
        private boolean failFast = false;
        private int maxErrors = DEFAULT_MAX_ERRORS;
        private int maxNodes = DEFAULT_MAX_NODES;

        public Builder enabledCategories(Collection<RuleCategory> categories) {
            Objects.requireNonNull(categories, "Categories cannot be null");
            this.enabledCategories.clear();
            this.enabledCategories.addAll(categories);
            return this;
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            if (maxErrors <= 0) {
                throw new IllegalArgumentException("Max errors must be positive");
            }
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            if (maxNodes <= 0) {
                throw new IllegalArgumentException("Max nodes must be positive");
            }
            this.maxNodes = maxNodes;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
