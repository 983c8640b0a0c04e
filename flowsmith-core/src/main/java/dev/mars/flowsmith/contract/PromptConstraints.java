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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Limits a prompt places on the generated workflow, from the {@code @constraints} section.
 * Node types are held as runtime type names, e.g. {@code httpRequest}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PromptConstraints {

    private static final PromptConstraints EMPTY = builder().build();

    private final Integer maxNodes;
    private final Integer timeoutSeconds;
    private final Boolean requireCredentials;
    private final Set<String> allowedTypes;
    private final Set<String> forbiddenTypes;
    private final List<String> customRules;

    private PromptConstraints(Builder builder) {
        this.maxNodes = builder.maxNodes;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.requireCredentials = builder.requireCredentials;
        this.allowedTypes = java.util.Collections.unmodifiableSet(new LinkedHashSet<>(builder.allowedTypes));
        this.forbiddenTypes = java.util.Collections.unmodifiableSet(new LinkedHashSet<>(builder.forbiddenTypes));
        this.customRules = List.copyOf(builder.customRules);
    }

    public static PromptConstraints empty() {
        return EMPTY;
    }

    public Optional<Integer> getMaxNodes() {
        return Optional.ofNullable(maxNodes);
    }

    public Optional<Integer> getTimeoutSeconds() {
        return Optional.ofNullable(timeoutSeconds);
    }

    public Optional<Boolean> getRequireCredentials() {
        return Optional.ofNullable(requireCredentials);
    }

    public Set<String> getAllowedTypes() {
        return allowedTypes;
    }

    public Set<String> getForbiddenTypes() {
        return forbiddenTypes;
    }

    public List<String> getCustomRules() {
        return customRules;
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptConstraints that = (PromptConstraints) o;
        return Objects.equals(maxNodes, that.maxNodes) &&
               Objects.equals(timeoutSeconds, that.timeoutSeconds) &&
               Objects.equals(requireCredentials, that.requireCredentials) &&
               allowedTypes.equals(that.allowedTypes) &&
               forbiddenTypes.equals(that.forbiddenTypes) &&
               customRules.equals(that.customRules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxNodes, timeoutSeconds, requireCredentials, allowedTypes, forbiddenTypes, customRules);
    }

    @Override
    public String toString() {
        return "PromptConstraints{" +
               "maxNodes=" + maxNodes +
               ", timeoutSeconds=" + timeoutSeconds +
               ", requireCredentials=" + requireCredentials +
               ", allowedTypes=" + allowedTypes +
               ", forbiddenTypes=" + forbiddenTypes +
               ", customRules=" + customRules +
               '}';
    }

    /**
     * Builder for PromptConstraints.
     */
    public static class Builder {
        private Integer maxNodes;
        private Integer timeoutSeconds;
        private Boolean requireCredentials;
        private final Set<String> allowedTypes = new LinkedHashSet<>();
        private final Set<String> forbiddenTypes = new LinkedHashSet<>();
        private final List<String> customRules = new ArrayList<>();

        public Builder maxNodes(Integer maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder requireCredentials(Boolean requireCredentials) {
            this.requireCredentials = requireCredentials;
            return this;
        }

        public Builder allowedType(String typeName) {
            this.allowedTypes.add(typeName);
            return this;
        }

        public Builder forbiddenType(String typeName) {
            this.forbiddenTypes.add(typeName);
            return this;
        }

        public Builder customRule(String rule) {
            this.customRules.add(rule);
            return this;
        }

        public PromptConstraints build() {
            return new PromptConstraints(this);
        }
    }
}
