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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Facts a prompt asks the generator to take for granted, from the {@code @assumptions} section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PromptAssumptions {

    private static final PromptAssumptions EMPTY = builder().build();

    private final ErrorPolicy defaultErrorPolicy;
    private final Integer defaultRetries;
    private final Boolean assumeCredentials;
    private final List<String> envVars;
    private final List<String> custom;

    private PromptAssumptions(Builder builder) {
        this.defaultErrorPolicy = builder.defaultErrorPolicy;
        this.defaultRetries = builder.defaultRetries;
        this.assumeCredentials = builder.assumeCredentials;
        this.envVars = List.copyOf(builder.envVars);
        this.custom = List.copyOf(builder.custom);
    }

    public static PromptAssumptions empty() {
        return EMPTY;
    }

    public Optional<ErrorPolicy> getDefaultErrorPolicy() {
        return Optional.ofNullable(defaultErrorPolicy);
    }

    public Optional<Integer> getDefaultRetries() {
        return Optional.ofNullable(defaultRetries);
    }

    public Optional<Boolean> getAssumeCredentials() {
        return Optional.ofNullable(assumeCredentials);
    }

    public List<String> getEnvVars() {
        return envVars;
    }

    public List<String> getCustom() {
        return custom;
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
        PromptAssumptions that = (PromptAssumptions) o;
        return defaultErrorPolicy == that.defaultErrorPolicy &&
               Objects.equals(defaultRetries, that.defaultRetries) &&
               Objects.equals(assumeCredentials, that.assumeCredentials) &&
               envVars.equals(that.envVars) &&
               custom.equals(that.custom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultErrorPolicy, defaultRetries, assumeCredentials, envVars, custom);
    }

    @Override
    public String toString() {
        return "PromptAssumptions{" +
               "defaultErrorPolicy=" + defaultErrorPolicy +
               ", defaultRetries=" + defaultRetries +
               ", assumeCredentials=" + assumeCredentials +
               ", envVars=" + envVars +
               ", custom=" + custom +
               '}';
    }

    /**
     * Builder for PromptAssumptions.
     */
    public static class Builder {
        private ErrorPolicy defaultErrorPolicy;
        private Integer defaultRetries;
        private Boolean assumeCredentials;
        private final List<String> envVars = new ArrayList<>();
        private final List<String> custom = new ArrayList<>();

        public Builder defaultErrorPolicy(ErrorPolicy defaultErrorPolicy) {
            this.defaultErrorPolicy = defaultErrorPolicy;
            return this;
        }

        public Builder defaultRetries(Integer defaultRetries) {
            this.defaultRetries = defaultRetries;
            return this;
        }

        public Builder assumeCredentials(Boolean assumeCredentials) {
            this.assumeCredentials = assumeCredentials;
            return this;
        }

        public Builder envVar(String name) {
            this.envVars.add(name);
            return this;
        }

        public Builder custom(String assumption) {
            this.custom.add(assumption);
            return this;
        }

        public PromptAssumptions build() {
            return new PromptAssumptions(this);
        }
    }
}
