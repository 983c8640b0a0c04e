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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of a workflow as described by the {@code @trigger} section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PromptTrigger {

    private final TriggerKind kind;
    private final String method;
    private final String path;
    private final String schedule;
    private final Map<String, String> options;

    private PromptTrigger(Builder builder) {
        this.kind = builder.kind != null ? builder.kind : TriggerKind.MANUAL;
        this.method = builder.method;
        this.path = builder.path;
        this.schedule = builder.schedule;
        this.options = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    }

    public static PromptTrigger manual() {
        return builder().build();
    }

    public TriggerKind getKind() {
        return kind;
    }

    /**
     * @return the upper-cased HTTP verb, only meaningful for webhook triggers
     */
    public Optional<String> getMethod() {
        return Optional.ofNullable(method);
    }

    public Optional<String> getPath() {
        return Optional.ofNullable(path);
    }

    /**
     * @return the cron expression of a schedule trigger
     */
    public Optional<String> getSchedule() {
        return Optional.ofNullable(schedule);
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptTrigger that = (PromptTrigger) o;
        return kind == that.kind &&
               Objects.equals(method, that.method) &&
               Objects.equals(path, that.path) &&
               Objects.equals(schedule, that.schedule) &&
               options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, method, path, schedule, options);
    }

    @Override
    public String toString() {
        return "PromptTrigger{" +
               "kind=" + kind +
               ", method='" + method + '\'' +
               ", path='" + path + '\'' +
               ", schedule='" + schedule + '\'' +
               ", options=" + options +
               '}';
    }

    /**
     * Builder for PromptTrigger.
     */
    public static class Builder {
        private TriggerKind kind = TriggerKind.MANUAL;
        private String method;
        private String path;
        private String schedule;
        private final Map<String, String> options = new LinkedHashMap<>();

        public Builder kind(TriggerKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder option(String key, String value) {
            this.options.put(Objects.requireNonNull(key, "Option key cannot be null"), value);
            return this;
        }

        public PromptTrigger build() {
            return new PromptTrigger(this);
        }
    }
}
