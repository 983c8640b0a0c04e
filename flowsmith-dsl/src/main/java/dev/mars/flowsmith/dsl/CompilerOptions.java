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

package dev.mars.flowsmith.dsl;

import java.util.Objects;

/**
 * Options controlling a compile run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class CompilerOptions {

    public static final int DEFAULT_MAX_ERRORS = 100;

    private static final CompilerOptions DEFAULTS = builder().build();

    private final boolean strictMode;
    private final boolean ignoreComments;
    private final int maxErrors;
    private final CompileMode mode;

    private CompilerOptions(Builder builder) {
        this.strictMode = builder.strictMode;
        this.ignoreComments = builder.ignoreComments;
        this.maxErrors = builder.maxErrors;
        this.mode = Objects.requireNonNull(builder.mode, "Compile mode cannot be null");
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * In strict mode a missing {@code @meta} section is an error rather than a warning.
     */
    public boolean isStrictMode() {
        return strictMode;
    }

    public boolean isIgnoreComments() {
        return ignoreComments;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public CompileMode getMode() {
        return mode;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
               "strictMode=" + strictMode +
               ", ignoreComments=" + ignoreComments +
               ", maxErrors=" + maxErrors +
               ", mode=" + mode +
               '}';
    }

    /**
     * Builder for CompilerOptions.
     */
    public static class Builder {
        private boolean strictMode = false;
        private boolean ignoreComments = true;
        private int maxErrors = DEFAULT_MAX_ERRORS;
        private CompileMode mode = CompileMode.FULL;

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder ignoreComments(boolean ignoreComments) {
            this.ignoreComments = ignoreComments;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            if (maxErrors <= 0) {
                throw new IllegalArgumentException("maxErrors must be positive");
            }
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder mode(CompileMode mode) {
            this.mode = mode;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
