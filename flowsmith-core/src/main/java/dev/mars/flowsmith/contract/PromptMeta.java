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

import java.util.Objects;

/**
 * Document-level settings taken from the {@code @meta} section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class PromptMeta {

    public static final String DEFAULT_RUNTIME_VERSION = "1.0.0";

    private final String runtimeVersion;
    private final OutputFormat outputFormat;
    private final boolean strict;

    public PromptMeta(String runtimeVersion, OutputFormat outputFormat, boolean strict) {
        this.runtimeVersion = Objects.requireNonNull(runtimeVersion, "Runtime version cannot be null");
        this.outputFormat = Objects.requireNonNull(outputFormat, "Output format cannot be null");
        this.strict = strict;
    }

    public static PromptMeta defaults() {
        return new PromptMeta(DEFAULT_RUNTIME_VERSION, OutputFormat.JSON, false);
    }

    public String getRuntimeVersion() {
        return runtimeVersion;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptMeta that = (PromptMeta) o;
        return strict == that.strict &&
               runtimeVersion.equals(that.runtimeVersion) &&
               outputFormat == that.outputFormat;
    }

    @Override
    public int hashCode() {
        return Objects.hash(runtimeVersion, outputFormat, strict);
    }

    @Override
    public String toString() {
        return "PromptMeta{" +
               "runtimeVersion='" + runtimeVersion + '\'' +
               ", outputFormat=" + outputFormat +
               ", strict=" + strict +
               '}';
    }
}
