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

import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.core.exceptions.FlowsmithException;

import java.util.List;

/**
 * Thrown by {@link DslCompiler#compileOrThrow} when a document does not compile.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DslCompileException extends FlowsmithException {

    private final List<Diagnostic> errors;

    public DslCompileException(List<Diagnostic> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    private static String summarize(List<Diagnostic> errors) {
        if (errors.isEmpty()) {
            return "Compilation failed";
        }
        StringBuilder sb = new StringBuilder("Compilation failed with ")
                .append(errors.size()).append(errors.size() == 1 ? " error" : " errors")
                .append(": ").append(errors.get(0));
        if (errors.size() > 1) {
            sb.append(" (and ").append(errors.size() - 1).append(" more)");
        }
        return sb.toString();
    }
}
