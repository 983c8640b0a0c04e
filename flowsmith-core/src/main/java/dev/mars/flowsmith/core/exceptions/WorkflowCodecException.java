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

package dev.mars.flowsmith.core.exceptions;

/**
 * Thrown when a workflow graph cannot be written to, or read from, its JSON form.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowCodecException extends FlowsmithException {

    private final String fieldPath;

    public WorkflowCodecException(String message) {
        this(message, null, null);
    }

    public WorkflowCodecException(String message, String fieldPath) {
        this(message, fieldPath, null);
    }

    public WorkflowCodecException(String message, String fieldPath, Throwable cause) {
        super(message, cause);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        if (fieldPath == null) {
            return super.getMessage();
        }
        return super.getMessage() + " (field: " + fieldPath + ")";
    }
}
