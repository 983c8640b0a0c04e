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

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.contract.PromptAssumptions;
import dev.mars.flowsmith.contract.PromptConstraints;
import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.PromptMeta;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.WorkflowStep;

import java.util.Collection;
import java.util.Objects;

/**
 * Renders a contract back to canonical prompt text. Compiling the output yields a contract equal
 * to the one written.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DslWriter {

    public String write(PromptContract contract) {
        Objects.requireNonNull(contract, "Contract cannot be null");
        StringBuilder out = new StringBuilder();

        if (contract.isDeclared(ContractSection.META)) {
            writeMeta(contract.getMeta(), out);
        }
        writeTrigger(contract.getTrigger(), out);
        writeSteps(contract, out);
        if (contract.isDeclared(ContractSection.CONSTRAINTS)) {
            writeConstraints(contract.getConstraints(), out);
        }
        if (contract.isDeclared(ContractSection.ASSUMPTIONS)) {
            writeAssumptions(contract.getAssumptions(), out);
        }
        return out.toString();
    }

    private static void writeMeta(PromptMeta meta, StringBuilder out) {
        header(ContractSection.META, out);
        field("version", meta.getRuntimeVersion(), out);
        field("output", meta.getOutputFormat().getLabel(), out);
        field("strict", String.valueOf(meta.isStrict()), out);
    }

    private static void writeTrigger(PromptTrigger trigger, StringBuilder out) {
        header(ContractSection.TRIGGER, out);
        field("type", trigger.getKind().getLabel(), out);
        trigger.getMethod().ifPresent(method -> field("method", method, out));
        trigger.getPath().ifPresent(path -> field("path", path, out));
        trigger.getSchedule().ifPresent(schedule -> field("schedule", schedule, out));
        trigger.getOptions().forEach((key, value) -> field(key, value, out));
    }

    private static void writeSteps(PromptContract contract, StringBuilder out) {
        header(ContractSection.WORKFLOW, out);
        for (WorkflowStep step : contract.getSteps()) {
            out.append(step.getNumber()).append('.');
            if (!step.getActionText().isEmpty()) {
                out.append(' ').append(step.getActionText());
            }
            out.append('\n');
        }
    }

    private static void writeConstraints(PromptConstraints constraints, StringBuilder out) {
        header(ContractSection.CONSTRAINTS, out);
        constraints.getMaxNodes().ifPresent(max -> field("max_nodes", String.valueOf(max), out));
        constraints.getTimeoutSeconds().ifPresent(timeout -> field("timeout", String.valueOf(timeout), out));
        constraints.getRequireCredentials().ifPresent(flag -> field("require_credentials", String.valueOf(flag), out));
        listField("allowed_nodes", constraints.getAllowedTypes(), out);
        listField("forbidden_nodes", constraints.getForbiddenTypes(), out);
        constraints.getCustomRules().forEach(rule -> out.append("- ").append(rule).append('\n'));
    }

    private static void writeAssumptions(PromptAssumptions assumptions, StringBuilder out) {
        header(ContractSection.ASSUMPTIONS, out);
        assumptions.getDefaultErrorPolicy().ifPresent(policy -> field("error_handling", policy.getLabel(), out));
        assumptions.getDefaultRetries().ifPresent(retries -> field("retries", String.valueOf(retries), out));
        assumptions.getAssumeCredentials().ifPresent(flag -> field("credentials_exist", String.valueOf(flag), out));
        listField("env_vars", assumptions.getEnvVars(), out);
        assumptions.getCustom().forEach(item -> out.append("- ").append(item).append('\n'));
    }

    private static void header(ContractSection section, StringBuilder out) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(section.getMarker()).append('\n');
    }

    private static void field(String key, String value, StringBuilder out) {
        out.append(key).append(':');
        if (value != null && !value.isEmpty()) {
            out.append(' ').append(value);
        }
        out.append('\n');
    }

    private static void listField(String key, Collection<String> values, StringBuilder out) {
        if (!values.isEmpty()) {
            field(key, String.join(", ", values), out);
        }
    }
}
