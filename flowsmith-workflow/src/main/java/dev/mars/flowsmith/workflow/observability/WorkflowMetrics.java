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

package dev.mars.flowsmith.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the compile, generate and validate pipeline.
 * Recording is a no-op unless an OpenTelemetry SDK is installed globally.
 *
 * Provides 9 metrics:
 * - flowsmith.compile.total (counter) - DSL compilations
 * - flowsmith.compile.failed (counter) - Compilations that produced no contract
 * - flowsmith.compile.duration.seconds (histogram) - Compilation duration
 * - flowsmith.generate.total (counter) - Workflow generations
 * - flowsmith.generate.nodes (histogram) - Nodes per generated workflow
 * - flowsmith.rules.executed (counter) - Rules evaluated
 * - flowsmith.rules.failed (counter) - Rules that failed
 * - flowsmith.rules.errors (counter) - Blocking rule errors
 * - flowsmith.validate.duration.seconds (histogram) - Rule engine run duration
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "flowsmith-workflow";

    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter compileTotal;
    private final LongCounter compileFailed;
    private final LongCounter generateTotal;
    private final LongCounter rulesExecuted;
    private final LongCounter rulesFailed;
    private final LongCounter rulesErrors;

    // Histograms
    private final DoubleHistogram compileDuration;
    private final DoubleHistogram generatedNodes;
    private final DoubleHistogram validateDuration;

    private static final AttributeKey<String> COMPILE_MODE_KEY = AttributeKey.stringKey("compile.mode");
    private static final AttributeKey<String> TRIGGER_KIND_KEY = AttributeKey.stringKey("trigger.kind");
    private static final AttributeKey<String> RULE_CATEGORY_KEY = AttributeKey.stringKey("rule.category");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        compileTotal = meter.counterBuilder("flowsmith.compile.total")
                .setDescription("Total number of DSL compilations")
                .setUnit("1")
                .build();

        compileFailed = meter.counterBuilder("flowsmith.compile.failed")
                .setDescription("Number of compilations that produced no contract")
                .setUnit("1")
                .build();

        generateTotal = meter.counterBuilder("flowsmith.generate.total")
                .setDescription("Total number of workflow generations")
                .setUnit("1")
                .build();

        rulesExecuted = meter.counterBuilder("flowsmith.rules.executed")
                .setDescription("Number of validation rules evaluated")
                .setUnit("1")
                .build();

        rulesFailed = meter.counterBuilder("flowsmith.rules.failed")
                .setDescription("Number of validation rules that failed")
                .setUnit("1")
                .build();

        rulesErrors = meter.counterBuilder("flowsmith.rules.errors")
                .setDescription("Number of blocking validation errors")
                .setUnit("1")
                .build();

        compileDuration = meter.histogramBuilder("flowsmith.compile.duration.seconds")
                .setDescription("DSL compilation duration in seconds")
                .setUnit("s")
                .build();

        generatedNodes = meter.histogramBuilder("flowsmith.generate.nodes")
                .setDescription("Number of nodes per generated workflow")
                .setUnit("1")
                .build();

        validateDuration = meter.histogramBuilder("flowsmith.validate.duration.seconds")
                .setDescription("Rule engine run duration in seconds")
                .setUnit("s")
                .build();

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordCompile(String compileMode, boolean success, long elapsedMs) {
        Attributes attrs = Attributes.builder()
                .put(COMPILE_MODE_KEY, compileMode)
                .put(OUTCOME_KEY, success ? "success" : "failure")
                .build();
        compileTotal.add(1, attrs);
        if (!success) {
            compileFailed.add(1, attrs);
        }
        compileDuration.record(elapsedMs / 1000.0, attrs);
    }

    public void recordGeneration(String triggerKind, boolean success, int nodeCount) {
        Attributes attrs = Attributes.builder()
                .put(TRIGGER_KIND_KEY, triggerKind)
                .put(OUTCOME_KEY, success ? "success" : "failure")
                .build();
        generateTotal.add(1, attrs);
        if (success) {
            generatedNodes.record(nodeCount, attrs);
        }
    }

    /**
     * Record the results of one rule category within an engine run.
     */
    public void recordRules(String category, int executed, int failed, int errors) {
        Attributes attrs = Attributes.of(RULE_CATEGORY_KEY, category);
        rulesExecuted.add(executed, attrs);
        rulesFailed.add(failed, attrs);
        rulesErrors.add(errors, attrs);
    }

    public void recordValidation(boolean success, long elapsedMs) {
        validateDuration.record(elapsedMs / 1000.0, Attributes.of(OUTCOME_KEY, success ? "success" : "failure"));
    }
}
