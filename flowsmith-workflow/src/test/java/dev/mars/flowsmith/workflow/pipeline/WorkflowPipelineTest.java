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

package dev.mars.flowsmith.workflow.pipeline;

import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.graph.WorkflowGraph;
import dev.mars.flowsmith.workflow.rules.EngineReport;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the WorkflowPipeline facade.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class WorkflowPipelineTest {

    private static final String WEBHOOK_PROMPT =
            "@trigger\ntype: webhook\npath: /x\n@workflow\n1. Call http api\n2. Send slack message";

    @Mock
    private GraphSchemaValidator schemaValidator;

    @Mock
    private SuggestionProvider suggestionProvider;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private WorkflowPipeline.Builder pipeline() {
        return WorkflowPipeline.builder().metricsEnabled(false);
    }

    private static List<String> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::getCode).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Core stages")
    class CoreStages {

        @Test
        void testWebhookPromptRunsEndToEnd() {
            PipelineResult result = pipeline().build().run(WEBHOOK_PROMPT);

            assertTrue(result.isSuccess(), () -> result.getErrors().toString());
            WorkflowGraph workflow = result.getWorkflow().orElseThrow();
            assertEquals(3, workflow.getNodes().size());
            assertEquals(2, workflow.connectionCount());
            EngineReport report = result.getEngineReport().orElseThrow();
            assertEquals(report.getTotalRules(), report.getPassedRules());
            assertTrue(result.getSuggestion().isEmpty());
        }

        @Test
        @DisplayName("A prompt that does not compile stops before generation")
        void testCompileFailureStopsPipeline() {
            PipelineResult result = pipeline().schemaValidator(schemaValidator).build()
                    .run("@trigger\ntype: webhook\npath: /x");

            assertFalse(result.isSuccess());
            assertTrue(result.getContract().isEmpty());
            assertTrue(result.getGenerationResult().isEmpty());
            assertTrue(result.getEngineReport().isEmpty());
            assertTrue(codes(result.getErrors()).contains("MISSING_WORKFLOW"));
            verify(schemaValidator, never()).validate(any());
        }

        @Test
        void testMetricsRecordedWithoutFailing() {
            PipelineResult result = WorkflowPipeline.builder().metricsEnabled(true).build().run(WEBHOOK_PROMPT);

            assertTrue(result.isSuccess());
        }

        @Test
        void testValidateSingleCategory() {
            WorkflowPipeline workflowPipeline = pipeline().build();
            WorkflowGraph workflow = workflowPipeline.run(WEBHOOK_PROMPT).getWorkflow().orElseThrow();

            EngineReport report = workflowPipeline.validateCategory(RuleCategory.FLOW, RuleContext.ofGraph(workflow));

            assertTrue(report.isSuccess());
            assertEquals(5, report.getTotalRules());
        }

        @Test
        void testNullTextRejected() {
            assertThrows(NullPointerException.class, () -> pipeline().build().run(null));
        }
    }

    @Nested
    @DisplayName("External collaborators")
    class Collaborators {

        @Test
        void testSchemaFailureBecomesError() {
            when(schemaValidator.validate(any()))
                    .thenReturn(SchemaValidationResult.failure(List.of("nodes[0].type is not allowed")));

            PipelineResult result = pipeline().schemaValidator(schemaValidator).build().run(WEBHOOK_PROMPT);

            assertFalse(result.isSuccess());
            assertEquals(List.of(WorkflowPipeline.SCHEMA_INVALID), codes(result.getErrors()));
            assertEquals("Schema validation failed: nodes[0].type is not allowed",
                    result.getErrors().get(0).getMessage());
            assertTrue(result.getWorkflow().isPresent());
        }

        @Test
        void testSchemaSuccess() {
            when(schemaValidator.validate(any())).thenReturn(SchemaValidationResult.success());

            PipelineResult result = pipeline().schemaValidator(schemaValidator).build().run(WEBHOOK_PROMPT);

            assertTrue(result.isSuccess());
            verify(schemaValidator).validate(any());
        }

        @Test
        @DisplayName("A throwing schema validator is reported as a warning and the run continues")
        void testSchemaValidatorFailure() {
            when(schemaValidator.validate(any())).thenThrow(new IllegalStateException("schema service down"));

            PipelineResult result = pipeline().schemaValidator(schemaValidator).build().run(WEBHOOK_PROMPT);

            assertTrue(result.isSuccess());
            assertTrue(codes(result.getWarnings()).contains(WorkflowPipeline.SCHEMA_VALIDATOR_FAILED));
        }

        @Test
        void testSuggestionReturned() {
            when(suggestionProvider.suggest(any(), any())).thenReturn(Optional.of("Add an error branch"));

            PipelineResult result = pipeline().suggestionProvider(suggestionProvider).build().run(WEBHOOK_PROMPT);

            assertEquals("Add an error branch", result.getSuggestion().orElseThrow());
        }

        @Test
        void testSuggestionProviderFailure() {
            when(suggestionProvider.suggest(any(), any())).thenThrow(new IllegalStateException("timeout"));

            PipelineResult result = pipeline().suggestionProvider(suggestionProvider).build().run(WEBHOOK_PROMPT);

            assertTrue(result.isSuccess());
            assertTrue(result.getSuggestion().isEmpty());
            assertTrue(codes(result.getWarnings()).contains(WorkflowPipeline.SUGGESTION_FAILED));
        }
    }
}
