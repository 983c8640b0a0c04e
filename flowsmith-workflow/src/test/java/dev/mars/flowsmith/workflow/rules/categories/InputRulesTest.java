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

package dev.mars.flowsmith.workflow.rules.categories;

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.contract.OutputFormat;
import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.PromptMeta;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.TriggerKind;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.graph.NodeType;
import dev.mars.flowsmith.workflow.WorkflowFixtures;
import dev.mars.flowsmith.workflow.rules.RuleContext;
import dev.mars.flowsmith.workflow.rules.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the input rules, which inspect the compiled contract.
 */
class InputRulesTest {

    private static PromptContract.Builder contract() {
        return PromptContract.builder().step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null));
    }

    private static RuleContext lenient(PromptContract contract) {
        return RuleContext.builder().promptContract(contract).build();
    }

    private static RuleContext strict(PromptContract contract) {
        return RuleContext.builder().promptContract(contract).strictMode(true).build();
    }

    @Nested
    @DisplayName("Meta section")
    class Meta {

        @Test
        void testMissingMetaPassesWhenLenient() {
            RuleResult result = new InputRules.MetaExistsRule().evaluate(lenient(contract().build()));

            assertTrue(result.passed());
        }

        @Test
        void testMissingMetaFailsWhenStrict() {
            RuleResult result = new InputRules.MetaExistsRule().evaluate(strict(contract().build()));

            assertFalse(result.passed());
            assertEquals("Missing @meta section in prompt", result.message());
        }

        @Test
        @DisplayName("A contract declaring strict meta has its meta section")
        void testStrictMetaIsDeclared() {
            PromptContract strictContract = contract().meta(new PromptMeta("1.0.0", OutputFormat.JSON, true)).build();

            RuleContext context = lenient(strictContract);

            assertTrue(context.isStrictMode());
            assertTrue(new InputRules.MetaExistsRule().evaluate(context).passed());
        }

        @Test
        void testExplicitlyDeclaredDefaultMeta() {
            PromptContract declared = contract().declared(ContractSection.META).build();

            assertTrue(new InputRules.MetaExistsRule().evaluate(strict(declared)).passed());
        }
    }

    @Nested
    @DisplayName("Runtime version")
    class RuntimeVersion {

        @Test
        void testDefaultVersionIsValidAndSupported() {
            RuleContext context = lenient(contract().build());

            assertTrue(new InputRules.VersionFormatRule().evaluate(context).passed());
            assertTrue(new InputRules.SupportedVersionRule().evaluate(context).passed());
        }

        @Test
        void testMalformedVersion() {
            PromptContract malformed = contract().meta(new PromptMeta("1.x", OutputFormat.JSON, false)).build();

            RuleResult result = new InputRules.VersionFormatRule().evaluate(lenient(malformed));

            assertFalse(result.passed());
            assertEquals("1.x", result.details().get("providedVersion"));
        }

        @Test
        @DisplayName("A well-formed version outside the supported set fails only the support check")
        void testUnsupportedVersion() {
            RuleContext context = lenient(contract().meta(new PromptMeta("2.0.0", OutputFormat.JSON, false)).build());

            assertTrue(new InputRules.VersionFormatRule().evaluate(context).passed());
            RuleResult result = new InputRules.SupportedVersionRule().evaluate(context);
            assertFalse(result.passed());
            assertEquals(InputRules.SUPPORTED_VERSIONS, result.details().get("supportedVersions"));
        }

        @Test
        void testExplicitTargetVersionOverridesContract() {
            RuleContext context = lenient(contract().build()).toBuilder().targetVersion("1.2.0").build();

            assertEquals("1.2.0", context.getTargetVersion().orElseThrow());
            assertTrue(new InputRules.SupportedVersionRule().evaluate(context).passed());
        }

        @Test
        void testNoVersionAvailable() {
            RuleContext context = RuleContext.ofGraph(WorkflowFixtures.linearGraph());

            RuleResult result = new InputRules.VersionFormatRule().evaluate(context);

            assertFalse(result.passed());
            assertEquals("Runtime version not specified", result.message());
        }
    }

    @Test
    void testTriggerAndWorkflowExist() {
        RuleContext context = lenient(WorkflowFixtures.webhookContract());

        RuleResult trigger = new InputRules.TriggerExistsRule().evaluate(context);
        RuleResult workflow = new InputRules.WorkflowExistsRule().evaluate(context);

        assertTrue(trigger.passed());
        assertEquals("Trigger section exists (webhook)", trigger.message());
        assertTrue(workflow.passed());
        assertEquals("Found 2 workflow steps", workflow.message());
    }

    @Test
    @DisplayName("A contract assembled without the trigger and workflow sections fails both checks")
    void testUndeclaredTriggerAndWorkflow() {
        RuleContext context = lenient(contract().build());

        RuleResult trigger = new InputRules.TriggerExistsRule().evaluate(context);
        RuleResult workflow = new InputRules.WorkflowExistsRule().evaluate(context);

        assertFalse(trigger.passed());
        assertEquals("Missing @trigger section in prompt", trigger.message());
        assertTrue(trigger.isBlocking());
        assertFalse(workflow.passed());
        assertEquals("Missing @workflow section or empty workflow", workflow.message());
        assertEquals("workflow", workflow.details().get("section"));
    }

    @Test
    void testWorkflowWithoutTriggerSection() {
        RuleContext context = lenient(contract().declared(ContractSection.WORKFLOW).build());

        assertFalse(new InputRules.TriggerExistsRule().evaluate(context).passed());
        assertTrue(new InputRules.WorkflowExistsRule().evaluate(context).passed());
    }

    @Test
    void testContractRequired() {
        RuleResult result = new InputRules.TriggerExistsRule().evaluate(RuleContext.ofGraph(WorkflowFixtures.linearGraph()));

        assertFalse(result.passed());
        assertEquals("Prompt contract is required for this rule", result.message());
    }

    @Nested
    @DisplayName("Strict ambiguity")
    class Ambiguity {

        private final PromptContract ambiguous = PromptContract.builder()
                .trigger(PromptTrigger.builder().kind(TriggerKind.WEBHOOK).build())
                .step(new WorkflowStep(1, " ", null, null))
                .build();

        @Test
        void testIgnoredWhenLenient() {
            assertTrue(new InputRules.StrictNoAmbiguityRule().evaluate(lenient(ambiguous)).passed());
        }

        @Test
        void testWebhookWithoutPathAndBlankStep() {
            RuleResult result = new InputRules.StrictNoAmbiguityRule().evaluate(strict(ambiguous));

            assertFalse(result.passed());
            assertEquals(List.of("Step 1: no clear action or node type", "Webhook trigger without path"),
                    result.details().get("ambiguities"));
        }

        @Test
        void testClearContractPasses() {
            assertTrue(new InputRules.StrictNoAmbiguityRule()
                    .evaluate(strict(WorkflowFixtures.webhookContract())).passed());
        }
    }
}
