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

import dev.mars.flowsmith.graph.NodeType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PromptContract construction rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class PromptContractTest {

    private static final WorkflowStep STEP = new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null);

    @Test
    void testDefaults() {
        PromptContract contract = PromptContract.builder().step(STEP).build();
        assertEquals(TriggerKind.MANUAL, contract.getTrigger().getKind());
        assertEquals(PromptMeta.defaults(), contract.getMeta());
        assertTrue(contract.getConstraints().isEmpty());
        assertFalse(contract.isDeclared(ContractSection.META));
        assertTrue(contract.getDeclaredSections().isEmpty());
    }

    @Test
    void testTriggerAndWorkflowDeclaredOnlyWhenStated() {
        PromptTrigger webhook = PromptTrigger.builder().kind(TriggerKind.WEBHOOK).path("/x").build();
        PromptContract implicit = PromptContract.builder().step(STEP).trigger(webhook).build();
        PromptContract stated = PromptContract.builder()
                .step(STEP)
                .trigger(webhook)
                .declared(ContractSection.TRIGGER)
                .declared(ContractSection.WORKFLOW)
                .build();

        assertFalse(implicit.isDeclared(ContractSection.TRIGGER));
        assertFalse(implicit.isDeclared(ContractSection.WORKFLOW));
        assertEquals(Set.of(ContractSection.TRIGGER, ContractSection.WORKFLOW), stated.getDeclaredSections());
        assertNotEquals(implicit, stated);
    }

    @Test
    void testStepsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> PromptContract.builder().build());
    }

    @Test
    void testNonDefaultContentMarksSectionDeclared() {
        PromptContract contract = PromptContract.builder()
                .step(STEP)
                .constraints(PromptConstraints.builder().maxNodes(5).build())
                .build();
        assertTrue(contract.isDeclared(ContractSection.CONSTRAINTS));
        assertFalse(contract.isDeclared(ContractSection.ASSUMPTIONS));
    }

    @Test
    void testTriggerKindFromText() {
        assertEquals(TriggerKind.WEBHOOK, TriggerKind.fromText("Webhook"));
        assertEquals(TriggerKind.SCHEDULE, TriggerKind.fromText("cron"));
        assertEquals(TriggerKind.CUSTOM, TriggerKind.fromText("custom"));
        assertEquals(TriggerKind.MANUAL, TriggerKind.fromText("button"));
        assertFalse(TriggerKind.isRecognized("button"));
        assertTrue(TriggerKind.isRecognized("manual"));
    }

    @Test
    void testValueEquality() {
        PromptContract a = PromptContract.builder().step(STEP).trigger(PromptTrigger.builder()
                .kind(TriggerKind.WEBHOOK).path("/x").build()).build();
        PromptContract b = PromptContract.builder().step(STEP).trigger(PromptTrigger.builder()
                .kind(TriggerKind.WEBHOOK).path("/x").build()).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
