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

package dev.mars.flowsmith.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the node-type catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class NodeTypeTest {

    @Test
    void testResolveQualifiedAndShortNames() {
        assertEquals(NodeType.HTTP_REQUEST, NodeType.fromTypeName("n8n-nodes-base.httpRequest").orElseThrow());
        assertEquals(NodeType.HTTP_REQUEST, NodeType.fromTypeName("httprequest").orElseThrow());
        assertTrue(NodeType.fromTypeName("n8n-nodes-base.somethingNew").isEmpty());
        assertTrue(NodeType.fromTypeName(null).isEmpty());
    }

    @Test
    void testTriggerDetection() {
        assertTrue(NodeType.isTriggerType("n8n-nodes-base.webhook"));
        assertTrue(NodeType.isTriggerType("n8n-nodes-base.manualTrigger"));
        assertTrue(NodeType.isTriggerType("n8n-nodes-base.emailReadImapTrigger"));
        assertFalse(NodeType.isTriggerType("n8n-nodes-base.slack"));
    }

    @Test
    void testConditionalNodesExposeTwoOutputs() {
        assertEquals(2, NodeType.IF.getOutputCount());
        assertEquals(1, NodeType.SET.getOutputCount());
    }

    @Test
    void testCatalogEntries() {
        assertEquals("n8n-nodes-base.scheduleTrigger", NodeType.SCHEDULE_TRIGGER.getTypeName());
        assertEquals(4, NodeType.HTTP_REQUEST.getVersion());
        assertTrue(NodeType.SET.getRequiredParameters().contains("assignments"));
        assertTrue(NodeType.SLACK.isTerminal());
        assertFalse(NodeType.IF.isTerminal());
    }
}
