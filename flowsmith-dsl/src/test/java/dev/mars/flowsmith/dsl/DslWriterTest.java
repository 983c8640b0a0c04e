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

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.contract.PromptTrigger;
import dev.mars.flowsmith.contract.TriggerKind;
import dev.mars.flowsmith.contract.WorkflowStep;
import dev.mars.flowsmith.graph.NodeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DslWriter.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class DslWriterTest {

    private final DslWriter writer = new DslWriter();
    private final DslCompiler compiler = new DslCompiler();

    @Test
    void testWritesCanonicalText() {
        PromptContract contract = PromptContract.builder()
                .trigger(PromptTrigger.builder().kind(TriggerKind.WEBHOOK).path("/x").build())
                .step(new WorkflowStep(1, "Call http api", NodeType.HTTP_REQUEST, null))
                .build();

        assertEquals("@trigger\ntype: webhook\npath: /x\n\n@workflow\n1. Call http api\n", writer.write(contract));
    }

    @Test
    void testWrittenTextCompilesToTheSameContract() throws DslCompileException {
        String prompt = String.join("\n",
                "@meta",
                "version: 1.1.0",
                "output: yaml",
                "@trigger",
                "type: schedule",
                "schedule: 0 9 * * *",
                "team: finance",
                "@workflow",
                "1. Fetch orders from api",
                "2. If amount > 100 -> notify finance",
                "3. Send email to team",
                "@constraints",
                "- max_nodes: 8",
                "- allowed_nodes: httpRequest, slack",
                "- budget: low",
                "- Avoid paid APIs",
                "@assumptions",
                "- error_handling: continue",
                "- credentials_exist: true",
                "- env_vars: API_KEY",
                "- Data is clean");

        PromptContract original = compiler.compileOrThrow(prompt, CompilerOptions.defaults());
        String written = writer.write(original);
        PromptContract reread = compiler.compileOrThrow(written, CompilerOptions.defaults());

        assertEquals(original, reread);
        assertEquals(written, writer.write(reread));
    }
}
