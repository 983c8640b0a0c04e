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

package dev.mars.flowsmith.dsl.ast;

import dev.mars.flowsmith.contract.ContractSection;
import dev.mars.flowsmith.core.Diagnostic;
import dev.mars.flowsmith.dsl.CompilerOptions;
import dev.mars.flowsmith.dsl.lexer.DslLexer;
import dev.mars.flowsmith.dsl.lexer.Token;
import dev.mars.flowsmith.dsl.lexer.TokenKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AstBuilder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class AstBuilderTest {

    private DslLexer lexer;
    private AstBuilder builder;

    @BeforeEach
    void setUp() {
        lexer = new DslLexer();
        builder = new AstBuilder();
    }

    private ParseResult parse(String text) {
        return builder.parseToAst(lexer.tokenize(text, CompilerOptions.defaults()).tokens(), CompilerOptions.defaults());
    }

    private DocumentNode document(String text) {
        ParseResult result = parse(text);
        assertTrue(result.isSuccess(), () -> "Unexpected errors: " + result.errors());
        return result.ast().orElseThrow();
    }

    @Nested
    @DisplayName("Sections")
    class Sections {

        @Test
        void testEntriesAttachToTheOpenSection() {
            DocumentNode doc = document("@trigger\ntype: webhook\npath: /x\n@workflow\n1. Call http api\n2. Send slack message");
            assertEquals(2, doc.sections().size());

            SectionNode trigger = doc.section(ContractSection.TRIGGER).orElseThrow();
            assertEquals(2, trigger.entries().size());
            FieldNode path = (FieldNode) trigger.entries().get(1);
            assertEquals("path", path.name());
            assertEquals("/x", path.scalar().orElseThrow());

            SectionNode workflow = doc.section(ContractSection.WORKFLOW).orElseThrow();
            assertEquals(2, workflow.entries().size());
            assertTrue(workflow.entries().stream().allMatch(e -> e.kind() == AstNodeKind.STEP));
        }

        @Test
        void testUnknownSectionIsSkipped() {
            ParseResult result = parse("@trigger\ntype: manual\n@extras\nfoo: bar\n@workflow\n1. Do it");
            DocumentNode doc = result.ast().orElseThrow();
            SectionNode trigger = doc.section(ContractSection.TRIGGER).orElseThrow();
            assertEquals(1, trigger.entries().size());
            assertTrue(result.warnings().stream().anyMatch(w -> w.getCode().equals("UNKNOWN_SECTION")));
        }

        @Test
        void testDuplicateSectionsAreMerged() {
            ParseResult result = parse("@trigger\ntype: webhook\n@trigger\npath: /y");
            DocumentNode doc = result.ast().orElseThrow();
            assertEquals(1, doc.sections().size());
            assertEquals(2, doc.sections().get(0).entries().size());
            assertTrue(result.warnings().stream().anyMatch(w -> w.getCode().equals("DUPLICATE_SECTION")));
        }

        @Test
        void testContentBeforeFirstSectionIsDropped() {
            ParseResult result = parse("hello there\nname: x\n@trigger\ntype: manual");
            DocumentNode doc = result.ast().orElseThrow();
            assertEquals(1, doc.sections().size());
            assertEquals(1, doc.sections().get(0).entries().size());
            long stray = result.warnings().stream().filter(w -> w.getCode().equals("STRAY_CONTENT")).count();
            assertEquals(2, stray);
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        void testFieldWithoutValueHasNoChildren() {
            FieldNode field = (FieldNode) document("@trigger\npath:\ntype: webhook")
                    .sections().get(0).entries().get(0);
            assertTrue(field.children().isEmpty());
            assertTrue(field.scalar().isEmpty());
        }

        @Test
        void testIndentedContinuationIsFolded() {
            FieldNode field = (FieldNode) document("@constraints\nnote: first part\n  second part\nmax_nodes: 3")
                    .sections().get(0).entries().get(0);
            assertEquals("first part second part", field.scalar().orElseThrow());
        }

        @Test
        void testLiteralKinds() {
            List<SectionEntry> entries = document("@meta\nstrict: true\nversion: 1.0.0\nname: \"quoted\"\nlimit: 5")
                    .sections().get(0).entries();
            assertEquals(LiteralKind.BOOLEAN, ((FieldNode) entries.get(0)).literal().literalKind());
            assertEquals(LiteralKind.TEXT, ((FieldNode) entries.get(1)).literal().literalKind());
            assertEquals("1.0.0", ((FieldNode) entries.get(1)).literal().text());
            assertEquals(LiteralKind.STRING, ((FieldNode) entries.get(2)).literal().literalKind());
            assertEquals(LiteralKind.NUMBER, ((FieldNode) entries.get(3)).literal().literalKind());
        }
    }

    @Nested
    @DisplayName("Steps and lists")
    class StepsAndLists {

        @Test
        void testStepContinuationLine() {
            StepNode step = (StepNode) document("@workflow\n1. Call the orders api\n   and store the response\n2. Done")
                    .sections().get(0).entries().get(0);
            assertEquals("Call the orders api and store the response", step.text());
            assertEquals(1, step.number());
            assertEquals(3, step.span().endLine());
        }

        @Test
        void testConditionAndReference() {
            StepNode step = (StepNode) document("@workflow\n3. If amount > 100 -> notify finance")
                    .sections().get(0).entries().get(0);
            ConditionNode condition = step.condition().orElseThrow();
            assertEquals("If", condition.keyword());
            assertEquals("amount > 100", condition.expression().text());
            assertEquals("If amount > 100", condition.scalar().orElseThrow());
            assertEquals("notify finance", step.reference().orElseThrow().name());
        }

        @Test
        void testConsecutiveItemsFormOneList() {
            List<SectionEntry> entries = document("@assumptions\n- retries: 3\n- Data is clean\n\n- Another")
                    .sections().get(0).entries();
            assertEquals(2, entries.size());
            ListNode list = (ListNode) entries.get(0);
            assertEquals(2, list.items().size());
            assertEquals("retries: 3", list.items().get(0).text());
            assertTrue(list.items().get(0).asField().isPresent());
            assertEquals("Data is clean", list.items().get(1).text());
            assertTrue(list.items().get(1).asField().isEmpty());
        }
    }

    @Test
    void testInvalidTokenStream() {
        ParseResult result = builder.parseToAst(List.of(new Token(TokenKind.IDENTIFIER, "x", 1, 1, 1)),
                CompilerOptions.defaults());
        assertFalse(result.isSuccess());
        assertTrue(result.ast().isEmpty());
        assertEquals(Diagnostic.Severity.ERROR, result.errors().get(0).getSeverity());
    }

    @Test
    void testSectionsNeverShareEntries() {
        DocumentNode doc = document("@trigger\ntype: webhook\n@workflow\n1. Step one\n@constraints\n- max_nodes: 4");
        SectionNode trigger = doc.section(ContractSection.TRIGGER).orElseThrow();
        assertEquals(1, trigger.entries().size());
        assertEquals(2, trigger.span().endLine());
        SectionNode workflow = doc.section(ContractSection.WORKFLOW).orElseThrow();
        assertEquals(1, workflow.entries().size());
        assertEquals(3, workflow.span().startLine());
        assertEquals(4, workflow.span().endLine());
        SectionNode constraints = doc.section(ContractSection.CONSTRAINTS).orElseThrow();
        assertEquals(AstNodeKind.LIST, constraints.entries().get(0).kind());
    }

    @Test
    void testDeterministic() {
        String text = "@trigger\ntype: webhook\n@workflow\n1. If paid -> ship order";
        assertEquals(document(text), document(text));
    }
}
