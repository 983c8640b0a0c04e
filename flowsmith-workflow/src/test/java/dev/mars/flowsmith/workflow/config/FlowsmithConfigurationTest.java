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

package dev.mars.flowsmith.workflow.config;

import dev.mars.flowsmith.dsl.CompileMode;
import dev.mars.flowsmith.dsl.CompilerOptions;
import dev.mars.flowsmith.workflow.generator.GeneratorOptions;
import dev.mars.flowsmith.workflow.rules.EngineConfig;
import dev.mars.flowsmith.workflow.rules.RuleCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlowsmithConfiguration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class FlowsmithConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowsmithConfiguration.RULES_FAIL_FAST);
    }

    private static FlowsmithConfiguration with(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return new FlowsmithConfiguration(properties);
    }

    @Test
    void testDefaults() {
        FlowsmithConfiguration config = new FlowsmithConfiguration(null);

        assertFalse(config.isCompilerStrict());
        assertTrue(config.isIgnoreComments());
        assertEquals(CompilerOptions.DEFAULT_MAX_ERRORS, config.getCompilerMaxErrors());
        assertEquals(CompileMode.FULL, config.getCompileMode());
        assertEquals(GeneratorOptions.DEFAULT_WORKFLOW_NAME, config.getWorkflowName());
        assertTrue(config.isAutoLayout());
        assertEquals(GeneratorOptions.DEFAULT_START_X, config.getStartX());
        assertTrue(config.isIncludeMetadata());
        assertFalse(config.isFailFast());
        assertEquals(EngineConfig.DEFAULT_MAX_NODES, config.getRulesMaxNodes());
        assertEquals(EnumSet.allOf(RuleCategory.class), config.getEnabledCategories());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.COMPILER_STRICT, "true");
        properties.setProperty(FlowsmithConfiguration.COMPILER_MODE, "heuristic");
        properties.setProperty(FlowsmithConfiguration.GENERATOR_WORKFLOW_NAME, "  Orders  ");
        properties.setProperty(FlowsmithConfiguration.GENERATOR_HORIZONTAL_SPACING, "300");
        properties.setProperty(FlowsmithConfiguration.RULES_MAX_ERRORS, "5");

        FlowsmithConfiguration config = new FlowsmithConfiguration(properties);

        assertTrue(config.isCompilerStrict());
        assertEquals(CompileMode.HEURISTIC, config.getCompileMode());
        assertEquals("Orders", config.getWorkflowName());
        assertEquals(300, config.getHorizontalSpacing());
        assertEquals(5, config.getRulesMaxErrors());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        assertEquals(CompilerOptions.DEFAULT_MAX_ERRORS,
                with(FlowsmithConfiguration.COMPILER_MAX_ERRORS, "many").getCompilerMaxErrors());
        assertEquals(EngineConfig.DEFAULT_MAX_NODES,
                with(FlowsmithConfiguration.RULES_MAX_NODES, "0").getRulesMaxNodes());
        assertEquals(GeneratorOptions.DEFAULT_HORIZONTAL_SPACING,
                with(FlowsmithConfiguration.GENERATOR_HORIZONTAL_SPACING, "-10").getHorizontalSpacing());
        assertEquals(GeneratorOptions.DEFAULT_START_Y,
                with(FlowsmithConfiguration.GENERATOR_START_Y, "top").getStartY());
        assertEquals(CompileMode.FULL, with(FlowsmithConfiguration.COMPILER_MODE, "fast").getCompileMode());
        assertEquals(GeneratorOptions.DEFAULT_WORKFLOW_NAME,
                with(FlowsmithConfiguration.GENERATOR_WORKFLOW_NAME, " ").getWorkflowName());
    }

    @Test
    void testCategoryList() {
        FlowsmithConfiguration config = with(FlowsmithConfiguration.RULES_CATEGORIES, "structural, flow,bogus,");

        assertEquals(EnumSet.of(RuleCategory.STRUCTURAL, RuleCategory.FLOW), config.getEnabledCategories());
        assertEquals(EnumSet.allOf(RuleCategory.class),
                with(FlowsmithConfiguration.RULES_CATEGORIES, "bogus").getEnabledCategories());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(FlowsmithConfiguration.RULES_FAIL_FAST, "true");

        assertTrue(new FlowsmithConfiguration().isFailFast());
    }

    @Test
    void testStageOptions() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.COMPILER_STRICT, "true");
        properties.setProperty(FlowsmithConfiguration.COMPILER_MAX_ERRORS, "7");
        properties.setProperty(FlowsmithConfiguration.GENERATOR_INCLUDE_METADATA, "false");
        properties.setProperty(FlowsmithConfiguration.RULES_CATEGORIES, "node");
        properties.setProperty(FlowsmithConfiguration.RULES_MAX_NODES, "20");
        FlowsmithConfiguration config = new FlowsmithConfiguration(properties);

        CompilerOptions compilerOptions = config.toCompilerOptions();
        GeneratorOptions generatorOptions = config.toGeneratorOptions();
        EngineConfig engineConfig = config.toEngineConfig();

        assertTrue(compilerOptions.isStrictMode());
        assertEquals(7, compilerOptions.getMaxErrors());
        assertFalse(generatorOptions.isIncludeMetadata());
        assertTrue(engineConfig.isStrictMode());
        assertTrue(engineConfig.isCategoryEnabled(RuleCategory.NODE));
        assertFalse(engineConfig.isCategoryEnabled(RuleCategory.FLOW));
        assertEquals(20, engineConfig.getMaxNodes());
    }
}
