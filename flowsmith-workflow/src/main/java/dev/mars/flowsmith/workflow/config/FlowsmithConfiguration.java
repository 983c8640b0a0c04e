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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Configuration for the compile, generate and validate pipeline.
 * Values come from built-in defaults, then the classpath resource {@code flowsmith.properties},
 * then {@code flowsmith.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FlowsmithConfiguration {
    private static final Logger logger = Logger.getLogger(FlowsmithConfiguration.class.getName());

    public static final String RESOURCE_NAME = "flowsmith.properties";
    private static final String PREFIX = "flowsmith.";

    public static final String COMPILER_STRICT = "flowsmith.compiler.strict";
    public static final String COMPILER_IGNORE_COMMENTS = "flowsmith.compiler.ignore.comments";
    public static final String COMPILER_MAX_ERRORS = "flowsmith.compiler.max.errors";
    public static final String COMPILER_MODE = "flowsmith.compiler.mode";
    public static final String GENERATOR_WORKFLOW_NAME = "flowsmith.generator.workflow.name";
    public static final String GENERATOR_AUTO_LAYOUT = "flowsmith.generator.auto.layout";
    public static final String GENERATOR_START_X = "flowsmith.generator.start.x";
    public static final String GENERATOR_START_Y = "flowsmith.generator.start.y";
    public static final String GENERATOR_HORIZONTAL_SPACING = "flowsmith.generator.horizontal.spacing";
    public static final String GENERATOR_INCLUDE_METADATA = "flowsmith.generator.include.metadata";
    public static final String RULES_FAIL_FAST = "flowsmith.rules.fail.fast";
    public static final String RULES_MAX_ERRORS = "flowsmith.rules.max.errors";
    public static final String RULES_MAX_NODES = "flowsmith.rules.max.nodes";
    public static final String RULES_CATEGORIES = "flowsmith.rules.categories";
    public static final String METRICS_ENABLED = "flowsmith.metrics.enabled";

    private final Properties properties;

    public FlowsmithConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromSystemProperties();
    }

    public FlowsmithConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Compiler
    public boolean isCompilerStrict() {
        return getBooleanProperty(COMPILER_STRICT, false);
    }

    public boolean isIgnoreComments() {
        return getBooleanProperty(COMPILER_IGNORE_COMMENTS, true);
    }

    public int getCompilerMaxErrors() {
        return getPositiveIntProperty(COMPILER_MAX_ERRORS, CompilerOptions.DEFAULT_MAX_ERRORS);
    }

    public CompileMode getCompileMode() {
        String value = properties.getProperty(COMPILER_MODE, CompileMode.FULL.name()).trim();
        try {
            return CompileMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid compile mode for property " + COMPILER_MODE + ": " + value +
                         ". Using default: " + CompileMode.FULL);
            return CompileMode.FULL;
        }
    }

    // Generator
    public String getWorkflowName() {
        String name = properties.getProperty(GENERATOR_WORKFLOW_NAME, GeneratorOptions.DEFAULT_WORKFLOW_NAME);
        return name.isBlank() ? GeneratorOptions.DEFAULT_WORKFLOW_NAME : name.trim();
    }

    public boolean isAutoLayout() {
        return getBooleanProperty(GENERATOR_AUTO_LAYOUT, true);
    }

    public double getStartX() {
        return getDoubleProperty(GENERATOR_START_X, GeneratorOptions.DEFAULT_START_X);
    }

    public double getStartY() {
        return getDoubleProperty(GENERATOR_START_Y, GeneratorOptions.DEFAULT_START_Y);
    }

    public double getHorizontalSpacing() {
        double spacing = getDoubleProperty(GENERATOR_HORIZONTAL_SPACING, GeneratorOptions.DEFAULT_HORIZONTAL_SPACING);
        if (spacing <= 0) {
            logger.warning("Horizontal spacing must be positive: " + spacing +
                         ". Using default: " + GeneratorOptions.DEFAULT_HORIZONTAL_SPACING);
            return GeneratorOptions.DEFAULT_HORIZONTAL_SPACING;
        }
        return spacing;
    }

    public boolean isIncludeMetadata() {
        return getBooleanProperty(GENERATOR_INCLUDE_METADATA, true);
    }

    // Rule engine
    public boolean isFailFast() {
        return getBooleanProperty(RULES_FAIL_FAST, false);
    }

    public int getRulesMaxErrors() {
        return getPositiveIntProperty(RULES_MAX_ERRORS, EngineConfig.DEFAULT_MAX_ERRORS);
    }

    public int getRulesMaxNodes() {
        return getPositiveIntProperty(RULES_MAX_NODES, EngineConfig.DEFAULT_MAX_NODES);
    }

    /**
     * Comma separated category labels. Unknown labels are logged and ignored; an empty
     * result falls back to every category.
     */
    public Set<RuleCategory> getEnabledCategories() {
        String value = properties.getProperty(RULES_CATEGORIES, "");
        Set<RuleCategory> categories = EnumSet.noneOf(RuleCategory.class);
        for (String label : value.split(",")) {
            if (label.isBlank()) {
                continue;
            }
            Optional<RuleCategory> category = RuleCategory.fromLabel(label);
            if (category.isPresent()) {
                categories.add(category.get());
            } else {
                logger.warning("Unknown rule category in property " + RULES_CATEGORIES + ": " + label.trim());
            }
        }
        return categories.isEmpty() ? EnumSet.allOf(RuleCategory.class) : categories;
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public CompilerOptions toCompilerOptions() {
        return CompilerOptions.builder()
                .strictMode(isCompilerStrict())
                .ignoreComments(isIgnoreComments())
                .maxErrors(getCompilerMaxErrors())
                .mode(getCompileMode())
                .build();
    }

    public GeneratorOptions toGeneratorOptions() {
        return GeneratorOptions.builder()
                .workflowName(getWorkflowName())
                .autoLayout(isAutoLayout())
                .startX(getStartX())
                .startY(getStartY())
                .horizontalSpacing(getHorizontalSpacing())
                .includeMetadata(isIncludeMetadata())
                .build();
    }

    public EngineConfig toEngineConfig() {
        return EngineConfig.builder()
                .enabledCategories(getEnabledCategories())
                .strictMode(isCompilerStrict())
                .failFast(isFailFast())
                .maxErrors(getRulesMaxErrors())
                .maxNodes(getRulesMaxNodes())
                .build();
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getPositiveIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid number value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(COMPILER_STRICT, "false");
        properties.setProperty(COMPILER_IGNORE_COMMENTS, "true");
        properties.setProperty(COMPILER_MAX_ERRORS, String.valueOf(CompilerOptions.DEFAULT_MAX_ERRORS));
        properties.setProperty(COMPILER_MODE, CompileMode.FULL.name());
        properties.setProperty(GENERATOR_WORKFLOW_NAME, GeneratorOptions.DEFAULT_WORKFLOW_NAME);
        properties.setProperty(GENERATOR_AUTO_LAYOUT, "true");
        properties.setProperty(GENERATOR_INCLUDE_METADATA, "true");
        properties.setProperty(RULES_FAIL_FAST, "false");
        properties.setProperty(RULES_MAX_ERRORS, String.valueOf(EngineConfig.DEFAULT_MAX_ERRORS));
        properties.setProperty(RULES_MAX_NODES, String.valueOf(EngineConfig.DEFAULT_MAX_NODES));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath resource " + RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        List<String> overridden = new ArrayList<>();
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    overridden.add(key);
                });
        if (!overridden.isEmpty()) {
            logger.fine("Overrides from system properties: " + overridden);
        }
    }

    @Override
    public String toString() {
        return "FlowsmithConfiguration{" +
                "strict=" + isCompilerStrict() +
                ", mode=" + getCompileMode() +
                ", workflowName='" + getWorkflowName() + '\'' +
                ", failFast=" + isFailFast() +
                ", categories=" + getEnabledCategories() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
