module dev.mars.flowsmith.workflow {
    requires java.logging;
    requires transitive dev.mars.flowsmith.core;
    requires transitive dev.mars.flowsmith.dsl;

    // Third-party libraries used in main sources
    requires com.fasterxml.jackson.databind;
    requires io.opentelemetry.api;

    exports dev.mars.flowsmith.workflow.config;
    exports dev.mars.flowsmith.workflow.generator;
    exports dev.mars.flowsmith.workflow.observability;
    exports dev.mars.flowsmith.workflow.pipeline;
    exports dev.mars.flowsmith.workflow.rules;
    exports dev.mars.flowsmith.workflow.rules.categories;
}
