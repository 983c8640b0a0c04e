module dev.mars.flowsmith.core {
    // WorkflowJsonCodec accepts a caller-supplied ObjectMapper
    requires transitive com.fasterxml.jackson.databind;

    exports dev.mars.flowsmith.core;
    exports dev.mars.flowsmith.core.exceptions;
    exports dev.mars.flowsmith.contract;
    exports dev.mars.flowsmith.graph;
}
