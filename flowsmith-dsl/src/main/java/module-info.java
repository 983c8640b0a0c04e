module dev.mars.flowsmith.dsl {
    requires java.logging;
    requires transitive dev.mars.flowsmith.core;

    exports dev.mars.flowsmith.dsl;
    exports dev.mars.flowsmith.dsl.ast;
    exports dev.mars.flowsmith.dsl.lexer;
    exports dev.mars.flowsmith.dsl.transform;
}
