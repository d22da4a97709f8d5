module dev.mars.flowlang.parser {
    requires java.logging;
    requires transitive dev.mars.flowlang.core;

    // Third-party libraries used in main sources
    requires org.yaml.snakeyaml;
    requires io.opentelemetry.api;

    exports dev.mars.flowlang.model;
    exports dev.mars.flowlang.diagnostics;
    exports dev.mars.flowlang.parser;
    exports dev.mars.flowlang.parser.observability;
    exports dev.mars.flowlang.yaml;
}
