module dev.mars.flowlang.core {
    requires java.logging;

    // Public API exports
    exports dev.mars.flowlang.value;
    exports dev.mars.flowlang.config;
    exports dev.mars.flowlang.exceptions;
}
