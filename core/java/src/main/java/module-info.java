module io.github.cyfko.esql.core {
    requires com.fasterxml.jackson.databind;
    requires java.logging;

    exports io.github.cyfko.esql.core;
    exports io.github.cyfko.esql.core.api;
    exports io.github.cyfko.esql.core.command;
    exports io.github.cyfko.esql.core.config;
    exports io.github.cyfko.esql.core.exception;
    exports io.github.cyfko.esql.core.expression;
    exports io.github.cyfko.esql.core.model;
    exports io.github.cyfko.esql.core.spi;
    exports io.github.cyfko.esql.core.utils;
}
