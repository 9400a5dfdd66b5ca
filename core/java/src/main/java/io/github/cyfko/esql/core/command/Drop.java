package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code DROP} processing command: removes columns. Wildcard patterns are written unescaped.
 */
public class Drop extends Command {

    private final List<String> columns;

    public Drop(Command parent, String... columns) {
        this(columnNames("DROP", columns), parent);
    }

    public Drop(Command parent, FieldReference... columns) {
        this(columnNames("DROP", columns), parent);
    }

    private Drop(List<String> columns, Command parent) {
        super(parent);
        this.columns = columns;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "DROP " + columns.stream()
                .map(column -> IdentifierFormatter.format(column, true))
                .collect(Collectors.joining(", "));
    }
}
