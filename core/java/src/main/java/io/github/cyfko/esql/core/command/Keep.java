package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code KEEP} processing command: selects and orders columns.
 * <p>
 * Names containing a wildcard are treated as patterns and written unescaped.
 * </p>
 */
public class Keep extends Command {

    private final List<String> columns;

    public Keep(Command parent, String... columns) {
        this(columnNames("KEEP", columns), parent);
    }

    public Keep(Command parent, FieldReference... columns) {
        this(columnNames("KEEP", columns), parent);
    }

    private Keep(List<String> columns, Command parent) {
        super(parent);
        this.columns = columns;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "KEEP " + columns.stream()
                .map(column -> IdentifierFormatter.format(column, true))
                .collect(Collectors.joining(", "));
    }
}
