package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.model.Assignment;
import io.github.cyfko.esql.core.model.CommandArguments;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code ROW} source command: produces one row from literal values.
 * <p>
 * Values are literals (strings are quoted) unless they are
 * {@link io.github.cyfko.esql.core.api.Expression}s, which are written verbatim.
 * </p>
 *
 * <pre>{@code
 * Esql.row(assign("a", 1), assign("b", "two"), assign("c", null));
 * // ROW a = 1, b = "two", c = null
 * }</pre>
 */
public class Row extends Command {

    private final List<Assignment> columns;

    public Row(Assignment... columns) {
        this(CommandArguments.of("ROW", (Object[]) requireNonEmpty("ROW", "column", columns)));
    }

    public Row(Map<String, ?> columns) {
        this(CommandArguments.of(columns));
    }

    private Row(CommandArguments arguments) {
        super(null);
        if (!(arguments instanceof CommandArguments.Named) || arguments.isEmpty()) {
            throw new CommandDefinitionException("ROW requires at least one named column");
        }
        this.columns = ((CommandArguments.Named) arguments).assignments();
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "ROW " + columns.stream()
                .map(column -> IdentifierFormatter.format(column.name()) + " = " + renderer.formatLiteral(column.value()))
                .collect(Collectors.joining(", "));
    }
}
