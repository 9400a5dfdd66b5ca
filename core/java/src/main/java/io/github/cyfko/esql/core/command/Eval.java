package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.model.CommandArguments;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

import java.util.Map;

/**
 * The {@code EVAL} processing command.
 *
 * <pre>{@code
 * Esql.from("employees").eval(assign("height_feet", Expr.of("height").mul(3.281)));
 * // FROM employees
 * // | EVAL height_feet = height * 3.281
 *
 * Esql.from("employees").eval("height * 3.281");
 * // FROM employees
 * // | EVAL height * 3.281
 * }</pre>
 */
public class Eval extends Command {

    private final CommandArguments columns;

    public Eval(Command parent, Object... columns) {
        this(requireColumns(CommandArguments.of("EVAL", columns)), parent);
    }

    public Eval(Command parent, Map<String, ?> namedColumns) {
        this(requireColumns(CommandArguments.of(namedColumns)), parent);
    }

    private Eval(CommandArguments columns, Command parent) {
        super(parent);
        this.columns = columns;
    }

    private static CommandArguments requireColumns(CommandArguments columns) {
        if (columns.isEmpty()) {
            throw new CommandDefinitionException("EVAL requires at least one column");
        }
        return columns;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "EVAL " + String.join(", ", Stats.renderArguments(columns, renderer));
    }
}
