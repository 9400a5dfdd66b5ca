package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code RENAME} processing command.
 *
 * <pre>{@code
 * Esql.from("employees").rename("still_hired", "employed");
 * // FROM employees
 * // | RENAME still_hired AS employed
 * }</pre>
 */
public class Rename extends Command {

    private final Map<String, String> columns;

    public Rename(Command parent, Map<String, String> columns) {
        this(validate(columns), parent);
    }

    private Rename(Map<String, String> columns, Command parent) {
        super(parent);
        this.columns = columns;
    }

    private static Map<String, String> validate(Map<String, String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new CommandDefinitionException("RENAME requires at least one column");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        columns.forEach((oldName, newName) -> copy.put(
                IdentifierFormatter.requireIdentifier("RENAME old name", oldName),
                IdentifierFormatter.requireIdentifier("RENAME new name", newName)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "RENAME " + columns.entrySet().stream()
                .map(entry -> IdentifierFormatter.format(entry.getKey()) + " AS " + IdentifierFormatter.format(entry.getValue()))
                .collect(Collectors.joining(", "));
    }
}
