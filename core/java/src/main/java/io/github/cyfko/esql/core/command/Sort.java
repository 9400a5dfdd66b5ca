package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.Expression;
import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code SORT} processing command.
 * <p>
 * A column spec given as a string may carry order keywords ({@code "height DESC"},
 * {@code "first_name ASC NULLS FIRST"}). The spec is split on spaces and every token is
 * identifier-formatted on its own: the keywords are simple identifiers and stay unquoted,
 * while a column name needing quotes gets them. Expressions are written verbatim.
 * </p>
 */
public class Sort extends Command {

    private final List<Object> columns;

    public Sort(Command parent, Object... columns) {
        this(validate(columns), parent);
    }

    private Sort(List<Object> columns, Command parent) {
        super(parent);
        this.columns = columns;
    }

    private static List<Object> validate(Object[] columns) {
        requireNonEmpty("SORT", "column", columns);
        for (Object column : columns) {
            if (!(column instanceof CharSequence || column instanceof FieldReference || column instanceof Expression)) {
                throw new CommandDefinitionException("SORT column must be a String, a FieldReference or an Expression, got: "
                        + (column == null ? "null" : column.getClass().getName()));
            }
            if (column instanceof CharSequence && column.toString().isBlank()) {
                throw new CommandDefinitionException("SORT column cannot be blank");
            }
        }
        return List.of(columns);
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "SORT " + columns.stream()
                .map(Sort::formatColumn)
                .collect(Collectors.joining(", "));
    }

    private static String formatColumn(Object column) {
        if (column instanceof Expression) {
            return ((Expression) column).render();
        }
        if (column instanceof FieldReference) {
            return IdentifierFormatter.format((FieldReference) column);
        }
        return Arrays.stream(column.toString().trim().split(" +"))
                .map(IdentifierFormatter::format)
                .collect(Collectors.joining(" "));
    }
}
