package io.github.cyfko.esql.core.model;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;

/**
 * A named argument: {@code name = value}.
 * <p>
 * Commands that accept named expressions ({@code ROW}, {@code EVAL}, {@code STATS},
 * {@code ENRICH ... WITH}, {@code COMPLETION}) take {@code Assignment} instances. The name is
 * identifier-formatted when rendered; the value is rendered by the command.
 * </p>
 *
 * <pre>{@code
 * Esql.from("employees")
 *     .eval(assign("height_feet", Expr.of("height").mul(3.281)))
 *     .stats(assign("avg_height", Functions.avg(Expr.of("height_feet"))));
 * }</pre>
 *
 * @param name  the column or parameter name
 * @param value the value, an expression or a literal (may be null)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Assignment(String name, Object value) {

    /**
     * Canonical constructor with validation.
     *
     * @throws CommandDefinitionException if the name is null or empty
     */
    public Assignment {
        if (name == null || name.isEmpty()) {
            throw new CommandDefinitionException("Assignment name cannot be null or empty");
        }
    }

    /**
     * Creates an assignment.
     *
     * @param name  the column or parameter name
     * @param value the assigned value
     * @return the assignment
     */
    public static Assignment of(String name, Object value) {
        return new Assignment(name, value);
    }
}
