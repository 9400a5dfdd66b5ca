package io.github.cyfko.esql.core;

import io.github.cyfko.esql.core.api.IndexReference;
import io.github.cyfko.esql.core.command.Branch;
import io.github.cyfko.esql.core.command.From;
import io.github.cyfko.esql.core.command.Row;
import io.github.cyfko.esql.core.command.Show;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.model.Assignment;

import java.util.Arrays;
import java.util.Map;

/**
 * <h2>Esql</h2>
 *
 * <p>
 * Entry point of the query builder. Every query starts with a source command built here; the
 * returned {@link io.github.cyfko.esql.core.command.Command} exposes the processing commands as
 * fluent methods.
 * </p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * import static io.github.cyfko.esql.core.Esql.assign;
 *
 * String query = Esql.from("employees")
 *     .eval(assign("height_feet", Expr.of("height").mul(3.281)))
 *     .sort(Expr.of("height_feet").desc())
 *     .limit(5)
 *     .render();
 * // FROM employees
 * // | EVAL height_feet = height * 3.281
 * // | SORT height_feet DESC
 * // | LIMIT 5
 *
 * String forked = Esql.from("employees")
 *     .fork(Esql.branch().where("emp_no == 10001"),
 *           Esql.branch().where("emp_no == 10002"))
 *     .render();
 * // FROM employees
 * // | FORK ( WHERE emp_no == 10001 )
 * //        ( WHERE emp_no == 10002 )
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Esql {

    private Esql() {}

    /**
     * {@code FROM} reads from indices, data streams or aliases.
     *
     * @param indices index names, patterns or remote cluster references
     * @return the source command; continue with {@link From#metadata(String...)}
     * @throws CommandDefinitionException if no index is given or a name is blank
     */
    public static From from(String... indices) {
        if (indices == null || indices.length == 0) {
            throw new CommandDefinitionException("FROM requires at least one index");
        }
        return new From(Arrays.stream(indices)
                .map(index -> {
                    if (index == null || index.isBlank()) {
                        throw new CommandDefinitionException("FROM index cannot be null or blank");
                    }
                    return IndexReference.of(index);
                })
                .toArray(IndexReference[]::new));
    }

    /**
     * {@code FROM} with indices resolved lazily, when the query is rendered.
     *
     * @param indices index handles
     * @return the source command
     */
    public static From from(IndexReference... indices) {
        return new From(indices);
    }

    /**
     * {@code ROW} produces a single row of literal values.
     *
     * @param columns the columns, in order
     * @return the source command
     */
    public static Row row(Assignment... columns) {
        return new Row(columns);
    }

    public static Row row(Map<String, ?> columns) {
        return new Row(columns);
    }

    /**
     * {@code SHOW} returns information about the deployment.
     *
     * @param item the item to show, e.g. {@code "INFO"}
     * @return the source command
     */
    public static Show show(String item) {
        return new Show(item);
    }

    /**
     * Starts a {@code FORK} branch. Append processing commands to it and pass the tail to
     * {@link io.github.cyfko.esql.core.command.Command#fork(io.github.cyfko.esql.core.command.Command...)}.
     *
     * @return a new branch start
     */
    public static Branch branch() {
        return new Branch();
    }

    /**
     * Names an argument of {@code ROW}, {@code EVAL}, {@code STATS}, {@code ENRICH ... WITH} or
     * {@code COMPLETION}.
     *
     * @param name  the column name
     * @param value the value or expression
     * @return the assignment
     */
    public static Assignment assign(String name, Object value) {
        return Assignment.of(name, value);
    }
}
