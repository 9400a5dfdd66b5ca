package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.api.IndexReference;
import io.github.cyfko.esql.core.config.RenderPolicy;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.spi.QueryExecutor;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * One stage of an ES|QL query, linked to the stage before it.
 * <p>
 * A query is a backward-linked chain of commands. Source commands ({@code FROM}, {@code ROW},
 * {@code SHOW}) have no parent; every processing method below returns a <em>new</em> command
 * whose parent is the command it was called on. {@link #render()} walks back to the root and
 * joins the stages top-down with {@code "\n| "}.
 * </p>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Order preservation:</strong> stages render exactly in construction order; no
 *       rewriting or optimization is performed</li>
 *   <li><strong>Continuations:</strong> some commands take optional or mandatory clauses through
 *       continuation methods ({@code on(...)}, {@code by(...)}, {@code with(...)}) called right
 *       after construction</li>
 *   <li><strong>Freezing:</strong> once a command has a child (or is used as a {@code FORK}
 *       branch) it is <em>extended</em>: its continuation methods fail with
 *       {@link QueryStructureException}, so a rendered prefix can never change under its
 *       children</li>
 *   <li><strong>Templates:</strong> an extended command may be extended again; each call starts
 *       an independent chain sharing the same frozen prefix</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * String query = Esql.from("employees")
 *     .where(Expr.of("still_hired").eq(true))
 *     .stats(assign("avg_salary", Functions.avg(Expr.of("salary")))).by("languages")
 *     .sort("languages")
 *     .render();
 * // FROM employees
 * // | WHERE still_hired == true
 * // | STATS avg_salary = AVG(salary)
 * //         BY languages
 * // | SORT languages
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Extended commands are effectively immutable and can be shared across threads. Continuation
 * calls on a tail command must not run concurrently with a render of a chain containing it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Command {

    private static final Logger log = Logger.getLogger(Command.class.getName());

    /**
     * Separator placed between two rendered stages.
     */
    public static final String STAGE_SEPARATOR = "\n| ";

    private final Command parent;
    private boolean extended;

    /**
     * @param parent the previous stage, or {@code null} for a source command or a branch start
     */
    protected Command(Command parent) {
        this.parent = parent;
        if (parent != null) {
            parent.extended = true;
        }
    }

    /**
     * Returns the text of this stage alone, without separator.
     *
     * @param renderer renderer for expressions and literals
     * @return the stage text
     * @throws QueryStructureException if a mandatory continuation was never supplied
     */
    protected abstract String renderStage(ExpressionRenderer renderer);

    public final Optional<Command> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * @return {@code true} once a child command has been derived from this command
     */
    public final boolean isExtended() {
        return extended;
    }

    /**
     * Renders the whole chain ending at this command with {@link RenderPolicy#defaults()}.
     *
     * @return the ES|QL query text
     * @throws QueryStructureException if a stage misses a mandatory continuation, or if the chain
     *                                 is a {@code FORK} branch
     */
    public final String render() {
        return render(RenderPolicy.defaults());
    }

    /**
     * Renders the whole chain ending at this command.
     *
     * @param policy the literal rendering policy
     * @return the ES|QL query text
     * @throws QueryStructureException if a stage misses a mandatory continuation, or if the chain
     *                                 is a {@code FORK} branch
     */
    public final String render(RenderPolicy policy) {
        List<Command> stages = stages();
        if (stages.get(0) instanceof Branch) {
            throw new QueryStructureException("A FORK branch cannot be rendered on its own; pass it to fork(...)");
        }
        ExpressionRenderer renderer = ExpressionRenderer.of(policy);
        StringBuilder query = new StringBuilder();
        for (Command stage : stages) {
            if (query.length() > 0) {
                query.append(STAGE_SEPARATOR);
            }
            query.append(stage.renderStage(renderer));
        }
        log.fine(() -> String.format("Rendered ES|QL query with %d stage(s)", stages.size()));
        return query.toString();
    }

    /**
     * Renders this query and hands it to an executor.
     *
     * @param executor the transport collaborator
     * @param <R>      the response type
     * @return the executor's response
     * @throws QueryStructureException if the query cannot be rendered
     */
    public final <R> R executeWith(QueryExecutor<R> executor) {
        Objects.requireNonNull(executor, "QueryExecutor cannot be null");
        String query = render();

        log.fine(() -> String.format("Executing ES|QL query:%n%s", query));

        long start = System.nanoTime();
        R response = executor.execute(query);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.info(() -> String.format("ES|QL query executed in %d ms", durationMs));
        return response;
    }

    /**
     * @return the commands of this chain, root first
     */
    final List<Command> stages() {
        Deque<Command> stages = new ArrayDeque<>();
        for (Command current = this; current != null; current = current.parent) {
            stages.addFirst(current);
        }
        return List.copyOf(stages);
    }

    /**
     * @return {@code true} if this command or one of its ancestors is a {@code FORK}
     */
    final boolean isForked() {
        for (Command current = this; current != null; current = current.parent) {
            if (current instanceof Fork) {
                return true;
            }
        }
        return false;
    }

    final void markExtended() {
        this.extended = true;
    }

    /**
     * Guards continuation methods: only the tail of a chain may still be configured.
     *
     * @param continuation name of the continuation, used in the error message
     * @throws QueryStructureException if this command already has a child
     */
    protected final void ensureTail(String continuation) {
        if (extended) {
            throw new QueryStructureException("Cannot call " + continuation + " on a "
                    + getClass().getSimpleName() + " command that already has a following command");
        }
    }

    /**
     * Checks that a varargs parameter holds at least one element and no null element.
     *
     * @param command command name, used in the error message
     * @param what    description of the parameter
     * @param values  the values
     * @param <T>     the element type
     * @return {@code values}
     */
    protected static <T> T[] requireNonEmpty(String command, String what, T[] values) {
        if (values == null || values.length == 0) {
            throw new CommandDefinitionException(command + " requires at least one " + what);
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new CommandDefinitionException(command + " " + what + " at position " + i + " is null");
            }
        }
        return values;
    }

    /**
     * Validates column names given as strings.
     *
     * @param command command name, used in error messages
     * @param columns the column names
     * @return the names, unquoted
     */
    protected static List<String> columnNames(String command, String[] columns) {
        requireNonEmpty(command, "column", columns);
        return Arrays.stream(columns)
                .map(column -> IdentifierFormatter.requireIdentifier(command + " column", column))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Resolves and validates column names given as field references.
     *
     * @param command command name, used in error messages
     * @param columns the field references
     * @return the names, unquoted
     */
    protected static List<String> columnNames(String command, FieldReference[] columns) {
        requireNonEmpty(command, "column", columns);
        return Arrays.stream(columns)
                .map(column -> IdentifierFormatter.requireIdentifier(command + " column", column))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the rendered query, or a description of the chain when it cannot be rendered yet
     * (a {@code FORK} branch, a missing mandatory continuation). Never throws.
     */
    @Override
    public String toString() {
        List<Command> stages = stages();
        if (stages.get(0) instanceof Branch) {
            return describe(stages.subList(1, stages.size()), "FORK branch");
        }
        try {
            return render();
        } catch (RuntimeException e) {
            return describe(stages, e.getMessage());
        }
    }

    private static String describe(List<Command> stages, String reason) {
        return stages.stream()
                .map(stage -> stage.getClass().getSimpleName())
                .collect(Collectors.joining(" | ", "Command[", "] (not renderable: " + reason + ")"));
    }

    // ---------------------------------------------------------------- processing commands

    /**
     * {@code CHANGE_POINT} detects spikes, dips and change points in a metric.
     *
     * @param value the column holding the metric
     * @return the new command; continue with {@link ChangePoint#on(String)} or {@link ChangePoint#as(String, String)}
     */
    public ChangePoint changePoint(String value) {
        return new ChangePoint(this, value);
    }

    public ChangePoint changePoint(FieldReference value) {
        return new ChangePoint(this, value);
    }

    /**
     * {@code COMPLETION} sends a prompt to a language model and stores the answer in a column.
     * <p>
     * Exactly one prompt must be given, either positional (the answer goes to the default
     * {@code completion} column) or as an {@link io.github.cyfko.esql.core.model.Assignment}
     * naming the output column.
     * </p>
     *
     * @param prompt the prompt expression
     * @return the new command; {@link Completion#with(String)} is mandatory
     */
    public Completion completion(Object... prompt) {
        return new Completion(this, prompt);
    }

    /**
     * {@code DISSECT} extracts structured data from a string with a dissect pattern.
     *
     * @param input   the column holding the string
     * @param pattern the dissect pattern, e.g. {@code "%{date} - %{msg}"}
     * @return the new command; continue with {@link Dissect#appendSeparator(String)}
     */
    public Dissect dissect(String input, String pattern) {
        return new Dissect(this, input, pattern);
    }

    public Dissect dissect(FieldReference input, String pattern) {
        return new Dissect(this, input, pattern);
    }

    /**
     * {@code DROP} removes columns. Wildcard patterns are passed through unescaped.
     *
     * @param columns the columns or patterns to drop
     * @return the new command
     */
    public Drop drop(String... columns) {
        return new Drop(this, columns);
    }

    public Drop drop(FieldReference... columns) {
        return new Drop(this, columns);
    }

    /**
     * {@code ENRICH} adds columns from an enrich policy.
     *
     * @param policy the enrich policy name
     * @return the new command; continue with {@link Enrich#on(String)} and {@link Enrich#with(Object...)}
     */
    public Enrich enrich(String policy) {
        return new Enrich(this, policy);
    }

    /**
     * {@code EVAL} appends computed columns.
     *
     * @param columns positional expressions, or {@link io.github.cyfko.esql.core.model.Assignment}s
     *                naming the new columns; the two forms cannot be mixed
     * @return the new command
     * @throws CommandDefinitionException if positional and named expressions are mixed
     */
    public Eval eval(Object... columns) {
        return new Eval(this, columns);
    }

    public Eval eval(Map<String, ?> namedColumns) {
        return new Eval(this, namedColumns);
    }

    /**
     * {@code FORK} runs between two and eight branches over the current table. A chain can be
     * forked only once.
     *
     * @param branches chains started with {@code Esql.branch()}
     * @return the new command
     * @throws QueryStructureException if this chain is already forked or a branch is invalid
     */
    public Fork fork(Command... branches) {
        return new Fork(this, branches);
    }

    /**
     * {@code GROK} extracts structured data from a string with a grok pattern.
     *
     * @param input   the column holding the string
     * @param pattern the grok pattern, e.g. {@code "%{IP:ip} %{NUMBER:num:int}"}
     * @return the new command
     */
    public Grok grok(String input, String pattern) {
        return new Grok(this, input, pattern);
    }

    public Grok grok(FieldReference input, String pattern) {
        return new Grok(this, input, pattern);
    }

    /**
     * {@code KEEP} selects and orders the returned columns. Wildcard patterns are passed through
     * unescaped.
     *
     * @param columns the columns or patterns to keep
     * @return the new command
     */
    public Keep keep(String... columns) {
        return new Keep(this, columns);
    }

    public Keep keep(FieldReference... columns) {
        return new Keep(this, columns);
    }

    /**
     * {@code LIMIT} caps the number of returned rows.
     *
     * @param maxNumberOfRows the maximum number of rows, not negative
     * @return the new command
     */
    public Limit limit(int maxNumberOfRows) {
        return new Limit(this, maxNumberOfRows);
    }

    /**
     * {@code LOOKUP JOIN} adds columns from a lookup index.
     *
     * @param lookupIndex the lookup index name
     * @return the new command; {@link LookupJoin#on(String)} is mandatory
     */
    public LookupJoin lookupJoin(String lookupIndex) {
        return new LookupJoin(this, IndexReference.of(lookupIndex));
    }

    public LookupJoin lookupJoin(IndexReference lookupIndex) {
        return new LookupJoin(this, lookupIndex);
    }

    /**
     * {@code MV_EXPAND} expands a multivalued column into one row per value.
     *
     * @param column the multivalued column
     * @return the new command
     */
    public MvExpand mvExpand(String column) {
        return new MvExpand(this, column);
    }

    public MvExpand mvExpand(FieldReference column) {
        return new MvExpand(this, column);
    }

    /**
     * {@code RENAME} renames one column.
     *
     * @param oldName the current name
     * @param newName the new name
     * @return the new command
     */
    public Rename rename(String oldName, String newName) {
        return new Rename(this, Map.of(oldName, newName));
    }

    /**
     * {@code RENAME} renames several columns, in the iteration order of the map.
     *
     * @param columns old name to new name mapping
     * @return the new command
     */
    public Rename rename(Map<String, String> columns) {
        return new Rename(this, columns);
    }

    /**
     * {@code SAMPLE} keeps a random fraction of the rows.
     *
     * @param probability the probability that a row is kept, between 0 and 1 exclusive
     * @return the new command
     */
    public Sample sample(double probability) {
        return new Sample(this, probability);
    }

    /**
     * {@code SORT} sorts the table.
     *
     * @param columns column specs such as {@code "height DESC"} or {@code "first_name ASC NULLS FIRST"},
     *                field references, or expressions built with {@code Expr.asc()/desc()}
     * @return the new command
     */
    public Sort sort(Object... columns) {
        return new Sort(this, columns);
    }

    /**
     * {@code STATS} computes aggregated values.
     *
     * @param expressions positional aggregations, or {@link io.github.cyfko.esql.core.model.Assignment}s
     *                    naming the results; the two forms cannot be mixed
     * @return the new command; continue with {@link Stats#by(Object...)}
     * @throws CommandDefinitionException if positional and named expressions are mixed
     */
    public Stats stats(Object... expressions) {
        return new Stats(this, expressions);
    }

    public Stats stats(Map<String, ?> namedExpressions) {
        return new Stats(this, namedExpressions);
    }

    /**
     * {@code WHERE} filters rows. Several conditions are combined with {@code AND}.
     *
     * @param expressions boolean expressions
     * @return the new command
     */
    public Where where(Object... expressions) {
        return new Where(this, expressions);
    }
}
