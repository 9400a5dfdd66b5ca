package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.model.Assignment;
import io.github.cyfko.esql.core.model.CommandArguments;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code STATS} processing command.
 * <p>
 * Aggregations are either all positional or all named. Each aggregation after the first, and
 * the optional {@code BY} clause, goes on its own line indented under the first one.
 * </p>
 *
 * <pre>{@code
 * Esql.from("employees")
 *     .stats(assign("avg_lang", Functions.avg(Expr.of("languages"))),
 *            assign("max_lang", Functions.max(Expr.of("languages"))))
 *     .by("gender");
 * // FROM employees
 * // | STATS avg_lang = AVG(languages),
 * //         max_lang = MAX(languages)
 * //         BY gender
 * }</pre>
 */
public class Stats extends Command {

    static final String CONTINUATION_INDENT = "\n        ";

    private final CommandArguments expressions;
    private List<Object> groupingExpressions;

    public Stats(Command parent, Object... expressions) {
        this(CommandArguments.of("STATS", expressions), parent);
    }

    public Stats(Command parent, Map<String, ?> namedExpressions) {
        this(CommandArguments.of(namedExpressions), parent);
    }

    private Stats(CommandArguments expressions, Command parent) {
        super(parent);
        this.expressions = expressions;
    }

    /**
     * Groups the aggregations.
     *
     * @param groupingExpressions columns or expressions to group by
     * @return this command
     */
    public Stats by(Object... groupingExpressions) {
        ensureTail("by(...)");
        requireNonEmpty("STATS ... BY", "grouping expression", groupingExpressions);
        this.groupingExpressions = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(groupingExpressions)));
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        if (expressions.isEmpty() && groupingExpressions == null) {
            throw new QueryStructureException("STATS requires at least one aggregation or a by(...) grouping");
        }
        String by = groupingExpressions == null ? "" : "BY " + groupingExpressions.stream()
                .map(renderer::formatExpr)
                .collect(Collectors.joining(", "));
        if (expressions.isEmpty()) {
            return "STATS " + by;
        }
        String aggregations = renderArguments(expressions, renderer).stream()
                .collect(Collectors.joining("," + CONTINUATION_INDENT));
        return "STATS " + aggregations + (by.isEmpty() ? "" : CONTINUATION_INDENT + by);
    }

    /**
     * Renders positional expressions as-is and named ones as {@code name = expression}.
     */
    static List<String> renderArguments(CommandArguments arguments, ExpressionRenderer renderer) {
        if (arguments instanceof CommandArguments.Named) {
            List<String> rendered = new ArrayList<>();
            for (Assignment assignment : ((CommandArguments.Named) arguments).assignments()) {
                rendered.add(IdentifierFormatter.format(assignment.name()) + " = " + renderer.formatExpr(assignment.value()));
            }
            return rendered;
        }
        if (arguments instanceof CommandArguments.Positional) {
            return ((CommandArguments.Positional) arguments).values().stream()
                    .map(renderer::formatExpr)
                    .collect(Collectors.toList());
        }
        throw new CommandDefinitionException("Unsupported arguments: " + arguments);
    }
}
