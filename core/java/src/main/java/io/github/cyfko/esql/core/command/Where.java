package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.utils.ExpressionRenderer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code WHERE} processing command. Several conditions are joined with {@code AND}.
 *
 * <pre>{@code
 * Esql.from("employees").where(Expr.of("emp_no").ge(10091), Expr.of("emp_no").lt(10094));
 * // FROM employees
 * // | WHERE emp_no >= 10091 AND emp_no < 10094
 * }</pre>
 */
public class Where extends Command {

    private final List<Object> expressions;

    public Where(Command parent, Object... expressions) {
        this(Collections.unmodifiableList(Arrays.asList(requireNonEmpty("WHERE", "condition", expressions).clone())), parent);
    }

    private Where(List<Object> expressions, Command parent) {
        super(parent);
        this.expressions = expressions;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "WHERE " + expressions.stream()
                .map(renderer::formatExpr)
                .collect(Collectors.joining(" AND "));
    }
}
