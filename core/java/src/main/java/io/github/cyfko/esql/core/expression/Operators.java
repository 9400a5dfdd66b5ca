package io.github.cyfko.esql.core.expression;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Boolean combinators. Every operand is parenthesized, so operator precedence never depends on
 * the operands' own text.
 *
 * <pre>{@code
 * Operators.and("emp_no > 10000", Expr.of("still_hired").eq(true));
 * // (emp_no > 10000) AND (still_hired == true)
 * Operators.not(Expr.of("languages").isNull());
 * // NOT (languages IS NULL)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Operators {

    private static final ExpressionRenderer RENDERER = ExpressionRenderer.defaults();

    private Operators() {}

    public static Expr and(Object... conditions) {
        return combine("AND", conditions);
    }

    public static Expr or(Object... conditions) {
        return combine("OR", conditions);
    }

    public static Expr not(Object condition) {
        if (condition == null) {
            throw new CommandDefinitionException("NOT requires a condition");
        }
        return Expr.of("NOT (" + RENDERER.formatExpr(condition) + ")");
    }

    private static Expr combine(String operator, Object[] conditions) {
        if (conditions == null || conditions.length < 2) {
            throw new CommandDefinitionException(operator + " requires at least two conditions");
        }
        return Expr.of(Arrays.stream(conditions)
                .map(condition -> "(" + RENDERER.formatExpr(condition) + ")")
                .collect(Collectors.joining(" " + operator + " ")));
    }
}
