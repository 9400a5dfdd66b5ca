package io.github.cyfko.esql.core.expression;

import io.github.cyfko.esql.core.api.Expression;
import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ES|QL expression with operator methods.
 * <p>
 * An {@code Expr} wraps source text that is trusted verbatim. Every operator returns a new
 * {@code Expr}; instances are immutable. Right-hand operands of comparison and arithmetic
 * operators are literals: a {@code String} operand is quoted, an {@link Expression} operand is
 * written as its own text.
 * </p>
 *
 * <pre>{@code
 * Expr.of("emp_no").ge(10091);                        // emp_no >= 10091
 * Expr.of("first_name").eq("Georgi");                 // first_name == "Georgi"
 * Expr.of("salary").mul(1.1).gt(Expr.of("bonus"));    // salary * 1.1 > bonus
 * Expr.of("height").desc().nullsLast();               // height DESC NULLS LAST
 * Expr.of("emp_no").gt(10000).and(Expr.of("still_hired").eq(true));
 *                                                     // (emp_no > 10000) AND (still_hired == true)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Expr implements Expression {

    private static final ExpressionRenderer RENDERER = ExpressionRenderer.defaults();

    private final String text;

    private Expr(String text) {
        this.text = text;
    }

    /**
     * Wraps ES|QL source text.
     *
     * @param text the source text, e.g. {@code "salary"} or {@code "salary * 1.1"}
     * @return the expression
     * @throws CommandDefinitionException if {@code text} is null or blank
     */
    public static Expr of(String text) {
        if (text == null || text.isBlank()) {
            throw new CommandDefinitionException("Expression text cannot be null or blank");
        }
        return new Expr(text);
    }

    /**
     * Wraps an existing expression so operators can be applied to it.
     *
     * @param expression the expression
     * @return {@code expression} itself if it already is an {@code Expr}
     */
    public static Expr of(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (expression instanceof Expr) {
            return (Expr) expression;
        }
        return of(expression.render());
    }

    /**
     * References a mapped field, quoting its name when needed.
     *
     * @param field the field reference
     * @return the expression naming the field
     */
    public static Expr field(FieldReference field) {
        return new Expr(IdentifierFormatter.format(IdentifierFormatter.requireIdentifier("Field", field)));
    }

    @Override
    public String render() {
        return text;
    }

    // comparison

    public Expr eq(Object other) {
        return binary("==", other);
    }

    public Expr ne(Object other) {
        return binary("!=", other);
    }

    public Expr lt(Object other) {
        return binary("<", other);
    }

    public Expr le(Object other) {
        return binary("<=", other);
    }

    public Expr gt(Object other) {
        return binary(">", other);
    }

    public Expr ge(Object other) {
        return binary(">=", other);
    }

    // arithmetic

    public Expr add(Object other) {
        return binary("+", other);
    }

    public Expr sub(Object other) {
        return binary("-", other);
    }

    public Expr mul(Object other) {
        return binary("*", other);
    }

    public Expr div(Object other) {
        return binary("/", other);
    }

    public Expr mod(Object other) {
        return binary("%", other);
    }

    public Expr negate() {
        return new Expr("-(" + text + ")");
    }

    // logical

    public Expr and(Object other) {
        return Operators.and(this, other);
    }

    public Expr or(Object other) {
        return Operators.or(this, other);
    }

    public Expr not() {
        return Operators.not(this);
    }

    // predicates

    public Expr isNull() {
        return new Expr(text + " IS NULL");
    }

    public Expr isNotNull() {
        return new Expr(text + " IS NOT NULL");
    }

    /**
     * {@code x IN (a, b, c)}. A string value is ES|QL source text, typically a column or an
     * expression; wrap string data in {@code Expr.of("\"text\"")} or compare with {@link #eq(Object)}.
     *
     * @param values the candidate values, at least one
     * @return the membership test
     */
    public Expr in(Object... values) {
        requireOperands("IN", values);
        return new Expr(text + " IN (" + Arrays.stream(values)
                .map(RENDERER::formatExpr)
                .collect(Collectors.joining(", ")) + ")");
    }

    /**
     * {@code x LIKE "pattern"}, or {@code x LIKE ("p1", "p2")} for several patterns.
     *
     * @param patterns wildcard patterns, at least one
     * @return the pattern test
     */
    public Expr like(String... patterns) {
        return patternMatch("LIKE", patterns);
    }

    /**
     * {@code x RLIKE "regex"}, or {@code x RLIKE ("r1", "r2")} for several patterns.
     *
     * @param patterns regular expressions, at least one
     * @return the pattern test
     */
    public Expr rlike(String... patterns) {
        return patternMatch("RLIKE", patterns);
    }

    /**
     * Full-text match operator: {@code field:"query"}.
     *
     * @param query the query text
     * @return the match test
     */
    public Expr match(String query) {
        Objects.requireNonNull(query, "Match query cannot be null");
        return new Expr(text + ":" + RENDERER.quote(query));
    }

    // sorting

    public Expr asc() {
        return new Expr(text + " ASC");
    }

    public Expr desc() {
        return new Expr(text + " DESC");
    }

    public Expr nullsFirst() {
        return new Expr(text + " NULLS FIRST");
    }

    public Expr nullsLast() {
        return new Expr(text + " NULLS LAST");
    }

    /**
     * Filters the rows an aggregation sees: {@code AVG(salary) WHERE languages > 2}. Several
     * conditions are combined with {@code AND}.
     *
     * @param conditions boolean expressions, at least one
     * @return the filtered aggregation
     */
    public Expr where(Object... conditions) {
        requireOperands("WHERE", conditions);
        if (conditions.length == 1) {
            return new Expr(text + " WHERE " + RENDERER.formatExpr(conditions[0]));
        }
        return new Expr(text + " WHERE " + Operators.and(conditions).render());
    }

    /**
     * Inline cast: {@code x::type}.
     *
     * @param type target type, e.g. {@code "long"} or {@code "datetime"}
     * @return the cast expression
     */
    public Expr cast(String type) {
        IdentifierFormatter.requireIdentifier("Cast type", type);
        return new Expr(text + "::" + type);
    }

    private Expr binary(String operator, Object other) {
        return new Expr(text + " " + operator + " " + RENDERER.formatLiteral(other));
    }

    private Expr patternMatch(String operator, String[] patterns) {
        requireOperands(operator, patterns);
        if (patterns.length == 1) {
            return new Expr(text + " " + operator + " " + RENDERER.quote(patterns[0]));
        }
        return new Expr(text + " " + operator + " (" + Arrays.stream(patterns)
                .map(RENDERER::quote)
                .collect(Collectors.joining(", ")) + ")");
    }

    private static void requireOperands(String operator, Object[] operands) {
        if (operands == null || operands.length == 0) {
            throw new CommandDefinitionException(operator + " requires at least one operand");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expr)) return false;
        return text.equals(((Expr) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
