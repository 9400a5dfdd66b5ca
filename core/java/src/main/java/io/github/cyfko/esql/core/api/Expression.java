package io.github.cyfko.esql.core.api;

/**
 * A pre-built ES|QL expression that knows how to render itself.
 * <p>
 * Wherever a command accepts an expression, an {@code Expression} is emitted exactly as
 * returned by {@link #render()}: it is neither quoted nor escaped again. Implementations are
 * therefore responsible for producing syntactically valid ES|QL, including operators,
 * function calls, sort-order suffixes and aggregate {@code WHERE} post-filters.
 * </p>
 *
 * <p>Values that are not {@code Expression} instances are treated as literals and serialized
 * with JSON rules (see {@link io.github.cyfko.esql.core.utils.ExpressionRenderer}).</p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations should be immutable. The built-in
 * {@link io.github.cyfko.esql.core.expression.Expr} is.
 * </p>
 *
 * @see io.github.cyfko.esql.core.expression.Expr
 * @see io.github.cyfko.esql.core.expression.Functions
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Expression {

    /**
     * Returns the ES|QL source text of this expression.
     *
     * @return the expression text, never {@code null}
     */
    String render();
}
