package io.github.cyfko.esql.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.cyfko.esql.core.api.Expression;
import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.config.RenderPolicy;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders expression operands and literal values as ES|QL text.
 * <p>
 * Two entry points cover the two ways a value can appear in a command:
 * </p>
 * <ul>
 *   <li>{@link #formatLiteral(Object)}: the value is data. Strings are quoted.</li>
 *   <li>{@link #formatExpr(Object)}: the value is an expression. A string is ES|QL source text
 *       and is emitted unchanged.</li>
 * </ul>
 *
 * <h2>Literal rules</h2>
 * <ul>
 *   <li>{@link Expression}: its own {@link Expression#render()} text, never re-escaped</li>
 *   <li>{@link FieldReference}: the identifier-formatted field name</li>
 *   <li>{@code null}: {@code null}</li>
 *   <li>strings, numbers, booleans, characters, enums: JSON scalars</li>
 *   <li>collections and arrays: {@code [a, b, c]}</li>
 *   <li>anything else is rejected with {@link CommandDefinitionException}</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionRenderer {

    private static final ExpressionRenderer DEFAULT = new ExpressionRenderer(RenderPolicy.defaults());

    private final RenderPolicy policy;
    private final JsonMapper mapper;

    private ExpressionRenderer(RenderPolicy policy) {
        this.policy = policy;
        JsonMapper.Builder builder = JsonMapper.builder();
        if (policy.escapeNonAscii()) {
            builder.enable(JsonWriteFeature.ESCAPE_NON_ASCII);
        }
        this.mapper = builder.build();
    }

    /**
     * Returns the renderer configured with {@link RenderPolicy#defaults()}.
     *
     * @return the shared default renderer
     */
    public static ExpressionRenderer defaults() {
        return DEFAULT;
    }

    /**
     * Creates a renderer for the given policy.
     *
     * @param policy the render policy, must not be null
     * @return a renderer applying {@code policy}
     */
    public static ExpressionRenderer of(RenderPolicy policy) {
        Objects.requireNonNull(policy, "RenderPolicy cannot be null");
        if (policy.equals(DEFAULT.policy)) {
            return DEFAULT;
        }
        return new ExpressionRenderer(policy);
    }

    public RenderPolicy policy() {
        return policy;
    }

    /**
     * Renders a value appearing in expression position.
     *
     * @param value an {@link Expression}, ES|QL source text, or a literal
     * @return the rendered text
     */
    public String formatExpr(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return formatLiteral(value);
    }

    /**
     * Renders a value appearing in literal position.
     *
     * @param value an {@link Expression} or a literal
     * @return the rendered text
     * @throws CommandDefinitionException if the value cannot be serialized as a literal
     */
    public String formatLiteral(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Expression) {
            return ((Expression) value).render();
        }
        if (value instanceof FieldReference) {
            return IdentifierFormatter.format((FieldReference) value);
        }
        if (value instanceof Collection<?>) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object item : (Collection<?>) value) {
                joiner.add(formatLiteral(item));
            }
            return joiner.toString();
        }
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                joiner.add(formatLiteral(Array.get(value, i)));
            }
            return joiner.toString();
        }
        return writeScalar(value);
    }

    /**
     * Renders a string as a double-quoted literal with JSON escaping.
     *
     * @param text the string, must not be null
     * @return the quoted literal
     */
    public String quote(String text) {
        Objects.requireNonNull(text, "Text to quote cannot be null");
        return writeScalar(text);
    }

    private String writeScalar(Object value) {
        if (!(value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?>)) {
            throw new CommandDefinitionException("Value of type " + value.getClass().getName()
                    + " has no ES|QL literal form; wrap it in an Expression or convert it first");
        }
        if (value instanceof Double && !Double.isFinite((Double) value)
                || value instanceof Float && !Float.isFinite((Float) value)) {
            throw new CommandDefinitionException("ES|QL has no literal for non-finite number " + value);
        }
        try {
            return mapper.writeValueAsString(value instanceof CharSequence ? value.toString() : value);
        } catch (JsonProcessingException e) {
            throw new CommandDefinitionException("Value of type " + value.getClass().getName()
                    + " cannot be rendered as an ES|QL literal", e);
        }
    }
}
