package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code CHANGE_POINT} processing command.
 * <p>
 * Without {@link #on(String)} the values are ordered by {@code @timestamp}. Without
 * {@link #as(String, String)} the output columns are {@code type} and {@code pvalue}; the
 * clauses are omitted from the rendered text when the defaults apply.
 * </p>
 */
public class ChangePoint extends Command {

    static final String DEFAULT_TYPE_NAME = "type";
    static final String DEFAULT_PVALUE_NAME = "pvalue";

    private final String value;
    private String key;
    private String typeName;
    private String pvalueName;

    public ChangePoint(Command parent, String value) {
        this(IdentifierFormatter.requireIdentifier("CHANGE_POINT value", value), parent);
    }

    public ChangePoint(Command parent, FieldReference value) {
        this(IdentifierFormatter.requireIdentifier("CHANGE_POINT value", value), parent);
    }

    private ChangePoint(String value, Command parent) {
        super(parent);
        this.value = value;
    }

    /**
     * Sets the column used to order the values.
     *
     * @param key the key column
     * @return this command
     */
    public ChangePoint on(String key) {
        ensureTail("on(...)");
        this.key = IdentifierFormatter.requireIdentifier("CHANGE_POINT key", key);
        return this;
    }

    public ChangePoint on(FieldReference key) {
        ensureTail("on(...)");
        this.key = IdentifierFormatter.requireIdentifier("CHANGE_POINT key", key);
        return this;
    }

    /**
     * Names the output columns. A {@code null} name keeps its default.
     *
     * @param typeName   name of the change point type column, {@code type} by default
     * @param pvalueName name of the p-value column, {@code pvalue} by default
     * @return this command
     */
    public ChangePoint as(String typeName, String pvalueName) {
        ensureTail("as(...)");
        this.typeName = typeName == null ? null : IdentifierFormatter.requireIdentifier("CHANGE_POINT type name", typeName);
        this.pvalueName = pvalueName == null ? null : IdentifierFormatter.requireIdentifier("CHANGE_POINT pvalue name", pvalueName);
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        StringBuilder stage = new StringBuilder("CHANGE_POINT ").append(IdentifierFormatter.format(value));
        if (key != null) {
            stage.append(" ON ").append(IdentifierFormatter.format(key));
        }
        if (typeName != null || pvalueName != null) {
            stage.append(" AS ")
                    .append(IdentifierFormatter.format(typeName != null ? typeName : DEFAULT_TYPE_NAME))
                    .append(", ")
                    .append(IdentifierFormatter.format(pvalueName != null ? pvalueName : DEFAULT_PVALUE_NAME));
        }
        return stage.toString();
    }
}
