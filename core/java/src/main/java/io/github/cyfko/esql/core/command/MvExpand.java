package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code MV_EXPAND} processing command: one row per value of a multivalued column.
 */
public class MvExpand extends Command {

    private final String column;

    public MvExpand(Command parent, String column) {
        this(IdentifierFormatter.requireIdentifier("MV_EXPAND column", column), parent);
    }

    public MvExpand(Command parent, FieldReference column) {
        this(IdentifierFormatter.requireIdentifier("MV_EXPAND column", column), parent);
    }

    private MvExpand(String column, Command parent) {
        super(parent);
        this.column = column;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "MV_EXPAND " + IdentifierFormatter.format(column);
    }
}
