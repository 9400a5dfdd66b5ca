package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

/**
 * The {@code LIMIT} processing command.
 */
public class Limit extends Command {

    private final int maxNumberOfRows;

    public Limit(Command parent, int maxNumberOfRows) {
        this(validate(maxNumberOfRows), parent);
    }

    private Limit(int maxNumberOfRows, Command parent) {
        super(parent);
        this.maxNumberOfRows = maxNumberOfRows;
    }

    private static int validate(int maxNumberOfRows) {
        if (maxNumberOfRows < 0) {
            throw new CommandDefinitionException("LIMIT cannot be negative, got: " + maxNumberOfRows);
        }
        return maxNumberOfRows;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "LIMIT " + maxNumberOfRows;
    }
}
