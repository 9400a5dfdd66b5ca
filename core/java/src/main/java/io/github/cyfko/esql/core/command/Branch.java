package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.utils.ExpressionRenderer;

/**
 * Start of a {@code FORK} branch.
 * <p>
 * A branch is a partial chain with no source command. It renders to nothing and only exists
 * so that processing commands can be appended to it before it is passed to
 * {@link Command#fork(Command...)}.
 * </p>
 */
public class Branch extends Command {

    public Branch() {
        super(null);
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "";
    }
}
