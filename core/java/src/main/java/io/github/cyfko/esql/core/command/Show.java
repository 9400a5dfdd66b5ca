package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code SHOW} source command: returns information about the deployment.
 * The only item currently supported by the engine is {@code INFO}.
 */
public class Show extends Command {

    private final String item;

    public Show(String item) {
        super(null);
        this.item = IdentifierFormatter.requireIdentifier("SHOW item", item);
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "SHOW " + item;
    }
}
