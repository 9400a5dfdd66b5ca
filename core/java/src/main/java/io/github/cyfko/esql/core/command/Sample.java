package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

/**
 * The {@code SAMPLE} processing command: keeps each row with the given probability.
 */
public class Sample extends Command {

    private final double probability;

    public Sample(Command parent, double probability) {
        this(validate(probability), parent);
    }

    private Sample(double probability, Command parent) {
        super(parent);
        this.probability = probability;
    }

    private static double validate(double probability) {
        if (!(probability > 0.0 && probability < 1.0)) {
            throw new CommandDefinitionException(
                    "SAMPLE probability must be between 0 and 1 exclusive, got: " + probability);
        }
        return probability;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "SAMPLE " + renderer.formatLiteral(probability);
    }
}
