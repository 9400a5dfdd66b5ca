package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code GROK} processing command.
 */
public class Grok extends Command {

    private final String input;
    private final String pattern;

    public Grok(Command parent, String input, String pattern) {
        this(IdentifierFormatter.requireIdentifier("GROK input", input), requirePattern(pattern), parent);
    }

    public Grok(Command parent, FieldReference input, String pattern) {
        this(IdentifierFormatter.requireIdentifier("GROK input", input), requirePattern(pattern), parent);
    }

    private Grok(String input, String pattern, Command parent) {
        super(parent);
        this.input = input;
        this.pattern = pattern;
    }

    private static String requirePattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new CommandDefinitionException("GROK pattern cannot be null or empty");
        }
        return pattern;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "GROK " + IdentifierFormatter.format(input) + " " + renderer.quote(pattern);
    }
}
