package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code DISSECT} processing command.
 *
 * <pre>{@code
 * Esql.row(assign("a", "2023-01-23T12:15:00.000Z - some text - 127.0.0.1"))
 *     .dissect("a", "%{date} - %{msg} - %{ip}")
 *     .appendSeparator(",");
 * // ROW a = "2023-01-23T12:15:00.000Z - some text - 127.0.0.1"
 * // | DISSECT a "%{date} - %{msg} - %{ip}" APPEND_SEPARATOR=","
 * }</pre>
 */
public class Dissect extends Command {

    private final String input;
    private final String pattern;
    private String separator;

    public Dissect(Command parent, String input, String pattern) {
        this(IdentifierFormatter.requireIdentifier("DISSECT input", input), requirePattern(pattern), parent);
    }

    public Dissect(Command parent, FieldReference input, String pattern) {
        this(IdentifierFormatter.requireIdentifier("DISSECT input", input), requirePattern(pattern), parent);
    }

    private Dissect(String input, String pattern, Command parent) {
        super(parent);
        this.input = input;
        this.pattern = pattern;
    }

    private static String requirePattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new CommandDefinitionException("DISSECT pattern cannot be null or empty");
        }
        return pattern;
    }

    /**
     * Sets the separator placed between appended values when the pattern uses the append modifier.
     *
     * @param separator the separator
     * @return this command
     */
    public Dissect appendSeparator(String separator) {
        ensureTail("appendSeparator(...)");
        if (separator == null) {
            throw new CommandDefinitionException("DISSECT append separator cannot be null");
        }
        this.separator = separator;
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        String stage = "DISSECT " + IdentifierFormatter.format(input) + " " + renderer.quote(pattern);
        if (separator == null) {
            return stage;
        }
        return stage + " APPEND_SEPARATOR=" + renderer.quote(separator);
    }
}
