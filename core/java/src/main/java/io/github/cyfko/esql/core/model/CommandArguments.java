package io.github.cyfko.esql.core.model;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments of a command that accepts either positional or named expressions, never both.
 * <p>
 * {@link #of(String, Object...)} classifies the raw arguments once, at construction of the
 * command: {@link Assignment} values are named, everything else is positional. Mixing the two
 * kinds is rejected immediately.
 * </p>
 *
 * <pre>{@code
 * CommandArguments.of("STATS", Functions.min(Expr.of("i")));              // Positional
 * CommandArguments.of("STATS", assign("count", Functions.count("*")));    // Named
 * CommandArguments.of("STATS", "MIN(i)", assign("count", "COUNT(*)"));    // throws
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface CommandArguments permits CommandArguments.Positional, CommandArguments.Named {

    /**
     * @return number of arguments
     */
    int size();

    /**
     * @return {@code true} if no argument was given
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Positional (unnamed) arguments.
     *
     * @param values the argument values, in call order
     */
    record Positional(List<Object> values) implements CommandArguments {
        public Positional {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public int size() {
            return values.size();
        }
    }

    /**
     * Named arguments.
     *
     * @param assignments the assignments, in call order
     */
    record Named(List<Assignment> assignments) implements CommandArguments {
        public Named {
            assignments = List.copyOf(assignments);
        }

        @Override
        public int size() {
            return assignments.size();
        }
    }

    /**
     * Classifies raw arguments.
     *
     * @param command   command name, used in the error message
     * @param arguments the raw arguments
     * @return positional or named arguments
     * @throws CommandDefinitionException if both kinds are present or an argument is null
     */
    static CommandArguments of(String command, Object... arguments) {
        Objects.requireNonNull(arguments, "Arguments array cannot be null");
        List<Object> positional = new ArrayList<>();
        List<Assignment> named = new ArrayList<>();
        for (Object argument : arguments) {
            if (argument == null) {
                throw new CommandDefinitionException(command + " argument at position "
                        + (positional.size() + named.size()) + " is null; use Expr.of(\"null\") for a null literal");
            }
            if (argument instanceof Assignment) {
                named.add((Assignment) argument);
            } else {
                positional.add(argument);
            }
        }
        if (!positional.isEmpty() && !named.isEmpty()) {
            throw new CommandDefinitionException(
                    command + " supports positional or named arguments but not both");
        }
        return named.isEmpty() ? new Positional(positional) : new Named(named);
    }

    /**
     * Builds named arguments from a map, keeping its iteration order.
     *
     * @param namedArguments name to value mapping
     * @return named arguments
     */
    static CommandArguments of(Map<String, ?> namedArguments) {
        Objects.requireNonNull(namedArguments, "Named arguments cannot be null");
        List<Assignment> named = new ArrayList<>(namedArguments.size());
        namedArguments.forEach((name, value) -> named.add(Assignment.of(name, value)));
        return new Named(named);
    }
}
