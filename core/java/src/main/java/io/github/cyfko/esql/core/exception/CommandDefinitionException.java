package io.github.cyfko.esql.core.exception;

/**
 * Exception thrown when an ES|QL command is constructed with invalid arguments.
 * <p>
 * This runtime exception is raised at the call site that builds the offending command,
 * before any rendering happens. A chain that triggered it is unusable and must be rebuilt.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>Positional and named arguments mixed in {@code STATS}, {@code EVAL}, {@code ENRICH ... WITH}
 *       or {@code COMPLETION}</li>
 *   <li>Wrong number of arguments (a {@code COMPLETION} prompt, {@code FORK} branches)</li>
 *   <li>Blank identifiers or index names</li>
 *   <li>Out-of-range numeric parameters ({@code LIMIT}, {@code SAMPLE})</li>
 * </ul>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * throw new CommandDefinitionException("STATS supports positional or named expressions but not both");
 *
 * throw new CommandDefinitionException("SAMPLE probability must be between 0 and 1 exclusive, got: 1.5");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryStructureException
 */
public class CommandDefinitionException extends RuntimeException {

    /**
     * Creates a new CommandDefinitionException with a detailed message.
     *
     * @param message explanation of the invalid argument
     */
    public CommandDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new CommandDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure (e.g., a JSON serialization error)
     */
    public CommandDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
