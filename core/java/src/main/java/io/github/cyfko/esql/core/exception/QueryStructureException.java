package io.github.cyfko.esql.core.exception;

/**
 * Exception thrown when a chain of ES|QL commands violates a structural rule.
 * <p>
 * Structural rules concern the shape of the chain rather than the arguments of a single command.
 * Some are checked at the offending call, others can only be checked when the query is rendered,
 * because a mandatory continuation may still be supplied after construction.
 * </p>
 *
 * <p><strong>Detected at the call:</strong></p>
 * <ul>
 *   <li>A second {@code FORK} in a chain that already contains one</li>
 *   <li>A {@code FORK} branch that does not start with {@code Esql.branch()}</li>
 *   <li>A continuation method invoked on a command that already has a child</li>
 * </ul>
 *
 * <p><strong>Detected at render time:</strong></p>
 * <ul>
 *   <li>{@code LOOKUP JOIN} rendered without {@code on(...)}</li>
 *   <li>{@code COMPLETION} rendered without {@code with(...)}</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     String query = Esql.from("firewall_logs").lookupJoin("threat_list").render();
 * } catch (QueryStructureException e) {
 *     // "LOOKUP JOIN threat_list requires a join field: call on(...) before rendering"
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see CommandDefinitionException
 */
public class QueryStructureException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the violated rule
     */
    public QueryStructureException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the violated rule
     * @param cause   the original cause of this exception
     */
    public QueryStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
