package io.github.cyfko.esql.core.spi;

/**
 * <h2>QueryExecutor</h2>
 *
 * <p>
 * Transport seam of the library: receives a rendered ES|QL query and returns whatever the
 * backend produces for it. The builder never opens connections itself; an application plugs
 * in its own client (HTTP, the official Elasticsearch client, a test double, etc.).
 * </p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * QueryExecutor<EsqlResponse> executor = query -> client.esql().query(q -> q.query(query));
 *
 * EsqlResponse response = Esql.from("employees")
 *     .keep("first_name", "last_name")
 *     .limit(10)
 *     .executeWith(executor);
 * }</pre>
 *
 * <h3>Thread Safety:</h3>
 * <p>
 * Implementations shared between threads must be thread-safe; the builder calls
 * {@link #execute(String)} from the thread invoking {@code executeWith}.
 * </p>
 *
 * @param <R> response type produced by the transport
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryExecutor<R> {

    /**
     * Runs a rendered query.
     *
     * @param query the ES|QL query text, never null
     * @return the backend response
     */
    R execute(String query);
}
