package io.github.cyfko.esql.core.api;

import java.util.Objects;

/**
 * Reference to an index, data stream or alias.
 * <p>
 * The name is resolved when the query is rendered, not when the command is built. A mapping
 * layer can therefore hand out a reference for a document class and re-point it to another
 * index at any time before rendering.
 * </p>
 *
 * <pre>{@code
 * IndexReference employees = () -> employeeDocument.currentIndexName();
 * Command query = Esql.from(employees).limit(10);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface IndexReference {

    /**
     * Returns the current index, data stream or alias name. Wildcards, date math and
     * remote cluster prefixes are passed through untouched.
     *
     * @return the index name
     */
    String indexName();

    /**
     * Creates a reference to a fixed index name.
     *
     * @param name the index name, must not be null
     * @return a reference always resolving to {@code name}
     */
    static IndexReference of(String name) {
        Objects.requireNonNull(name, "Index name cannot be null");
        return () -> name;
    }
}
