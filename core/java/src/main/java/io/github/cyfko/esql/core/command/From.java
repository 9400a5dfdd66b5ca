package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.api.IndexReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@code FROM} source command: reads from indices, data streams or aliases.
 * <p>
 * Index names are written as given, since they may legitimately contain wildcards, date math
 * ({@code <logs-{now/d}>}) or remote cluster prefixes ({@code cluster_one:employees}). They are
 * resolved from their {@link IndexReference} when the query is rendered.
 * </p>
 *
 * <pre>{@code
 * Esql.from("employees-00001", "other-employees-*").metadata("_id");
 * // FROM employees-00001, other-employees-* METADATA _id
 * }</pre>
 */
public class From extends Command {

    private final List<IndexReference> indices;
    private List<String> metadataFields = List.of();

    public From(IndexReference... indices) {
        super(null);
        requireNonEmpty("FROM", "index", indices);
        for (IndexReference index : indices) {
            if (index == null) {
                throw new CommandDefinitionException("FROM index reference cannot be null");
            }
        }
        this.indices = List.of(indices);
    }

    /**
     * Requests metadata fields such as {@code _id} or {@code _index}.
     *
     * @param fields the metadata fields
     * @return this command
     */
    public From metadata(String... fields) {
        ensureTail("metadata(...)");
        requireNonEmpty("FROM ... METADATA", "field", fields);
        this.metadataFields = Arrays.stream(fields)
                .map(field -> IdentifierFormatter.requireIdentifier("Metadata field", field))
                .collect(Collectors.toUnmodifiableList());
        return this;
    }

    public From metadata(FieldReference... fields) {
        ensureTail("metadata(...)");
        requireNonEmpty("FROM ... METADATA", "field", fields);
        this.metadataFields = Arrays.stream(fields)
                .map(field -> IdentifierFormatter.requireIdentifier("Metadata field", field))
                .collect(Collectors.toUnmodifiableList());
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        String names = indices.stream()
                .map(From::resolve)
                .collect(Collectors.joining(", "));
        if (metadataFields.isEmpty()) {
            return "FROM " + names;
        }
        return "FROM " + names + " METADATA " + metadataFields.stream()
                .map(IdentifierFormatter::format)
                .collect(Collectors.joining(", "));
    }

    static String resolve(IndexReference index) {
        String name = index.indexName();
        if (name == null || name.isBlank()) {
            throw new QueryStructureException("Index reference " + index + " resolved to an empty index name");
        }
        return name;
    }
}
