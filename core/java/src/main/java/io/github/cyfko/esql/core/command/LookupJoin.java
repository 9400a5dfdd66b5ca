package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.api.IndexReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code LOOKUP JOIN} processing command.
 * <p>
 * The join field is mandatory and supplied through {@link #on(String)}. Since it may be supplied
 * any time before rendering, its absence is only reported by {@link #render()}.
 * </p>
 *
 * <pre>{@code
 * Esql.from("system_metrics").lookupJoin("host_inventory").on("host.name");
 * // FROM system_metrics
 * // | LOOKUP JOIN host_inventory ON host.name
 * }</pre>
 */
public class LookupJoin extends Command {

    private final IndexReference lookupIndex;
    private String field;

    public LookupJoin(Command parent, IndexReference lookupIndex) {
        this(requireIndex(lookupIndex), parent);
    }

    private LookupJoin(IndexReference lookupIndex, Command parent) {
        super(parent);
        this.lookupIndex = lookupIndex;
    }

    private static IndexReference requireIndex(IndexReference lookupIndex) {
        if (lookupIndex == null) {
            throw new CommandDefinitionException("LOOKUP JOIN index cannot be null");
        }
        return lookupIndex;
    }

    /**
     * Sets the field to join on. It must exist both in the current table and in the lookup index.
     *
     * @param field the join field
     * @return this command
     */
    public LookupJoin on(String field) {
        ensureTail("on(...)");
        this.field = IdentifierFormatter.requireIdentifier("LOOKUP JOIN field", field);
        return this;
    }

    public LookupJoin on(FieldReference field) {
        ensureTail("on(...)");
        this.field = IdentifierFormatter.requireIdentifier("LOOKUP JOIN field", field);
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        String index = From.resolve(lookupIndex);
        if (field == null) {
            throw new QueryStructureException("LOOKUP JOIN " + index
                    + " requires a join field: call on(...) before rendering");
        }
        return "LOOKUP JOIN " + index + " ON " + IdentifierFormatter.format(field);
    }
}
