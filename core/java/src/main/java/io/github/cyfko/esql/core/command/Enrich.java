package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.model.Assignment;
import io.github.cyfko.esql.core.model.CommandArguments;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code ENRICH} processing command.
 * <p>
 * Both clauses are optional: without {@code on(...)} the engine matches on the policy's match
 * field, without {@code with(...)} every enrich field of the policy is added.
 * </p>
 *
 * <pre>{@code
 * Esql.row(assign("language_code", "1"))
 *     .enrich("languages_policy").on("language_code").with(assign("name", "language_name"));
 * // ROW language_code = "1"
 * // | ENRICH languages_policy ON language_code WITH name = language_name
 * }</pre>
 */
public class Enrich extends Command {

    private final String policy;
    private String matchField;
    private CommandArguments fields;

    public Enrich(Command parent, String policy) {
        this(IdentifierFormatter.requireIdentifier("ENRICH policy", policy), parent);
    }

    private Enrich(String policy, Command parent) {
        super(parent);
        this.policy = policy;
    }

    /**
     * Sets the column whose value is looked up in the enrich index.
     *
     * @param matchField the match column
     * @return this command
     */
    public Enrich on(String matchField) {
        ensureTail("on(...)");
        this.matchField = IdentifierFormatter.requireIdentifier("ENRICH match field", matchField);
        return this;
    }

    public Enrich on(FieldReference matchField) {
        ensureTail("on(...)");
        this.matchField = IdentifierFormatter.requireIdentifier("ENRICH match field", matchField);
        return this;
    }

    /**
     * Selects the enrich fields added as columns.
     *
     * @param fields enrich field names, or {@link Assignment}s renaming them ({@code newName = field});
     *               the two forms cannot be mixed
     * @return this command
     * @throws CommandDefinitionException if the forms are mixed or a field is not a name
     */
    public Enrich with(Object... fields) {
        ensureTail("with(...)");
        requireNonEmpty("ENRICH ... WITH", "field", fields);
        this.fields = validate(CommandArguments.of("ENRICH ... WITH", fields));
        return this;
    }

    public Enrich with(Map<String, ?> namedFields) {
        ensureTail("with(...)");
        if (namedFields == null || namedFields.isEmpty()) {
            throw new CommandDefinitionException("ENRICH ... WITH requires at least one field");
        }
        this.fields = validate(CommandArguments.of(namedFields));
        return this;
    }

    private static CommandArguments validate(CommandArguments fields) {
        if (fields instanceof CommandArguments.Named) {
            ((CommandArguments.Named) fields).assignments().forEach(assignment -> fieldName(assignment.value()));
        } else {
            ((CommandArguments.Positional) fields).values().forEach(Enrich::fieldName);
        }
        return fields;
    }

    private static String fieldName(Object field) {
        if (field instanceof FieldReference) {
            return IdentifierFormatter.requireIdentifier("ENRICH field", (FieldReference) field);
        }
        if (field instanceof String) {
            return IdentifierFormatter.requireIdentifier("ENRICH field", (String) field);
        }
        throw new CommandDefinitionException("ENRICH field must be a String or a FieldReference, got: "
                + (field == null ? "null" : field.getClass().getName()));
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        StringBuilder stage = new StringBuilder("ENRICH ").append(policy);
        if (matchField != null) {
            stage.append(" ON ").append(IdentifierFormatter.format(matchField));
        }
        if (fields instanceof CommandArguments.Named) {
            stage.append(" WITH ").append(((CommandArguments.Named) fields).assignments().stream()
                    .map(assignment -> IdentifierFormatter.format(assignment.name()) + " = "
                            + IdentifierFormatter.format(fieldName(assignment.value())))
                    .collect(Collectors.joining(", ")));
        } else if (fields instanceof CommandArguments.Positional) {
            stage.append(" WITH ").append(((CommandArguments.Positional) fields).values().stream()
                    .map(field -> IdentifierFormatter.format(fieldName(field)))
                    .collect(Collectors.joining(", ")));
        }
        return stage.toString();
    }
}
