package io.github.cyfko.esql.core.utils;

import io.github.cyfko.esql.core.api.FieldReference;
import io.github.cyfko.esql.core.config.PatternConfig;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;

/**
 * Renders field, column and parameter names as valid ES|QL identifiers.
 * <p>
 * Identifiers matching {@link PatternConfig#SIMPLE_IDENTIFIER_PATTERN} are written unchanged.
 * Any other identifier is wrapped in backticks, with embedded backticks doubled, so that names
 * such as {@code height * 3.281} or {@code first name} reach the engine as a single token.
 * </p>
 *
 * <p><strong>Patterns:</strong> when patterns are allowed and the identifier contains a
 * {@code *}, it is returned unchanged. A pattern cannot be quoted without turning the wildcard
 * into a literal character, so pattern identifiers bypass escaping entirely. Callers passing
 * untrusted names to {@code KEEP} or {@code DROP} must validate them first.</p>
 *
 * <pre>{@code
 * IdentifierFormatter.format("first_name");           // first_name
 * IdentifierFormatter.format("height * 3.281");       // `height * 3.281`
 * IdentifierFormatter.format("odd`name");             // `odd``name`
 * IdentifierFormatter.format("h*", true);             // h*
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IdentifierFormatter {

    private IdentifierFormatter() {}

    /**
     * Formats an identifier, quoting it when required. Wildcards are quoted like any other
     * special character.
     *
     * @param id the identifier
     * @return the identifier, quoted if it is not a simple identifier
     */
    public static String format(String id) {
        return format(id, false);
    }

    /**
     * Formats an identifier, quoting it when required.
     *
     * @param id            the identifier
     * @param allowPatterns whether an identifier containing a wildcard is passed through unchanged
     * @return the formatted identifier
     */
    public static String format(String id, boolean allowPatterns) {
        if (allowPatterns && id.indexOf(PatternConfig.WILDCARD) >= 0) {
            return id;
        }
        if (PatternConfig.SIMPLE_IDENTIFIER_PATTERN.matcher(id).matches()) {
            return id;
        }
        String tick = String.valueOf(PatternConfig.BACKTICK);
        return tick + id.replace(tick, tick + tick) + tick;
    }

    /**
     * Formats the name of a mapped field.
     *
     * @param field the field reference
     * @return the formatted field name
     */
    public static String format(FieldReference field) {
        return format(field.fieldName(), false);
    }

    /**
     * Validates that an identifier supplied to a command is usable.
     *
     * @param what description of the argument, used in the error message
     * @param id   the identifier to check
     * @return {@code id}
     * @throws CommandDefinitionException if {@code id} is null or empty
     */
    public static String requireIdentifier(String what, String id) {
        if (id == null || id.isEmpty()) {
            throw new CommandDefinitionException(what + " cannot be null or empty");
        }
        return id;
    }

    /**
     * Resolves and validates the name of a mapped field.
     *
     * @param what  description of the argument, used in the error message
     * @param field the field reference
     * @return the unquoted field name
     * @throws CommandDefinitionException if the reference or its name is null or empty
     */
    public static String requireIdentifier(String what, FieldReference field) {
        if (field == null) {
            throw new CommandDefinitionException(what + " cannot be null");
        }
        return requireIdentifier(what, field.fieldName());
    }
}
