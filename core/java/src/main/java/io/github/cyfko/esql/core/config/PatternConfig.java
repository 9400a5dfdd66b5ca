package io.github.cyfko.esql.core.config;

import java.util.regex.Pattern;

/**
 * Lexical patterns of the ES|QL identifier grammar.
 * <p>
 * An identifier that matches {@link #SIMPLE_IDENTIFIER_PATTERN} can be written as-is; any other
 * identifier must be quoted with backticks.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    private static final String SIMPLE_FORM = "[a-zA-Z_@][a-zA-Z0-9_.]*";

    /**
     * Pattern for identifiers that need no quoting.
     * <p>
     * Matches identifiers starting with a letter, an underscore or an at-sign, followed by
     * letters, digits, underscores or dots.
     * Example valid: "first_name", "@timestamp", "host.name", "_id"
     * Example invalid: "2nd", "first name", "height * 3.281"
     * </p>
     */
    public static final Pattern SIMPLE_IDENTIFIER_PATTERN = Pattern.compile("^" + SIMPLE_FORM + "$");

    /**
     * Wildcard character of column and index patterns ({@code KEEP h*}).
     */
    public static final char WILDCARD = '*';

    /**
     * Quote character of escaped identifiers.
     */
    public static final char BACKTICK = '`';
}
