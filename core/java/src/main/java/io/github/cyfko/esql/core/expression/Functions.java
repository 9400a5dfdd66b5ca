package io.github.cyfko.esql.core.expression;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Helpers building ES|QL function calls.
 * <p>
 * Arguments follow the literal rules of {@link ExpressionRenderer#formatLiteral(Object)}:
 * expressions (typically column references built with {@link Expr#of(String)}) are written
 * verbatim, strings are quoted, numbers and booleans are written as-is. Functions without a
 * dedicated helper are reachable through {@link #call(String, Object...)}.
 * </p>
 *
 * <pre>{@code
 * Functions.round(Expr.of("salary").div(1000), 1);                // ROUND(salary / 1000, 1)
 * Functions.dateFormat(Expr.of("hire_date"), "yyyy");             // DATE_FORMAT("yyyy", hire_date)
 * Functions.count();                                              // COUNT(*)
 * Functions.avg(Expr.of("salary")).where(Expr.of("languages").gt(2));
 *                                                                 // AVG(salary) WHERE languages > 2
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Functions {

    private static final ExpressionRenderer RENDERER = ExpressionRenderer.defaults();
    private static final Pattern FUNCTION_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private Functions() {}

    /**
     * Builds a call to any function.
     *
     * @param name      upper-case function name, e.g. {@code "ST_DISTANCE"}
     * @param arguments the arguments, in order
     * @return the call expression
     * @throws CommandDefinitionException if the name is not a valid function name
     */
    public static Expr call(String name, Object... arguments) {
        if (name == null || !FUNCTION_NAME.matcher(name).matches()) {
            throw new CommandDefinitionException("Invalid ES|QL function name: " + name);
        }
        String rendered = arguments == null ? "" : Arrays.stream(arguments)
                .map(RENDERER::formatLiteral)
                .collect(Collectors.joining(", "));
        return Expr.of(name + "(" + rendered + ")");
    }

    private static Expr callVariadic(String name, Object first, Object[] rest) {
        List<Object> arguments = new ArrayList<>();
        arguments.add(first);
        if (rest != null) {
            arguments.addAll(Arrays.asList(rest));
        }
        return call(name, arguments.toArray());
    }

    // ---------------------------------------------------------------- aggregates

    public static Expr avg(Object number) {
        return call("AVG", number);
    }

    /**
     * @return {@code COUNT(*)}
     */
    public static Expr count() {
        return call("COUNT", Expr.of("*"));
    }

    public static Expr count(Object field) {
        return call("COUNT", field);
    }

    public static Expr countDistinct(Object field) {
        return call("COUNT_DISTINCT", field);
    }

    public static Expr countDistinct(Object field, int precision) {
        return call("COUNT_DISTINCT", field, precision);
    }

    public static Expr max(Object field) {
        return call("MAX", field);
    }

    public static Expr median(Object number) {
        return call("MEDIAN", number);
    }

    public static Expr min(Object field) {
        return call("MIN", field);
    }

    public static Expr percentile(Object number, Object percentile) {
        return call("PERCENTILE", number, percentile);
    }

    public static Expr sum(Object number) {
        return call("SUM", number);
    }

    public static Expr values(Object field) {
        return call("VALUES", field);
    }

    // ---------------------------------------------------------------- math

    public static Expr abs(Object number) {
        return call("ABS", number);
    }

    public static Expr ceil(Object number) {
        return call("CEIL", number);
    }

    public static Expr floor(Object number) {
        return call("FLOOR", number);
    }

    public static Expr log10(Object number) {
        return call("LOG10", number);
    }

    public static Expr pow(Object base, Object exponent) {
        return call("POW", base, exponent);
    }

    /**
     * Rounds to the nearest integer.
     */
    public static Expr round(Object number) {
        return call("ROUND", number);
    }

    /**
     * Rounds to a number of decimal digits; a negative count rounds to the left of the point.
     */
    public static Expr round(Object number, int decimals) {
        return call("ROUND", number, decimals);
    }

    public static Expr sqrt(Object number) {
        return call("SQRT", number);
    }

    // ---------------------------------------------------------------- strings

    public static Expr concat(Object first, Object second, Object... rest) {
        List<Object> arguments = new ArrayList<>(List.of(first, second));
        if (rest != null) {
            arguments.addAll(Arrays.asList(rest));
        }
        return call("CONCAT", arguments.toArray());
    }

    public static Expr endsWith(Object string, Object suffix) {
        return call("ENDS_WITH", string, suffix);
    }

    public static Expr length(Object string) {
        return call("LENGTH", string);
    }

    public static Expr toLower(Object string) {
        return call("TO_LOWER", string);
    }

    public static Expr toUpper(Object string) {
        return call("TO_UPPER", string);
    }

    public static Expr replace(Object string, Object regex, Object replacement) {
        return call("REPLACE", string, regex, replacement);
    }

    public static Expr startsWith(Object string, Object prefix) {
        return call("STARTS_WITH", string, prefix);
    }

    public static Expr substring(Object string, int start) {
        return call("SUBSTRING", string, start);
    }

    public static Expr substring(Object string, int start, int length) {
        return call("SUBSTRING", string, start, length);
    }

    public static Expr trim(Object string) {
        return call("TRIM", string);
    }

    // ---------------------------------------------------------------- dates

    /**
     * Formats a date. The format comes first in the rendered call.
     *
     * @param date   the date expression
     * @param format the format pattern, e.g. {@code "yyyy-MM-dd"}
     * @return {@code DATE_FORMAT(format, date)}
     */
    public static Expr dateFormat(Object date, String format) {
        return call("DATE_FORMAT", format, date);
    }

    public static Expr dateExtract(String part, Object date) {
        return call("DATE_EXTRACT", part, date);
    }

    /**
     * Rounds a date down to an interval.
     *
     * @param interval the interval, e.g. {@code Expr.of("1 year")} or {@code Expr.of("1 month")}
     * @param date     the date expression
     * @return {@code DATE_TRUNC(interval, date)}
     */
    public static Expr dateTrunc(Object interval, Object date) {
        return call("DATE_TRUNC", interval, date);
    }

    public static Expr now() {
        return call("NOW");
    }

    // ---------------------------------------------------------------- conversions

    public static Expr toBoolean(Object field) {
        return call("TO_BOOLEAN", field);
    }

    public static Expr toDatetime(Object field) {
        return call("TO_DATETIME", field);
    }

    public static Expr toDouble(Object field) {
        return call("TO_DOUBLE", field);
    }

    public static Expr toInteger(Object field) {
        return call("TO_INTEGER", field);
    }

    public static Expr toIp(Object field) {
        return call("TO_IP", field);
    }

    public static Expr toLong(Object field) {
        return call("TO_LONG", field);
    }

    public static Expr toStringValue(Object field) {
        return call("TO_STRING", field);
    }

    // ---------------------------------------------------------------- conditionals

    /**
     * {@code CASE(condition, value, ..., elseValue)}: the arguments alternate conditions and
     * values, with an optional trailing default value.
     *
     * @param condition the first condition
     * @param value     the value when {@code condition} holds
     * @param more      further condition/value pairs, optionally followed by a default value
     * @return the case expression
     */
    public static Expr caseOf(Object condition, Object value, Object... more) {
        List<Object> arguments = new ArrayList<>(Arrays.asList(condition, value));
        if (more != null) {
            arguments.addAll(Arrays.asList(more));
        }
        return call("CASE", arguments.toArray());
    }

    public static Expr coalesce(Object first, Object... rest) {
        return callVariadic("COALESCE", first, rest);
    }

    public static Expr greatest(Object first, Object... rest) {
        return callVariadic("GREATEST", first, rest);
    }

    public static Expr least(Object first, Object... rest) {
        return callVariadic("LEAST", first, rest);
    }

    // ---------------------------------------------------------------- multivalue

    public static Expr mvAvg(Object number) {
        return call("MV_AVG", number);
    }

    public static Expr mvConcat(Object string, String delimiter) {
        return call("MV_CONCAT", string, delimiter);
    }

    public static Expr mvCount(Object field) {
        return call("MV_COUNT", field);
    }

    public static Expr mvDedupe(Object field) {
        return call("MV_DEDUPE", field);
    }

    public static Expr mvFirst(Object field) {
        return call("MV_FIRST", field);
    }

    public static Expr mvLast(Object field) {
        return call("MV_LAST", field);
    }

    public static Expr mvMax(Object field) {
        return call("MV_MAX", field);
    }

    public static Expr mvMin(Object field) {
        return call("MV_MIN", field);
    }

    public static Expr mvSum(Object number) {
        return call("MV_SUM", number);
    }
}
