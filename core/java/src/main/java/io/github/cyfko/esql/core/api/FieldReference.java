package io.github.cyfko.esql.core.api;

/**
 * Reference to a document field, supplied by a document-mapping layer.
 * <p>
 * Commands that accept column names also accept {@code FieldReference} instances, so that a
 * mapping layer can expose its fields in a type-safe way. The usual implementation is an enum:
 * </p>
 *
 * <pre>{@code
 * public enum EmployeeField implements FieldReference {
 *     FIRST_NAME("first_name"),
 *     LAST_NAME("last_name"),
 *     HIRE_DATE("hire_date");
 *
 *     private final String fieldName;
 *
 *     EmployeeField(String fieldName) {
 *         this.fieldName = fieldName;
 *     }
 *
 *     @Override
 *     public String fieldName() {
 *         return fieldName;
 *     }
 * }
 *
 * Esql.from("employees").keep(EmployeeField.FIRST_NAME, EmployeeField.LAST_NAME);
 * }</pre>
 *
 * <p>The returned name is identifier-formatted by the command that uses it.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FieldReference {

    /**
     * Returns the name of the field as known to the index mapping (e.g. {@code "host.name"}).
     *
     * @return the unquoted field name
     */
    String fieldName();
}
