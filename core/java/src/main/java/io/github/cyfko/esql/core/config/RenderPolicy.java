package io.github.cyfko.esql.core.config;

/**
 * Configuration of literal serialization when rendering queries.
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: non-ASCII characters in string literals are written as JSON unicode escapes
 * RenderPolicy policy = RenderPolicy.defaults();
 *
 * // Unicode: string literals keep their characters as-is
 * RenderPolicy policy = RenderPolicy.unicode();
 *
 * // Custom
 * RenderPolicy policy = RenderPolicy.builder()
 *     .escapeNonAscii(false)
 *     .build();
 * }</pre>
 *
 * @param policyName     name of the policy, for diagnostics
 * @param escapeNonAscii whether string literals escape characters outside the ASCII range
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RenderPolicy(
        String policyName,
        boolean escapeNonAscii
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the policy name is blank
     */
    public RenderPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Escape non-ASCII: ENABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static RenderPolicy defaults() {
        return new RenderPolicy(PolicyName.DEFAULT_POLICY.name(), true);
    }

    /**
     * Configuration emitting string literals with their characters unchanged.
     * <ul>
     *   <li>Escape non-ASCII: DISABLED</li>
     * </ul>
     *
     * @return unicode configuration
     */
    public static RenderPolicy unicode() {
        return new RenderPolicy(PolicyName.UNICODE_POLICY.name(), false);
    }

    /**
     * Creates a custom configuration. Builder parameters are initialized as in {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private boolean _escapeNonAscii = true;

        private Builder() {}

        public RenderPolicy build() {
            return new RenderPolicy(_policyName, _escapeNonAscii);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder escapeNonAscii(boolean escapeNonAscii) { this._escapeNonAscii = escapeNonAscii; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        UNICODE_POLICY,
        CUSTOM_POLICY
    }
}
