package com.repocheck.core.model;

import java.util.Objects;

/**
 * One missing or incomplete piece of coverage.
 *
 * <p>Discrepancies are accumulated during a pass and reported together; they are
 * never thrown individually.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Discrepancy d = Discrepancy.of(
 *     DiscrepancyKind.MISSING_TEST_FILE,
 *     "transformers.modeling_foo",
 *     "test_modeling_foo.py",
 *     "transformers.modeling_foo does not have its corresponding test file test_modeling_foo.py."
 * );
 * }</pre>
 *
 * @param kind nature of the mismatch
 * @param module qualified name of the offending module
 * @param subject offending class or file name
 * @param message self-explanatory description including the remedy
 */
public record Discrepancy(
    DiscrepancyKind kind,
    String module,
    String subject,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Discrepancy {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Discrepancy of(DiscrepancyKind kind, String module, String subject, String message) {
        return new Discrepancy(kind, module, subject, message);
    }

    public CoveragePass pass() {
        return kind.pass();
    }
}
