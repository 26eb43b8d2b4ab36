package com.repocheck.core.model;

/**
 * Nature of a coverage discrepancy.
 *
 * @since 1.0.0
 */
public enum DiscrepancyKind {
    /**
     * The module has no test file named after it. Never allow-listable.
     */
    MISSING_TEST_FILE(CoveragePass.TESTED),

    /**
     * The test file exists but declares no {@code all_model_classes}.
     */
    MISSING_TEST_DECLARATION(CoveragePass.TESTED),

    /**
     * A model class is missing from its test file's declaration.
     */
    CLASS_NOT_TESTED(CoveragePass.TESTED),

    /**
     * The module has no documentation page for its family. Never allow-listable.
     */
    MISSING_DOC_FILE(CoveragePass.DOCUMENTED),

    /**
     * A model class is not auto-included by its documentation page.
     */
    CLASS_NOT_DOCUMENTED(CoveragePass.DOCUMENTED);

    private final CoveragePass pass;

    DiscrepancyKind(CoveragePass pass) {
        this.pass = pass;
    }

    public CoveragePass pass() {
        return pass;
    }
}
