package com.repocheck.core.model;

/**
 * The two independent audits run over the model modules.
 */
public enum CoveragePass {
    TESTED("tested"),
    DOCUMENTED("documented");

    private final String label;

    CoveragePass(String label) {
        this.label = label;
    }

    /**
     * Returns the lowercase label used in log lines and CLI options.
     *
     * @return label (e.g., "tested")
     */
    public String label() {
        return label;
    }
}
