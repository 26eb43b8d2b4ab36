package com.repocheck.core.audit;

import com.repocheck.core.model.CoveragePass;
import com.repocheck.core.model.Discrepancy;

import java.util.List;

/**
 * Raised when a coverage pass finds one or more discrepancies.
 *
 * <p>The message carries the count and the full itemized list.
 */
public class AuditFailedException extends RuntimeException {

    private final transient AuditReport report;

    public AuditFailedException(AuditReport report) {
        super(report.format());
        this.report = report;
    }

    public CoveragePass pass() {
        return report.pass();
    }

    public List<Discrepancy> discrepancies() {
        return report.discrepancies();
    }
}
