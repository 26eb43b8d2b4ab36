package com.repocheck.core.audit;

import com.repocheck.core.model.CoveragePass;
import com.repocheck.core.model.Discrepancy;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one coverage pass.
 *
 * @param pass the pass that produced the report
 * @param discrepancies every discrepancy found, in audit order
 */
public record AuditReport(
    CoveragePass pass,
    List<Discrepancy> discrepancies
) {
    /**
     * Compact constructor with validation.
     */
    public AuditReport {
        Objects.requireNonNull(pass, "pass must not be null");
        discrepancies = discrepancies != null ? List.copyOf(discrepancies) : List.of();
    }

    /**
     * Returns true if the pass found nothing to report.
     *
     * @return true if there are no discrepancies
     */
    public boolean isClean() {
        return discrepancies.isEmpty();
    }

    public int failureCount() {
        return discrepancies.size();
    }

    /**
     * Formats the itemized failure text: a count line followed by one line per discrepancy.
     *
     * @return failure text, or an empty string when clean
     */
    public String format() {
        if (isClean()) {
            return "";
        }
        StringBuilder text = new StringBuilder()
            .append("There were ").append(discrepancies.size()).append(" failures:");
        for (Discrepancy discrepancy : discrepancies) {
            text.append(System.lineSeparator()).append(discrepancy.message());
        }
        return text.toString();
    }

    /**
     * Fails if the pass found any discrepancy.
     *
     * @throws AuditFailedException if the report is not clean
     */
    public void orThrow() {
        if (!isClean()) {
            throw new AuditFailedException(this);
        }
    }
}
