package com.repocheck.core.audit;

import com.repocheck.core.model.CoveragePass;
import com.repocheck.core.model.Discrepancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a pass's discrepancy list into its single success or failure signal.
 */
public class Reporter {

    private static final Logger log = LoggerFactory.getLogger(Reporter.class);

    /**
     * Aggregates the discrepancies of a pass into a report.
     *
     * @param pass the pass
     * @param discrepancies discrepancies collected by the pass
     * @return report
     */
    public AuditReport report(CoveragePass pass, List<Discrepancy> discrepancies) {
        AuditReport report = new AuditReport(pass, discrepancies);
        if (report.isClean()) {
            log.debug("All models are properly {}.", pass.label());
        } else {
            log.debug("{} pass found {} failures", pass.label(), report.failureCount());
        }
        return report;
    }

    /**
     * Aggregates the discrepancies of a pass and fails if there are any.
     *
     * @param pass the pass
     * @param discrepancies discrepancies collected by the pass
     * @throws AuditFailedException if the list is not empty
     */
    public void reportOrFail(CoveragePass pass, List<Discrepancy> discrepancies) {
        report(pass, discrepancies).orThrow();
    }
}
