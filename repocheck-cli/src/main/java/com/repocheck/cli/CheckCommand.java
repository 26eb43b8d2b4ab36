package com.repocheck.cli;

import com.repocheck.core.audit.AuditReport;
import com.repocheck.core.audit.RepoAudit;
import com.repocheck.core.config.AuditConfig;
import com.repocheck.core.config.ConfigLoader;
import com.repocheck.core.model.CoveragePass;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to check that all models are properly tested and documented.
 *
 * <p>Runs both coverage passes by default. Each pass either succeeds silently or prints
 * its itemized failure list; the command exits with:
 * <ul>
 *   <li>{@code 0} - every pass is clean</li>
 *   <li>{@code 1} - at least one pass found discrepancies</li>
 *   <li>{@code 2} - the audit could not run (unreadable library, corpus or file)</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Check the current directory
 * repocheck check
 *
 * # Check another checkout with a custom config
 * repocheck check /path/to/transformers -c ci/repocheck.yaml
 *
 * # Only the tested-coverage pass
 * repocheck check --pass tested
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check that all models are properly tested and documented",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: repocheck.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(
        names = {"-p", "--pass"},
        description = "Pass to run, repeatable: ${COMPLETION-CANDIDATES} (default: all)"
    )
    private List<CoveragePass> passes;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            log.info("Starting audit of: {}", projectPath.toAbsolutePath());
            AuditConfig config = AuditCommandSupport.loadConfiguration(projectPath, configPath);
            RepoAudit audit = RepoAudit.forProject(projectPath, config);

            Set<CoveragePass> selected = passes == null || passes.isEmpty()
                ? EnumSet.allOf(CoveragePass.class)
                : EnumSet.copyOf(passes);

            boolean failed = false;
            for (AuditReport report : audit.run(selected)) {
                if (report.isClean()) {
                    out.println("✓ All models are properly " + report.pass().label());
                } else {
                    failed = true;
                    err.println("✗ Models not properly " + report.pass().label());
                    err.println(report.format());
                    err.println();
                }
            }
            out.flush();
            err.flush();

            return failed ? AuditCommandSupport.EXIT_FAILURES : AuditCommandSupport.EXIT_OK;

        } catch (Exception e) {
            log.error("Audit failed to run", e);
            err.println("✗ Audit failed to run: " + e.getMessage());
            err.flush();
            return AuditCommandSupport.EXIT_ERROR;
        }
    }
}
